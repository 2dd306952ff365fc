package smt2utils.lexer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

final class LexerTest {

  @Test
  void tokenizesCommand() {
    List<TokenKind> kinds = kinds("(assert (> |x y| #b01 2.50 \"s\"))");
    assertEquals(
        List.of(
            TokenKind.LEFT_PAREN,
            TokenKind.SYMBOL,
            TokenKind.LEFT_PAREN,
            TokenKind.SYMBOL,
            TokenKind.SYMBOL,
            TokenKind.BINARY,
            TokenKind.DECIMAL,
            TokenKind.STRING,
            TokenKind.RIGHT_PAREN,
            TokenKind.RIGHT_PAREN),
        kinds,
        "Token kinds should follow the input");
  }

  @Test
  void skipsCommentsAndTracksPositions() {
    Lexer lexer = new Lexer("; header\n  (x");
    Token open = lexer.next();
    assertEquals(TokenKind.LEFT_PAREN, open.kind(), "Comment should be skipped");
    assertEquals(
        new Position(2, 3, 11), open.position(), "Position should count lines and columns");
    Token symbol = lexer.next();
    assertEquals("x", symbol.text(), "Symbol text should be kept");
    assertFalse(lexer.hasNext(), "Input should be exhausted");
  }

  @Test
  void distinguishesReservedWordsFromQuotedSymbols() {
    Lexer lexer = new Lexer("let |let| :named");
    assertEquals(TokenKind.RESERVED, lexer.next().kind(), "Bare let is reserved");
    assertEquals(TokenKind.SYMBOL, lexer.next().kind(), "Quoted let is an ordinary symbol");
    Token keyword = lexer.next();
    assertEquals(TokenKind.KEYWORD, keyword.kind(), "Colon starts a keyword");
    assertEquals(":named", keyword.text(), "Keyword text should include the colon");
  }

  @Test
  void keepsDoubledQuotesInsideStrings() {
    Lexer lexer = new Lexer("\"say \"\"hi\"\"\" x");
    Token string = lexer.next();
    assertEquals(TokenKind.STRING, string.kind(), "Doubled quotes do not end the string");
    assertEquals("\"say \"\"hi\"\"\"", string.text(), "String lexeme should be verbatim");
    assertEquals("x", lexer.next().text(), "Lexing should continue after the string");
  }

  @Test
  void rejectsMalformedNumerals() {
    LexException error = assertThrows(LexException.class, () -> new Lexer("12abc").next());
    assertEquals(new Position(1, 1, 0), error.position(), "Error should point at the numeral");
    assertEquals(5, error.endOffset(), "Error span should cover the trailing symbol characters");
    assertThrows(LexException.class, () -> new Lexer("2.").next(), "Fraction digits required");
    assertThrows(LexException.class, () -> new Lexer("#b").next(), "Radix digits required");
    assertThrows(LexException.class, () -> new Lexer("\"open").next(), "Unterminated string");
    assertThrows(LexException.class, () -> new Lexer("|open").next(), "Unterminated symbol");
  }

  @Test
  void rejectsBackslashInQuotedSymbol() {
    Lexer lexer = new Lexer("|a\\b| ok");
    LexException error = assertThrows(LexException.class, lexer::next);
    assertEquals(5, error.endOffset(), "Error span should end at the closing bar");
    lexer.skipPast(error);
    assertEquals("ok", lexer.next().text(), "Lexing resumes after the quoted symbol");
  }

  @Test
  void failedTokenFailsAgainUntilSkipped() {
    Lexer lexer = new Lexer("#z foo");
    LexException first = assertThrows(LexException.class, lexer::next);
    assertThrows(LexException.class, lexer::next, "The lexer must not move past the error");
    lexer.skipPast(first);
    Token next = lexer.next();
    assertEquals("foo", next.text(), "Skipping should resume after the malformed token");
  }

  @Test
  void resetReturnsToCheckpoint() {
    Lexer lexer = new Lexer("(a b)");
    lexer.next();
    Position mark = lexer.checkpoint();
    assertEquals("a", lexer.next().text(), "First symbol after the parenthesis");
    lexer.reset(mark);
    assertEquals("a", lexer.next().text(), "Reset should replay the same token");
    assertThrows(
        IllegalArgumentException.class,
        () -> lexer.reset(new Position(1, 1, 99)),
        "Checkpoints past the input are rejected");
  }

  @Test
  void recognizesSymbolCharacters() {
    assertTrue(Lexer.isSymbolChar('@'), "@ is a symbol character");
    assertTrue(Lexer.isSymbolChar('.'), ". is a symbol character");
    assertFalse(Lexer.isSymbolChar('|'), "| delimits quoted symbols");
    assertFalse(Lexer.isSymbolChar('#'), "# starts radix literals");
  }

  private static List<TokenKind> kinds(String input) {
    List<TokenKind> kinds = new ArrayList<>();
    Lexer lexer = new Lexer(input);
    while (lexer.hasNext()) {
      kinds.add(lexer.next().kind());
    }
    return kinds;
  }
}
