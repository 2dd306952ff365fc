package smt2utils.lexer;

import com.google.common.io.CharStreams;
import java.io.IOException;
import java.io.Reader;
import java.util.Iterator;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;

/**
 * Lazy SMT-LIB-2 tokenizer.
 *
 * <p>Whitespace and {@code ;} line comments are skipped. Every other character either starts a
 * token or fails with a {@link LexException}; the lexer never guesses. A failed {@link #next()}
 * leaves the lexer at the start of the offending token, so the same call fails again until the
 * caller decides to {@link #skipPast(LexException) skip} it.
 *
 * <p>The lexer is restartable: {@link #checkpoint()} captures the current position and {@link
 * #reset(Position)} returns to it.
 */
public final class Lexer implements Iterator<Token> {
  private static final String SYMBOL_PUNCTUATION = "~!@$%^&*_-+=<>.?/";

  /** Reserved words that may not be used as plain (unquoted) symbols inside terms. */
  public static final Set<String> RESERVED_WORDS =
      Set.of(
          "!", "_", "as", "let", "exists", "forall", "match", "par", "BINARY", "DECIMAL",
          "HEXADECIMAL", "NUMERAL", "STRING");

  private final CharSequence input;
  private int offset;
  private int line = 1;
  private int column = 1;

  public Lexer(CharSequence input) {
    this.input = Objects.requireNonNull(input, "input");
  }

  /** Drains {@code reader} into memory. The reader stays owned (and open) by the caller. */
  public static Lexer of(Reader reader) throws IOException {
    return new Lexer(CharStreams.toString(reader));
  }

  public static boolean isReservedWord(String text) {
    return RESERVED_WORDS.contains(text);
  }

  public Position checkpoint() {
    return new Position(line, column, offset);
  }

  public void reset(Position checkpoint) {
    Objects.requireNonNull(checkpoint, "checkpoint");
    if (checkpoint.offset() > input.length()) {
      throw new IllegalArgumentException("Checkpoint beyond end of input: " + checkpoint);
    }
    offset = checkpoint.offset();
    line = checkpoint.line();
    column = checkpoint.column();
  }

  /** Moves past the span of a lexical error raised by this lexer. */
  public void skipPast(LexException error) {
    int end = Math.min(error.endOffset(), input.length());
    if (end > offset) {
      advanceTo(end);
    }
  }

  @Override
  public boolean hasNext() {
    skipTrivia();
    return offset < input.length();
  }

  @Override
  public Token next() {
    if (!hasNext()) {
      throw new NoSuchElementException("End of input at " + checkpoint());
    }
    Position start = checkpoint();
    char c = input.charAt(offset);
    Token token;
    if (c == '(') {
      token = token(TokenKind.LEFT_PAREN, start, offset + 1);
    } else if (c == ')') {
      token = token(TokenKind.RIGHT_PAREN, start, offset + 1);
    } else if (c == '"') {
      token = token(TokenKind.STRING, start, scanString(start));
    } else if (c == '|') {
      token = token(TokenKind.SYMBOL, start, scanQuotedSymbol(start));
    } else if (c == ':') {
      token = token(TokenKind.KEYWORD, start, scanKeyword(start));
    } else if (c == '#') {
      token = scanRadixLiteral(start);
    } else if (isDigit(c)) {
      token = scanNumber(start);
    } else if (isSymbolChar(c)) {
      int end = scanWhile(offset, Lexer::isSymbolChar);
      String text = input.subSequence(offset, end).toString();
      token =
          new Token(isReservedWord(text) ? TokenKind.RESERVED : TokenKind.SYMBOL, text, start, end);
    } else {
      throw new LexException("Unexpected character '" + c + "'", start, offset + 1);
    }
    advanceTo(token.endOffset());
    return token;
  }

  private Token token(TokenKind kind, Position start, int end) {
    return new Token(kind, input.subSequence(start.offset(), end).toString(), start, end);
  }

  private int scanString(Position start) {
    int i = offset + 1;
    while (i < input.length()) {
      if (input.charAt(i) == '"') {
        if (i + 1 < input.length() && input.charAt(i + 1) == '"') {
          i += 2;
          continue;
        }
        return i + 1;
      }
      i++;
    }
    throw new LexException("Unterminated string literal", start, input.length());
  }

  private int scanQuotedSymbol(Position start) {
    int backslash = -1;
    for (int i = offset + 1; i < input.length(); i++) {
      char c = input.charAt(i);
      if (c == '\\' && backslash < 0) {
        backslash = i;
      } else if (c == '|') {
        if (backslash >= 0) {
          throw new LexException("Backslash in quoted symbol", start, i + 1);
        }
        return i + 1;
      }
    }
    throw new LexException("Unterminated quoted symbol", start, input.length());
  }

  private int scanKeyword(Position start) {
    int end = scanWhile(offset + 1, Lexer::isSymbolChar);
    if (end == offset + 1) {
      throw new LexException("Empty keyword", start, end);
    }
    return end;
  }

  private Token scanRadixLiteral(Position start) {
    char radix = offset + 1 < input.length() ? input.charAt(offset + 1) : '\0';
    TokenKind kind;
    int end;
    if (radix == 'b') {
      kind = TokenKind.BINARY;
      end = scanWhile(offset + 2, ch -> ch == '0' || ch == '1');
    } else if (radix == 'x') {
      kind = TokenKind.HEXADECIMAL;
      end = scanWhile(offset + 2, Lexer::isHexDigit);
    } else {
      throw new LexException(
          "Malformed numeral radix prefix", start, Math.min(offset + 2, input.length()));
    }
    if (end == offset + 2) {
      throw new LexException("Missing digits after radix prefix", start, end);
    }
    rejectTrailingSymbolChars(start, end, kind);
    return token(kind, start, end);
  }

  private Token scanNumber(Position start) {
    int end = scanWhile(offset, Lexer::isDigit);
    TokenKind kind = TokenKind.NUMERAL;
    if (end < input.length() && input.charAt(end) == '.') {
      int fractionEnd = scanWhile(end + 1, Lexer::isDigit);
      if (fractionEnd == end + 1) {
        throw new LexException("Decimal without fraction digits", start, fractionEnd);
      }
      kind = TokenKind.DECIMAL;
      end = fractionEnd;
    }
    rejectTrailingSymbolChars(start, end, kind);
    return token(kind, start, end);
  }

  private void rejectTrailingSymbolChars(Position start, int end, TokenKind kind) {
    if (end < input.length() && isSymbolChar(input.charAt(end))) {
      int badEnd = scanWhile(end, Lexer::isSymbolChar);
      throw new LexException(
          "Malformed " + kind.name().toLowerCase(Locale.ROOT) + " literal '"
              + input.subSequence(start.offset(), badEnd) + "'",
          start,
          badEnd);
    }
  }

  private int scanWhile(int from, CharPredicate predicate) {
    int i = from;
    while (i < input.length() && predicate.test(input.charAt(i))) {
      i++;
    }
    return i;
  }

  private void skipTrivia() {
    int i = offset;
    while (i < input.length()) {
      char c = input.charAt(i);
      if (c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f') {
        i++;
      } else if (c == ';') {
        while (i < input.length() && input.charAt(i) != '\n') {
          i++;
        }
      } else {
        break;
      }
    }
    if (i > offset) {
      advanceTo(i);
    }
  }

  private void advanceTo(int end) {
    for (int i = offset; i < end; i++) {
      if (input.charAt(i) == '\n') {
        line++;
        column = 1;
      } else {
        column++;
      }
    }
    offset = end;
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private static boolean isHexDigit(char c) {
    return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
  }

  public static boolean isSymbolChar(char c) {
    return (c >= 'a' && c <= 'z')
        || (c >= 'A' && c <= 'Z')
        || isDigit(c)
        || SYMBOL_PUNCTUATION.indexOf(c) >= 0;
  }

  @FunctionalInterface
  private interface CharPredicate {
    boolean test(char c);
  }
}
