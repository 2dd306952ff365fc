package smt2utils.sexpr;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import smt2utils.SyntaxException;
import smt2utils.lexer.LexException;
import smt2utils.lexer.Lexer;
import smt2utils.lexer.Position;
import smt2utils.lexer.Token;
import smt2utils.lexer.TokenKind;
import smt2utils.model.Keyword;
import smt2utils.model.NumeralLiteral;
import smt2utils.model.StringLiteral;
import smt2utils.model.SymbolTable;

/**
 * Shift-reduce reader that assembles one top-level S-expression per call.
 *
 * <p>An opening parenthesis shifts a new frame, atoms are appended to the top frame and a closing
 * parenthesis reduces the top frame to a {@link SExpr.ListExpr}. The stack is explicit, so
 * nesting depth is bounded by memory rather than by the call stack.
 */
public final class SExprReader {
  private static final Logger LOG = LoggerFactory.getLogger(SExprReader.class);

  private final Lexer lexer;
  private final SymbolTable symbols;
  private final Deque<Frame> stack = new ArrayDeque<>();
  private int abandonedDepth;

  public SExprReader(Lexer lexer, SymbolTable symbols) {
    this.lexer = Objects.requireNonNull(lexer, "lexer");
    this.symbols = Objects.requireNonNull(symbols, "symbols");
  }

  /**
   * Reads the next top-level form, or returns empty at end of input.
   *
   * @throws LexException when a token inside the form is malformed
   * @throws SyntaxException on an unmatched {@code )} or when input ends inside a form
   */
  public Optional<SExpr> read() {
    stack.clear();
    abandonedDepth = 0;
    while (true) {
      if (!lexer.hasNext()) {
        if (stack.isEmpty()) {
          return Optional.empty();
        }
        Position open = stack.peek().position;
        stack.clear();
        throw new SyntaxException(
            "')' closing the list opened at " + open, "end of input", lexer.checkpoint());
      }
      Token token;
      try {
        token = lexer.next();
      } catch (LexException ex) {
        abandonedDepth = stack.size();
        stack.clear();
        throw ex;
      }
      SExpr completed;
      switch (token.kind()) {
        case LEFT_PAREN -> {
          stack.push(new Frame(token.position()));
          continue;
        }
        case RIGHT_PAREN -> {
          if (stack.isEmpty()) {
            throw new SyntaxException("'(' or an atom", "')'", token.position());
          }
          Frame frame = stack.pop();
          completed = new SExpr.ListExpr(frame.items, frame.position);
        }
        default -> completed = atom(token);
      }
      if (stack.isEmpty()) {
        return Optional.of(completed);
      }
      stack.peek().items.add(completed);
    }
  }

  /**
   * Skips the remainder of a form abandoned by a lexical error, up to and including the
   * parenthesis that closes it. Malformed tokens met on the way are skipped as well.
   *
   * @return number of tokens skipped
   */
  public int recover(LexException cause) {
    if (cause != null) {
      lexer.skipPast(cause);
    }
    int depth = abandonedDepth;
    abandonedDepth = 0;
    int skipped = 0;
    while (depth > 0 && lexer.hasNext()) {
      Token token;
      try {
        token = lexer.next();
      } catch (LexException ex) {
        lexer.skipPast(ex);
        skipped++;
        continue;
      }
      skipped++;
      if (token.kind() == TokenKind.LEFT_PAREN) {
        depth++;
      } else if (token.kind() == TokenKind.RIGHT_PAREN) {
        depth--;
      }
    }
    LOG.debug("Skipped {} tokens while resynchronizing at {}", skipped, lexer.checkpoint());
    return skipped;
  }

  public Lexer lexer() {
    return lexer;
  }

  private SExpr atom(Token token) {
    return switch (token.kind()) {
      case SYMBOL, RESERVED -> new SExpr.SymbolAtom(symbols.intern(token.text()), token.position());
      case KEYWORD -> new SExpr.KeywordAtom(Keyword.fromLexeme(token.text()), token.position());
      case STRING ->
          new SExpr.ConstantAtom(StringLiteral.fromLexeme(token.text()), token.position());
      case NUMERAL, DECIMAL, HEXADECIMAL, BINARY ->
          new SExpr.ConstantAtom(NumeralLiteral.parse(token.text()), token.position());
      default -> throw new IllegalStateException("Not an atom: " + token);
    };
  }

  private static final class Frame {
    private final Position position;
    private final List<SExpr> items = new ArrayList<>();

    private Frame(Position position) {
      this.position = position;
    }
  }
}
