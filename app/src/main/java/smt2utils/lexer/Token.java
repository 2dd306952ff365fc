package smt2utils.lexer;

import java.util.Objects;

/**
 * Immutable lexical token. {@code text} is the raw lexeme exactly as it appears in the input,
 * spanning {@code [position.offset(), endOffset)}.
 */
public record Token(TokenKind kind, String text, Position position, int endOffset) {

  public Token {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(text, "text");
    Objects.requireNonNull(position, "position");
    if (endOffset < position.offset()) {
      throw new IllegalArgumentException("Token ends before it starts: " + text);
    }
  }

  public boolean is(TokenKind expected) {
    return kind == expected;
  }

  @Override
  public String toString() {
    return kind + "(" + text + ")@" + position;
  }
}
