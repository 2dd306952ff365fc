package smt2utils.lexer;

import smt2utils.Smt2Exception;

/** Malformed token. The span {@code [position.offset(), endOffset)} covers the offending text. */
public final class LexException extends Smt2Exception {
  private final int endOffset;

  public LexException(String message, Position position, int endOffset) {
    super(message, position);
    this.endOffset = endOffset;
  }

  public int endOffset() {
    return endOffset;
  }
}
