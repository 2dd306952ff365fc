package smt2utils;

import smt2utils.lexer.Position;

/**
 * Base type for failures on the SMT-LIB-2 path. Each failure is local to the current token or
 * top-level form; the caller decides whether to stop or continue with the next form.
 */
public class Smt2Exception extends RuntimeException {
  private final Position position;

  public Smt2Exception(String message, Position position) {
    super(position == null ? message : message + " at " + position);
    this.position = position;
  }

  /** Source position of the failure, or {@code null} when the input had no location. */
  public Position position() {
    return position;
  }
}
