package smt2utils;

import smt2utils.lexer.Position;

/** Grammar violation: the input had {@code found} where {@code expected} was required. */
public final class SyntaxException extends Smt2Exception {
  private final String expected;
  private final String found;

  public SyntaxException(String expected, String found, Position position) {
    super("Expected " + expected + " but found " + found, position);
    this.expected = expected;
    this.found = found;
  }

  public String expected() {
    return expected;
  }

  public String found() {
    return found;
  }
}
