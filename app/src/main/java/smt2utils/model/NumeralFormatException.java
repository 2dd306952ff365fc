package smt2utils.model;

import smt2utils.Smt2Exception;

/** Numeric lexeme whose digits do not match its radix or form. */
public final class NumeralFormatException extends Smt2Exception {
  private final String lexeme;

  public NumeralFormatException(String message, String lexeme) {
    super(message + ": '" + lexeme + "'", null);
    this.lexeme = lexeme;
  }

  public String lexeme() {
    return lexeme;
  }
}
