package smt2utils.lexer;

/** Lexical categories of SMT-LIB-2 tokens. */
public enum TokenKind {
  LEFT_PAREN,
  RIGHT_PAREN,
  SYMBOL,
  RESERVED,
  KEYWORD,
  NUMERAL,
  DECIMAL,
  HEXADECIMAL,
  BINARY,
  STRING;

  public boolean isConstant() {
    return this == NUMERAL
        || this == DECIMAL
        || this == HEXADECIMAL
        || this == BINARY
        || this == STRING;
  }
}
