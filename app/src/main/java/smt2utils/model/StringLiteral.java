package smt2utils.model;

import java.util.Objects;

/** String constant. {@code value} is the decoded content; doubled quotes are undone. */
public record StringLiteral(String value) implements Constant {

  public StringLiteral {
    Objects.requireNonNull(value, "value");
  }

  public static StringLiteral fromLexeme(String lexeme) {
    if (lexeme == null
        || lexeme.length() < 2
        || !lexeme.startsWith("\"")
        || !lexeme.endsWith("\"")) {
      throw new IllegalArgumentException("Not a string literal: " + lexeme);
    }
    return new StringLiteral(lexeme.substring(1, lexeme.length() - 1).replace("\"\"", "\""));
  }

  @Override
  public String lexeme() {
    return "\"" + value.replace("\"", "\"\"") + "\"";
  }

  @Override
  public String toString() {
    return lexeme();
  }
}
