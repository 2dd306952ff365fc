package smt2utils.model;

import java.util.Objects;

/** SMT-LIB-2 keyword such as {@code :named}; {@code name} excludes the leading colon. */
public record Keyword(String name) {

  public Keyword {
    Objects.requireNonNull(name, "name");
    if (name.isEmpty()) {
      throw new IllegalArgumentException("Keyword name must not be empty");
    }
  }

  public static Keyword fromLexeme(String lexeme) {
    if (lexeme == null || !lexeme.startsWith(":")) {
      throw new IllegalArgumentException("Not a keyword: " + lexeme);
    }
    return new Keyword(lexeme.substring(1));
  }

  public String lexeme() {
    return ":" + name;
  }

  @Override
  public String toString() {
    return lexeme();
  }
}
