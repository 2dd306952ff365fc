package smt2utils.model;

import java.util.Objects;
import smt2utils.lexer.Lexer;

/**
 * Identifier shared by SMT-LIB-2 syntax and trace-log term tags.
 *
 * <p>Equality and hashing use the name only: {@code |x|} and {@code x} denote the same symbol.
 * Whether the symbol was written between bars is lexical form, kept so that a printer can
 * reproduce the input.
 *
 * <p>Names may not contain {@code |} or {@code \}: those characters cannot appear in any
 * SMT-LIB-2 symbol, quoted or not.
 */
public final class Symbol implements Comparable<Symbol> {
  private final String name;
  private final boolean quoted;

  public Symbol(String name, boolean quoted) {
    this.name = Objects.requireNonNull(name, "name");
    if (!isQuotable(name)) {
      throw new IllegalArgumentException("Symbol name contains '|' or '\\': " + name);
    }
    this.quoted = quoted;
  }

  /** Whether {@code name} can be written as a symbol, between bars if need be. */
  public static boolean isQuotable(String name) {
    return name.indexOf('|') < 0 && name.indexOf('\\') < 0;
  }

  /**
   * Builds a symbol from its lexeme, stripping the bars of a quoted symbol.
   *
   * @throws IllegalArgumentException when the name has a {@code |} or {@code \} inside
   */
  public static Symbol fromLexeme(String lexeme) {
    Objects.requireNonNull(lexeme, "lexeme");
    if (lexeme.length() >= 2 && lexeme.startsWith("|") && lexeme.endsWith("|")) {
      return new Symbol(lexeme.substring(1, lexeme.length() - 1), true);
    }
    return new Symbol(lexeme, false);
  }

  public static Symbol of(String name) {
    return new Symbol(name, false);
  }

  public String name() {
    return name;
  }

  public boolean quoted() {
    return quoted;
  }

  public boolean isReserved() {
    return !quoted && Lexer.isReservedWord(name);
  }

  /** Lexeme to emit: the original bars are kept, and added when the name needs them. */
  public String lexeme() {
    if (quoted || !isSimple(name)) {
      return "|" + name + "|";
    }
    return name;
  }

  /** Symbol with a new name and the same quoting. */
  public Symbol withName(String newName) {
    return new Symbol(newName, quoted);
  }

  static boolean isSimple(String text) {
    if (text.isEmpty() || Character.isDigit(text.charAt(0))) {
      return false;
    }
    for (int i = 0; i < text.length(); i++) {
      if (!Lexer.isSymbolChar(text.charAt(i))) {
        return false;
      }
    }
    return true;
  }

  @Override
  public int compareTo(Symbol other) {
    return name.compareTo(other.name);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Symbol other)) {
      return false;
    }
    return name.equals(other.name);
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public String toString() {
    return lexeme();
  }
}
