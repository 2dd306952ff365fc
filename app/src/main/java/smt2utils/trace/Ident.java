package smt2utils.trace;

import java.util.Objects;

/**
 * Raw term identifier of the trace log, written {@code #12} or {@code ns#12}. The empty
 * namespace is the default one.
 */
public record Ident(String namespace, long number) {

  public Ident {
    Objects.requireNonNull(namespace, "namespace");
    if (number < 0) {
      throw new IllegalArgumentException("Negative term number: " + number);
    }
  }

  public static Ident of(long number) {
    return new Ident("", number);
  }

  /**
   * Parses {@code ns#n}.
   *
   * @throws IllegalArgumentException when {@code text} is not an identifier
   */
  public static Ident parse(String text) {
    int hash = text.indexOf('#');
    if (hash < 0 || hash == text.length() - 1) {
      throw new IllegalArgumentException("Not a term identifier: '" + text + "'");
    }
    long number;
    try {
      number = Long.parseLong(text.substring(hash + 1));
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Not a term identifier: '" + text + "'", ex);
    }
    return new Ident(text.substring(0, hash), number);
  }

  @Override
  public String toString() {
    return namespace + "#" + number;
  }
}
