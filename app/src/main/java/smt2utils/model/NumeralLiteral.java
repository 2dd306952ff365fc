package smt2utils.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;

/**
 * Exact numeric literal together with the lexeme it was read from.
 *
 * <p>The value and its lexical form travel together: printing always reproduces {@link
 * #lexeme()}, so {@code #x00FF} never turns into {@code 255}. Consumers that only need the number
 * call {@link #value()} and thereby drop the form explicitly.
 */
public final class NumeralLiteral implements Constant {

  /** Lexical form of a numeric literal. */
  public enum Form {
    NUMERAL,
    DECIMAL,
    HEXADECIMAL,
    BINARY,
    RATIONAL
  }

  private final Form form;
  private final String lexeme;
  private final Rational value;

  private NumeralLiteral(Form form, String lexeme, Rational value) {
    this.form = form;
    this.lexeme = lexeme;
    this.value = value;
  }

  /**
   * Parses decimal integers ({@code 42}), decimals ({@code 4.20}), binary ({@code #b1010}),
   * hexadecimal ({@code #x2A}) and rationals ({@code 21/50}).
   *
   * @throws NumeralFormatException when the digits do not match the form
   */
  public static NumeralLiteral parse(String lexeme) {
    Objects.requireNonNull(lexeme, "lexeme");
    if (lexeme.isEmpty()) {
      throw new NumeralFormatException("Empty numeral", lexeme);
    }
    if (lexeme.startsWith("#b")) {
      String digits = requireDigits(lexeme, 2, 2);
      return new NumeralLiteral(Form.BINARY, lexeme, Rational.of(new BigInteger(digits, 2)));
    }
    if (lexeme.startsWith("#x")) {
      String digits = requireDigits(lexeme, 2, 16);
      return new NumeralLiteral(Form.HEXADECIMAL, lexeme, Rational.of(new BigInteger(digits, 16)));
    }
    if (lexeme.startsWith("#")) {
      throw new NumeralFormatException("Unknown radix prefix", lexeme);
    }
    int slash = lexeme.indexOf('/');
    if (slash >= 0) {
      BigInteger numerator = new BigInteger(requireDecimalDigits(lexeme, 0, slash));
      BigInteger denominator =
          new BigInteger(requireDecimalDigits(lexeme, slash + 1, lexeme.length()));
      if (denominator.signum() == 0) {
        throw new NumeralFormatException("Zero denominator", lexeme);
      }
      return new NumeralLiteral(Form.RATIONAL, lexeme, Rational.of(numerator, denominator));
    }
    int dot = lexeme.indexOf('.');
    if (dot >= 0) {
      requireDecimalDigits(lexeme, 0, dot);
      requireDecimalDigits(lexeme, dot + 1, lexeme.length());
      return new NumeralLiteral(Form.DECIMAL, lexeme, Rational.of(new BigDecimal(lexeme)));
    }
    String digits = requireDecimalDigits(lexeme, 0, lexeme.length());
    return new NumeralLiteral(Form.NUMERAL, lexeme, Rational.of(new BigInteger(digits)));
  }

  public static NumeralLiteral of(long value) {
    return of(BigInteger.valueOf(value));
  }

  public static NumeralLiteral of(BigInteger value) {
    if (value.signum() < 0) {
      throw new IllegalArgumentException("SMT-LIB-2 numerals are non-negative: " + value);
    }
    return new NumeralLiteral(Form.NUMERAL, value.toString(), Rational.of(value));
  }

  private static String requireDigits(String lexeme, int from, int radix) {
    if (from >= lexeme.length()) {
      throw new NumeralFormatException("Missing digits", lexeme);
    }
    for (int i = from; i < lexeme.length(); i++) {
      char c = lexeme.charAt(i);
      if (c > 'f' || Character.digit(c, radix) < 0) {
        throw new NumeralFormatException("Digit not valid in radix " + radix, lexeme);
      }
    }
    return lexeme.substring(from);
  }

  private static String requireDecimalDigits(String lexeme, int from, int to) {
    if (from >= to) {
      throw new NumeralFormatException("Missing digits", lexeme);
    }
    for (int i = from; i < to; i++) {
      char c = lexeme.charAt(i);
      if (c < '0' || c > '9') {
        throw new NumeralFormatException("Invalid decimal digit", lexeme);
      }
    }
    return lexeme.substring(from, to);
  }

  public Form form() {
    return form;
  }

  @Override
  public String lexeme() {
    return lexeme;
  }

  /** Exact numeric value, without the lexical form. */
  public Rational value() {
    return value;
  }

  /** Integral value of a numeral, binary or hexadecimal literal. */
  public BigInteger bigIntegerValue() {
    return value.toBigIntegerExact();
  }

  /** Number of digits written after the prefix (or in total for decimal forms). */
  public int digitCount() {
    return switch (form) {
      case BINARY, HEXADECIMAL -> lexeme.length() - 2;
      case NUMERAL -> lexeme.length();
      case DECIMAL, RATIONAL -> lexeme.length() - 1;
    };
  }

  /** Bit width implied by a binary or hexadecimal literal; {@code -1} for other forms. */
  public int bitWidth() {
    return switch (form) {
      case BINARY -> digitCount();
      case HEXADECIMAL -> digitCount() * 4;
      default -> -1;
    };
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof NumeralLiteral other)) {
      return false;
    }
    return form == other.form && lexeme.equals(other.lexeme);
  }

  @Override
  public int hashCode() {
    return Objects.hash(form, lexeme);
  }

  @Override
  public String toString() {
    return lexeme;
  }
}
