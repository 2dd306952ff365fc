package smt2utils.concrete;

import java.util.Objects;
import smt2utils.model.Symbol;

/** Identifier optionally qualified by {@code (as identifier sort)}; {@code sort} may be null. */
public record QualIdentifier(Identifier identifier, Sort sort) {

  public QualIdentifier {
    Objects.requireNonNull(identifier, "identifier");
  }

  public static QualIdentifier simple(Symbol symbol) {
    return new QualIdentifier(Identifier.simple(symbol), null);
  }

  public boolean isQualified() {
    return sort != null;
  }

  public Symbol symbol() {
    return identifier.symbol();
  }
}
