package smt2utils.concrete;

import java.util.Objects;
import smt2utils.model.NumeralLiteral;
import smt2utils.model.Symbol;

/** {@code (T 0)} entry of {@code declare-datatypes}. */
public record SortDec(Symbol symbol, NumeralLiteral arity) {

  public SortDec {
    Objects.requireNonNull(symbol, "symbol");
    Objects.requireNonNull(arity, "arity");
  }
}
