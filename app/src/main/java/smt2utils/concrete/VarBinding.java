package smt2utils.concrete;

import java.util.Objects;
import smt2utils.model.Symbol;

/** {@code let} binding {@code (x term)}. */
public record VarBinding(Symbol symbol, Term term) {

  public VarBinding {
    Objects.requireNonNull(symbol, "symbol");
    Objects.requireNonNull(term, "term");
  }
}
