package smt2utils.concrete;

import java.util.Objects;
import smt2utils.model.Symbol;

/** Variable declaration {@code (x Int)} in binders and function signatures. */
public record SortedVar(Symbol symbol, Sort sort) {

  public SortedVar {
    Objects.requireNonNull(symbol, "symbol");
    Objects.requireNonNull(sort, "sort");
  }
}
