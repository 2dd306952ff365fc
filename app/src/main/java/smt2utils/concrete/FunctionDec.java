package smt2utils.concrete;

import java.util.List;
import java.util.Objects;
import smt2utils.model.Symbol;

/** Function signature {@code f ((x Int) (y Int)) Bool} used by the define-fun family. */
public record FunctionDec(Symbol name, List<SortedVar> parameters, Sort result) {

  public FunctionDec {
    Objects.requireNonNull(name, "name");
    parameters = parameters == null ? List.of() : List.copyOf(parameters);
    Objects.requireNonNull(result, "result");
  }
}
