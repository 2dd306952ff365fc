package smt2utils.concrete;

import java.util.List;
import java.util.Objects;
import smt2utils.model.Symbol;

/** Sort expression: an identifier applied to zero or more parameter sorts. */
public record Sort(Identifier identifier, List<Sort> parameters) {

  public Sort {
    Objects.requireNonNull(identifier, "identifier");
    parameters = parameters == null ? List.of() : List.copyOf(parameters);
  }

  public static Sort simple(Symbol symbol) {
    return new Sort(Identifier.simple(symbol), List.of());
  }

  public boolean isParameterized() {
    return !parameters.isEmpty();
  }
}
