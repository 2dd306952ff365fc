package smt2utils.concrete;

import java.util.List;
import java.util.Objects;
import smt2utils.model.Symbol;

/**
 * Datatype declaration body: constructors, optionally under {@code (par (X ...) ...)} sort
 * parameters.
 */
public record DatatypeDec(List<Symbol> parameters, List<ConstructorDec> constructors) {

  public DatatypeDec {
    parameters = parameters == null ? List.of() : List.copyOf(parameters);
    constructors = List.copyOf(Objects.requireNonNull(constructors, "constructors"));
    if (constructors.isEmpty()) {
      throw new IllegalArgumentException("A datatype needs at least one constructor");
    }
  }

  public boolean isParametric() {
    return !parameters.isEmpty();
  }

  /** Constructor {@code (cons (head Int) (tail List))}. */
  public record ConstructorDec(Symbol symbol, List<SelectorDec> selectors) {
    public ConstructorDec {
      Objects.requireNonNull(symbol, "symbol");
      selectors = selectors == null ? List.of() : List.copyOf(selectors);
    }
  }

  /** Selector {@code (head Int)}. */
  public record SelectorDec(Symbol symbol, Sort sort) {
    public SelectorDec {
      Objects.requireNonNull(symbol, "symbol");
      Objects.requireNonNull(sort, "sort");
    }
  }
}
