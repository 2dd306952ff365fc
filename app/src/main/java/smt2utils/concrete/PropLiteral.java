package smt2utils.concrete;

import java.util.Objects;
import smt2utils.model.Symbol;

/** Assumption of {@code check-sat-assuming}: {@code p} or {@code (not p)}. */
public record PropLiteral(Symbol symbol, boolean negated) {

  public PropLiteral {
    Objects.requireNonNull(symbol, "symbol");
  }
}
