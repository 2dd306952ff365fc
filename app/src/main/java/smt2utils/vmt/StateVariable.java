package smt2utils.vmt;

import java.util.Objects;
import smt2utils.concrete.Command;
import smt2utils.model.Symbol;

/**
 * State variable of a transition system: the declaration of its current value and of the
 * variable that names its value in the next state.
 */
public record StateVariable(Command.DeclareFun current, Command.DeclareFun next) {

  public StateVariable {
    Objects.requireNonNull(current, "current");
    Objects.requireNonNull(next, "next");
  }

  public Symbol currentName() {
    return current.symbol();
  }

  public Symbol nextName() {
    return next.symbol();
  }
}
