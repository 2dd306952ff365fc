package smt2utils.vmt;

import java.util.Objects;
import smt2utils.concrete.Command;
import smt2utils.model.Symbol;

/** Input variable chosen freely at every step. */
public record Action(Command.DeclareFun declaration) {

  public Action {
    Objects.requireNonNull(declaration, "declaration");
  }

  public Symbol name() {
    return declaration.symbol();
  }
}
