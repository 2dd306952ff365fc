package smt2utils.concrete;

/**
 * Receives decoded commands, one call per command, in input order.
 *
 * <p>Every method defaults to {@link #visitDefault(Command)}, which does nothing, so a consumer
 * overrides only the commands it cares about, or {@code visitDefault} to see all of them.
 */
public interface CommandVisitor {

  /** Fallback for every command kind the visitor does not override. */
  default void visitDefault(Command command) {}

  default void visitAssert(Command.Assert command) {
    visitDefault(command);
  }

  default void visitCheckSat(Command.CheckSat command) {
    visitDefault(command);
  }

  default void visitCheckSatAssuming(Command.CheckSatAssuming command) {
    visitDefault(command);
  }

  default void visitDeclareConst(Command.DeclareConst command) {
    visitDefault(command);
  }

  default void visitDeclareDatatype(Command.DeclareDatatype command) {
    visitDefault(command);
  }

  default void visitDeclareDatatypes(Command.DeclareDatatypes command) {
    visitDefault(command);
  }

  default void visitDeclareFun(Command.DeclareFun command) {
    visitDefault(command);
  }

  default void visitDeclareSort(Command.DeclareSort command) {
    visitDefault(command);
  }

  default void visitDefineFun(Command.DefineFun command) {
    visitDefault(command);
  }

  default void visitDefineFunRec(Command.DefineFunRec command) {
    visitDefault(command);
  }

  default void visitDefineFunsRec(Command.DefineFunsRec command) {
    visitDefault(command);
  }

  default void visitDefineSort(Command.DefineSort command) {
    visitDefault(command);
  }

  default void visitEcho(Command.Echo command) {
    visitDefault(command);
  }

  default void visitExit(Command.Exit command) {
    visitDefault(command);
  }

  default void visitGetAssertions(Command.GetAssertions command) {
    visitDefault(command);
  }

  default void visitGetAssignment(Command.GetAssignment command) {
    visitDefault(command);
  }

  default void visitGetInfo(Command.GetInfo command) {
    visitDefault(command);
  }

  default void visitGetModel(Command.GetModel command) {
    visitDefault(command);
  }

  default void visitGetOption(Command.GetOption command) {
    visitDefault(command);
  }

  default void visitGetProof(Command.GetProof command) {
    visitDefault(command);
  }

  default void visitGetUnsatAssumptions(Command.GetUnsatAssumptions command) {
    visitDefault(command);
  }

  default void visitGetUnsatCore(Command.GetUnsatCore command) {
    visitDefault(command);
  }

  default void visitGetValue(Command.GetValue command) {
    visitDefault(command);
  }

  default void visitPop(Command.Pop command) {
    visitDefault(command);
  }

  default void visitPush(Command.Push command) {
    visitDefault(command);
  }

  default void visitReset(Command.Reset command) {
    visitDefault(command);
  }

  default void visitResetAssertions(Command.ResetAssertions command) {
    visitDefault(command);
  }

  default void visitSetInfo(Command.SetInfo command) {
    visitDefault(command);
  }

  default void visitSetLogic(Command.SetLogic command) {
    visitDefault(command);
  }

  default void visitSetOption(Command.SetOption command) {
    visitDefault(command);
  }
}
