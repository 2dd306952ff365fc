package smt2utils.concrete;

import java.util.List;
import java.util.Objects;
import smt2utils.model.Keyword;
import smt2utils.model.NumeralLiteral;
import smt2utils.model.StringLiteral;
import smt2utils.model.Symbol;

/**
 * Top-level SMT-LIB-2 command. The set of variants is closed; each one is an immutable record
 * with typed fields and dispatches to exactly one {@link CommandVisitor} method.
 */
public interface Command {

  /** Command name as written in SMT-LIB-2, e.g. {@code declare-fun}. */
  String name();

  void accept(CommandVisitor visitor);

  record Assert(Term term) implements Command {
    public Assert {
      Objects.requireNonNull(term, "term");
    }

    @Override
    public String name() {
      return "assert";
    }

    @Override
    public void accept(CommandVisitor visitor) {
      visitor.visitAssert(this);
    }
  }

  record CheckSat() implements Command {
    @Override
    public String name() {
      return "check-sat";
    }

    @Override
    public void accept(CommandVisitor visitor) {
      visitor.visitCheckSat(this);
    }
  }

  record CheckSatAssuming(List<PropLiteral> literals) implements Command {
    public CheckSatAssuming {
      literals = List.copyOf(Objects.requireNonNull(literals, "literals"));
    }

    @Override
    public String name() {
      return "check-sat-assuming";
    }

    @Override
    public void accept(CommandVisitor visitor) {
      visitor.visitCheckSatAssuming(this);
    }
  }

  record DeclareConst(Symbol symbol, Sort sort) implements Command {
    public DeclareConst {
      Objects.requireNonNull(symbol, "symbol");
      Objects.requireNonNull(sort, "sort");
    }

    @Override
    public String name() {
      return "declare-const";
    }

    @Override
    public void accept(CommandVisitor visitor) {
      visitor.visitDeclareConst(this);
    }
  }

  record DeclareDatatype(Symbol symbol, DatatypeDec datatype) implements Command {
    public DeclareDatatype {
      Objects.requireNonNull(symbol, "symbol");
      Objects.requireNonNull(datatype, "datatype");
    }

    @Override
    public String name() {
      return "declare-datatype";
    }

    @Override
    public void accept(CommandVisitor visitor) {
      visitor.visitDeclareDatatype(this);
    }
  }

  record DeclareDatatypes(List<SortDec> sorts, List<DatatypeDec> datatypes) implements Command {
    public DeclareDatatypes {
      sorts = List.copyOf(Objects.requireNonNull(sorts, "sorts"));
      datatypes = List.copyOf(Objects.requireNonNull(datatypes, "datatypes"));
    }

    @Override
    public String name() {
      return "declare-datatypes";
    }

    @Override
    public void accept(CommandVisitor visitor) {
      visitor.visitDeclareDatatypes(this);
    }
  }

  /** {@code (declare-fun f (Int Int) Bool)}. */
  record DeclareFun(Symbol symbol, List<Sort> parameters, Sort sort) implements Command {
    public DeclareFun {
      Objects.requireNonNull(symbol, "symbol");
      parameters = List.copyOf(Objects.requireNonNull(parameters, "parameters"));
      Objects.requireNonNull(sort, "sort");
    }

    @Override
    public String name() {
      return "declare-fun";
    }

    @Override
    public void accept(CommandVisitor visitor) {
      visitor.visitDeclareFun(this);
    }

    public int arity() {
      return parameters.size();
    }
  }

  /** {@code (declare-sort U 0)}; {@code arity} is null when omitted. */
  record DeclareSort(Symbol symbol, NumeralLiteral arity) implements Command {
    public DeclareSort {
      Objects.requireNonNull(symbol, "symbol");
    }

    @Override
    public String name() {
      return "declare-sort";
    }

    @Override
    public void accept(CommandVisitor visitor) {
      visitor.visitDeclareSort(this);
    }
  }

  record DefineFun(FunctionDef definition) implements Command {
    public DefineFun {
      Objects.requireNonNull(definition, "definition");
    }

    @Override
    public String name() {
      return "define-fun";
    }

    @Override
    public void accept(CommandVisitor visitor) {
      visitor.visitDefineFun(this);
    }
  }

  record DefineFunRec(FunctionDef definition) implements Command {
    public DefineFunRec {
      Objects.requireNonNull(definition, "definition");
    }

    @Override
    public String name() {
      return "define-fun-rec";
    }

    @Override
    public void accept(CommandVisitor visitor) {
      visitor.visitDefineFunRec(this);
    }
  }

  /** Mutually recursive definitions; {@code bodies} line up with {@code declarations}. */
  record DefineFunsRec(List<FunctionDec> declarations, List<Term> bodies) implements Command {
    public DefineFunsRec {
      declarations = List.copyOf(Objects.requireNonNull(declarations, "declarations"));
      bodies = List.copyOf(Objects.requireNonNull(bodies, "bodies"));
      if (declarations.size() != bodies.size()) {
        throw new IllegalArgumentException(
            "define-funs-rec has " + declarations.size() + " declarations but "
                + bodies.size() + " bodies");
      }
    }

    @Override
    public String name() {
      return "define-funs-rec";
    }

    @Override
    public void accept(CommandVisitor visitor) {
      visitor.visitDefineFunsRec(this);
    }
  }

  record DefineSort(Symbol symbol, List<Symbol> parameters, Sort sort) implements Command {
    public DefineSort {
      Objects.requireNonNull(symbol, "symbol");
      parameters = List.copyOf(Objects.requireNonNull(parameters, "parameters"));
      Objects.requireNonNull(sort, "sort");
    }

    @Override
    public String name() {
      return "define-sort";
    }

    @Override
    public void accept(CommandVisitor visitor) {
      visitor.visitDefineSort(this);
    }
  }

  record Echo(StringLiteral message) implements Command {
    public Echo {
      Objects.requireNonNull(message, "message");
    }

    @Override
    public String name() {
      return "echo";
    }

    @Override
    public void accept(CommandVisitor visitor) {
      visitor.visitEcho(this);
    }
  }

  record Exit() implements Command {
    @Override
    public String name() {
      return "exit";
    }

    @Override
    public void accept(CommandVisitor visitor) {
      visitor.visitExit(this);
    }
  }

  record GetAssertions() implements Command {
    @Override
    public String name() {
      return "get-assertions";
    }

    @Override
    public void accept(CommandVisitor visitor) {
      visitor.visitGetAssertions(this);
    }
  }

  record GetAssignment() implements Command {
    @Override
    public String name() {
      return "get-assignment";
    }

    @Override
    public void accept(CommandVisitor visitor) {
      visitor.visitGetAssignment(this);
    }
  }

  record GetInfo(Keyword flag) implements Command {
    public GetInfo {
      Objects.requireNonNull(flag, "flag");
    }

    @Override
    public String name() {
      return "get-info";
    }

    @Override
    public void accept(CommandVisitor visitor) {
      visitor.visitGetInfo(this);
    }
  }

  record GetModel() implements Command {
    @Override
    public String name() {
      return "get-model";
    }

    @Override
    public void accept(CommandVisitor visitor) {
      visitor.visitGetModel(this);
    }
  }

  record GetOption(Keyword keyword) implements Command {
    public GetOption {
      Objects.requireNonNull(keyword, "keyword");
    }

    @Override
    public String name() {
      return "get-option";
    }

    @Override
    public void accept(CommandVisitor visitor) {
      visitor.visitGetOption(this);
    }
  }

  record GetProof() implements Command {
    @Override
    public String name() {
      return "get-proof";
    }

    @Override
    public void accept(CommandVisitor visitor) {
      visitor.visitGetProof(this);
    }
  }

  record GetUnsatAssumptions() implements Command {
    @Override
    public String name() {
      return "get-unsat-assumptions";
    }

    @Override
    public void accept(CommandVisitor visitor) {
      visitor.visitGetUnsatAssumptions(this);
    }
  }

  record GetUnsatCore() implements Command {
    @Override
    public String name() {
      return "get-unsat-core";
    }

    @Override
    public void accept(CommandVisitor visitor) {
      visitor.visitGetUnsatCore(this);
    }
  }

  record GetValue(List<Term> terms) implements Command {
    public GetValue {
      terms = List.copyOf(Objects.requireNonNull(terms, "terms"));
      if (terms.isEmpty()) {
        throw new IllegalArgumentException("get-value needs at least one term");
      }
    }

    @Override
    public String name() {
      return "get-value";
    }

    @Override
    public void accept(CommandVisitor visitor) {
      visitor.visitGetValue(this);
    }
  }

  /** {@code (pop n)}; {@code level} is null for a bare {@code (pop)}. */
  record Pop(NumeralLiteral level) implements Command {
    @Override
    public String name() {
      return "pop";
    }

    @Override
    public void accept(CommandVisitor visitor) {
      visitor.visitPop(this);
    }
  }

  /** {@code (push n)}; {@code level} is null for a bare {@code (push)}. */
  record Push(NumeralLiteral level) implements Command {
    @Override
    public String name() {
      return "push";
    }

    @Override
    public void accept(CommandVisitor visitor) {
      visitor.visitPush(this);
    }
  }

  record Reset() implements Command {
    @Override
    public String name() {
      return "reset";
    }

    @Override
    public void accept(CommandVisitor visitor) {
      visitor.visitReset(this);
    }
  }

  record ResetAssertions() implements Command {
    @Override
    public String name() {
      return "reset-assertions";
    }

    @Override
    public void accept(CommandVisitor visitor) {
      visitor.visitResetAssertions(this);
    }
  }

  record SetInfo(Attribute attribute) implements Command {
    public SetInfo {
      Objects.requireNonNull(attribute, "attribute");
    }

    @Override
    public String name() {
      return "set-info";
    }

    @Override
    public void accept(CommandVisitor visitor) {
      visitor.visitSetInfo(this);
    }
  }

  record SetLogic(Symbol symbol) implements Command {
    public SetLogic {
      Objects.requireNonNull(symbol, "symbol");
    }

    @Override
    public String name() {
      return "set-logic";
    }

    @Override
    public void accept(CommandVisitor visitor) {
      visitor.visitSetLogic(this);
    }
  }

  record SetOption(Attribute attribute) implements Command {
    public SetOption {
      Objects.requireNonNull(attribute, "attribute");
    }

    @Override
    public String name() {
      return "set-option";
    }

    @Override
    public void accept(CommandVisitor visitor) {
      visitor.visitSetOption(this);
    }
  }
}
