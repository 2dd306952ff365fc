package smt2utils.printer;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.UnaryOperator;
import smt2utils.concrete.Attribute;
import smt2utils.concrete.Command;
import smt2utils.concrete.CommandVisitor;
import smt2utils.concrete.DatatypeDec;
import smt2utils.concrete.FunctionDec;
import smt2utils.concrete.FunctionDef;
import smt2utils.concrete.Identifier;
import smt2utils.concrete.MatchCase;
import smt2utils.concrete.PropLiteral;
import smt2utils.concrete.QualIdentifier;
import smt2utils.concrete.Sort;
import smt2utils.concrete.SortDec;
import smt2utils.concrete.SortedVar;
import smt2utils.concrete.Term;
import smt2utils.concrete.TermVisitor;
import smt2utils.concrete.VarBinding;
import smt2utils.model.Symbol;
import smt2utils.sexpr.SExpr;

/**
 * Rebuilds commands and terms, passing every symbol through {@link #rewriteSymbol(Symbol)}.
 *
 * <p>Declared names, bound variables, sort names and identifiers are all rewritten. Attribute
 * values are S-expressions: a bare symbol value is rewritten, list values are kept as written.
 * Subclasses override the hook; {@link #renaming(UnaryOperator)} covers the common case.
 */
public class TermRewriter implements TermVisitor<Term> {

  public static TermRewriter renaming(UnaryOperator<Symbol> renamer) {
    Objects.requireNonNull(renamer, "renamer");
    return new TermRewriter() {
      @Override
      protected Symbol rewriteSymbol(Symbol symbol) {
        return renamer.apply(symbol);
      }
    };
  }

  /** Identity by default. */
  protected Symbol rewriteSymbol(Symbol symbol) {
    return symbol;
  }

  public Term rewrite(Term term) {
    return term.accept(this);
  }

  public Command rewrite(Command command) {
    CommandRebuilder rebuilder = new CommandRebuilder();
    command.accept(rebuilder);
    return rebuilder.result;
  }

  public Sort rewrite(Sort sort) {
    return new Sort(identifier(sort.identifier()), map(sort.parameters(), this::rewrite));
  }

  @Override
  public Term visitConstant(Term.ConstantTerm term) {
    return term;
  }

  @Override
  public Term visitIdentifier(Term.IdentifierTerm term) {
    return new Term.IdentifierTerm(qualIdentifier(term.identifier()));
  }

  @Override
  public Term visitApplication(Term.Application term) {
    return new Term.Application(
        qualIdentifier(term.function()), map(term.arguments(), this::rewrite));
  }

  @Override
  public Term visitLet(Term.Let term) {
    List<VarBinding> bindings =
        map(
            term.bindings(),
            binding -> new VarBinding(rewriteSymbol(binding.symbol()), rewrite(binding.term())));
    return new Term.Let(bindings, rewrite(term.body()));
  }

  @Override
  public Term visitForall(Term.Forall term) {
    return new Term.Forall(map(term.variables(), this::sortedVar), rewrite(term.body()));
  }

  @Override
  public Term visitExists(Term.Exists term) {
    return new Term.Exists(map(term.variables(), this::sortedVar), rewrite(term.body()));
  }

  @Override
  public Term visitMatch(Term.Match term) {
    List<MatchCase> cases =
        map(
            term.cases(),
            matchCase ->
                new MatchCase(
                    new MatchCase.Pattern(
                        rewriteSymbol(matchCase.pattern().constructor()),
                        map(matchCase.pattern().variables(), this::rewriteSymbol)),
                    rewrite(matchCase.term())));
    return new Term.Match(rewrite(term.scrutinee()), cases);
  }

  @Override
  public Term visitAnnotated(Term.Annotated term) {
    return new Term.Annotated(rewrite(term.term()), map(term.attributes(), this::attribute));
  }

  private Attribute attribute(Attribute attribute) {
    if (attribute.value() instanceof SExpr.SymbolAtom atom) {
      return new Attribute(
          attribute.keyword(),
          new SExpr.SymbolAtom(rewriteSymbol(atom.symbol()), atom.position()));
    }
    return attribute;
  }

  private SortedVar sortedVar(SortedVar variable) {
    return new SortedVar(rewriteSymbol(variable.symbol()), rewrite(variable.sort()));
  }

  private QualIdentifier qualIdentifier(QualIdentifier identifier) {
    Sort sort = identifier.isQualified() ? rewrite(identifier.sort()) : null;
    return new QualIdentifier(identifier(identifier.identifier()), sort);
  }

  private Identifier identifier(Identifier identifier) {
    return new Identifier(rewriteSymbol(identifier.symbol()), identifier.indices());
  }

  private FunctionDec functionDec(FunctionDec declaration) {
    return new FunctionDec(
        rewriteSymbol(declaration.name()),
        map(declaration.parameters(), this::sortedVar),
        rewrite(declaration.result()));
  }

  private FunctionDef functionDef(FunctionDef definition) {
    return new FunctionDef(functionDec(definition.signature()), rewrite(definition.body()));
  }

  private DatatypeDec datatype(DatatypeDec datatype) {
    List<DatatypeDec.ConstructorDec> constructors =
        map(
            datatype.constructors(),
            constructor ->
                new DatatypeDec.ConstructorDec(
                    rewriteSymbol(constructor.symbol()),
                    map(
                        constructor.selectors(),
                        selector ->
                            new DatatypeDec.SelectorDec(
                                rewriteSymbol(selector.symbol()), rewrite(selector.sort())))));
    return new DatatypeDec(map(datatype.parameters(), this::rewriteSymbol), constructors);
  }

  private static <T, R> List<R> map(List<T> items, Function<T, R> mapper) {
    List<R> mapped = new ArrayList<>(items.size());
    for (T item : items) {
      mapped.add(mapper.apply(item));
    }
    return mapped;
  }

  private final class CommandRebuilder implements CommandVisitor {
    private Command result;

    @Override
    public void visitAssert(Command.Assert command) {
      result = new Command.Assert(rewrite(command.term()));
    }

    @Override
    public void visitCheckSatAssuming(Command.CheckSatAssuming command) {
      result =
          new Command.CheckSatAssuming(
              map(
                  command.literals(),
                  literal ->
                      new PropLiteral(rewriteSymbol(literal.symbol()), literal.negated())));
    }

    @Override
    public void visitDeclareConst(Command.DeclareConst command) {
      result =
          new Command.DeclareConst(rewriteSymbol(command.symbol()), rewrite(command.sort()));
    }

    @Override
    public void visitDeclareDatatype(Command.DeclareDatatype command) {
      result =
          new Command.DeclareDatatype(
              rewriteSymbol(command.symbol()), datatype(command.datatype()));
    }

    @Override
    public void visitDeclareDatatypes(Command.DeclareDatatypes command) {
      result =
          new Command.DeclareDatatypes(
              map(
                  command.sorts(),
                  sortDec -> new SortDec(rewriteSymbol(sortDec.symbol()), sortDec.arity())),
              map(command.datatypes(), TermRewriter.this::datatype));
    }

    @Override
    public void visitDeclareFun(Command.DeclareFun command) {
      result =
          new Command.DeclareFun(
              rewriteSymbol(command.symbol()),
              map(command.parameters(), TermRewriter.this::rewrite),
              rewrite(command.sort()));
    }

    @Override
    public void visitDeclareSort(Command.DeclareSort command) {
      result = new Command.DeclareSort(rewriteSymbol(command.symbol()), command.arity());
    }

    @Override
    public void visitDefineFun(Command.DefineFun command) {
      result = new Command.DefineFun(functionDef(command.definition()));
    }

    @Override
    public void visitDefineFunRec(Command.DefineFunRec command) {
      result = new Command.DefineFunRec(functionDef(command.definition()));
    }

    @Override
    public void visitDefineFunsRec(Command.DefineFunsRec command) {
      result =
          new Command.DefineFunsRec(
              map(command.declarations(), TermRewriter.this::functionDec),
              map(command.bodies(), TermRewriter.this::rewrite));
    }

    @Override
    public void visitDefineSort(Command.DefineSort command) {
      result =
          new Command.DefineSort(
              rewriteSymbol(command.symbol()),
              map(command.parameters(), TermRewriter.this::rewriteSymbol),
              rewrite(command.sort()));
    }

    @Override
    public void visitGetValue(Command.GetValue command) {
      result = new Command.GetValue(map(command.terms(), TermRewriter.this::rewrite));
    }

    @Override
    public void visitSetLogic(Command.SetLogic command) {
      result = new Command.SetLogic(rewriteSymbol(command.symbol()));
    }

    /** Commands that carry no symbols are shared. */
    @Override
    public void visitDefault(Command command) {
      result = command;
    }
  }
}
