package smt2utils.printer;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import smt2utils.concrete.Attribute;
import smt2utils.concrete.Command;
import smt2utils.concrete.CommandVisitor;
import smt2utils.concrete.DatatypeDec;
import smt2utils.concrete.FunctionDec;
import smt2utils.concrete.FunctionDef;
import smt2utils.concrete.Identifier;
import smt2utils.concrete.Index;
import smt2utils.concrete.MatchCase;
import smt2utils.concrete.PropLiteral;
import smt2utils.concrete.QualIdentifier;
import smt2utils.concrete.Sort;
import smt2utils.concrete.SortDec;
import smt2utils.concrete.SortedVar;
import smt2utils.concrete.Term;
import smt2utils.concrete.TermVisitor;
import smt2utils.concrete.VarBinding;
import smt2utils.model.NumeralLiteral;
import smt2utils.model.Symbol;
import smt2utils.sexpr.SExprPrinter;

/**
 * Canonical re-serializer. Every dispatched command is rendered on one line, tokens separated by
 * single spaces, and handed to the sink.
 *
 * <p>Lexical forms are preserved: numerals keep their radix and digits, quoted symbols keep their
 * bars and strings are re-escaped. Parsing the output again yields an equal command.
 */
public final class SyntaxPrinter implements CommandVisitor {
  private final Consumer<String> sink;

  public SyntaxPrinter(Consumer<String> sink) {
    this.sink = Objects.requireNonNull(sink, "sink");
  }

  /** Printer that appends each command, followed by a newline, to {@code out}. */
  public static SyntaxPrinter appendingTo(StringBuilder out) {
    Objects.requireNonNull(out, "out");
    return new SyntaxPrinter(line -> out.append(line).append('\n'));
  }

  @Override
  public void visitDefault(Command command) {
    sink.accept(render(command));
  }

  public static String render(Command command) {
    Renderer renderer = new Renderer();
    command.accept(renderer);
    return renderer.out.toString();
  }

  public static String render(Term term) {
    Renderer renderer = new Renderer();
    term.accept(renderer);
    return renderer.out.toString();
  }

  public static String render(Sort sort) {
    Renderer renderer = new Renderer();
    renderer.sort(sort);
    return renderer.out.toString();
  }

  private static final class Renderer implements CommandVisitor, TermVisitor<Void> {
    private final StringBuilder out = new StringBuilder();

    @Override
    public void visitAssert(Command.Assert command) {
      open("assert").space().term(command.term()).close();
    }

    @Override
    public void visitCheckSatAssuming(Command.CheckSatAssuming command) {
      open("check-sat-assuming").space().out.append('(');
      separated(command.literals(), this::propLiteral);
      out.append(')');
      close();
    }

    @Override
    public void visitDeclareConst(Command.DeclareConst command) {
      open("declare-const").space().symbol(command.symbol()).space().sort(command.sort()).close();
    }

    @Override
    public void visitDeclareDatatype(Command.DeclareDatatype command) {
      open("declare-datatype").space().symbol(command.symbol()).space();
      datatype(command.datatype());
      close();
    }

    @Override
    public void visitDeclareDatatypes(Command.DeclareDatatypes command) {
      open("declare-datatypes").space().out.append('(');
      separated(command.sorts(), this::sortDec);
      out.append(") (");
      separated(command.datatypes(), this::datatype);
      out.append(')');
      close();
    }

    @Override
    public void visitDeclareFun(Command.DeclareFun command) {
      open("declare-fun").space().symbol(command.symbol()).space().out.append('(');
      separated(command.parameters(), this::sort);
      out.append(") ");
      sort(command.sort()).close();
    }

    @Override
    public void visitDeclareSort(Command.DeclareSort command) {
      open("declare-sort").space().symbol(command.symbol());
      if (command.arity() != null) {
        space().numeral(command.arity());
      }
      close();
    }

    @Override
    public void visitDefineFun(Command.DefineFun command) {
      open("define-fun").space();
      functionDef(command.definition());
      close();
    }

    @Override
    public void visitDefineFunRec(Command.DefineFunRec command) {
      open("define-fun-rec").space();
      functionDef(command.definition());
      close();
    }

    @Override
    public void visitDefineFunsRec(Command.DefineFunsRec command) {
      open("define-funs-rec").space().out.append('(');
      separated(
          command.declarations(),
          declaration -> {
            out.append('(');
            functionDec(declaration);
            out.append(')');
          });
      out.append(") (");
      separated(command.bodies(), this::term);
      out.append(')');
      close();
    }

    @Override
    public void visitDefineSort(Command.DefineSort command) {
      open("define-sort").space().symbol(command.symbol()).space().out.append('(');
      separated(command.parameters(), this::symbol);
      out.append(") ");
      sort(command.sort()).close();
    }

    @Override
    public void visitEcho(Command.Echo command) {
      open("echo").space().out.append(command.message().lexeme());
      close();
    }

    @Override
    public void visitGetInfo(Command.GetInfo command) {
      open("get-info").space().out.append(command.flag().lexeme());
      close();
    }

    @Override
    public void visitGetOption(Command.GetOption command) {
      open("get-option").space().out.append(command.keyword().lexeme());
      close();
    }

    @Override
    public void visitGetValue(Command.GetValue command) {
      open("get-value").space().out.append('(');
      separated(command.terms(), this::term);
      out.append(')');
      close();
    }

    @Override
    public void visitPop(Command.Pop command) {
      open("pop");
      if (command.level() != null) {
        space().numeral(command.level());
      }
      close();
    }

    @Override
    public void visitPush(Command.Push command) {
      open("push");
      if (command.level() != null) {
        space().numeral(command.level());
      }
      close();
    }

    @Override
    public void visitSetInfo(Command.SetInfo command) {
      open("set-info").space();
      attribute(command.attribute());
      close();
    }

    @Override
    public void visitSetLogic(Command.SetLogic command) {
      open("set-logic").space().symbol(command.symbol()).close();
    }

    @Override
    public void visitSetOption(Command.SetOption command) {
      open("set-option").space();
      attribute(command.attribute());
      close();
    }

    /** Commands without arguments. */
    @Override
    public void visitDefault(Command command) {
      open(command.name()).close();
    }

    @Override
    public Void visitConstant(Term.ConstantTerm term) {
      out.append(term.constant().lexeme());
      return null;
    }

    @Override
    public Void visitIdentifier(Term.IdentifierTerm term) {
      qualIdentifier(term.identifier());
      return null;
    }

    @Override
    public Void visitApplication(Term.Application term) {
      out.append('(');
      qualIdentifier(term.function());
      for (Term argument : term.arguments()) {
        space().term(argument);
      }
      out.append(')');
      return null;
    }

    @Override
    public Void visitLet(Term.Let term) {
      out.append("(let (");
      separated(term.bindings(), this::binding);
      out.append(") ");
      term(term.body()).out.append(')');
      return null;
    }

    @Override
    public Void visitForall(Term.Forall term) {
      quantifier("forall", term.variables(), term.body());
      return null;
    }

    @Override
    public Void visitExists(Term.Exists term) {
      quantifier("exists", term.variables(), term.body());
      return null;
    }

    @Override
    public Void visitMatch(Term.Match term) {
      out.append("(match ");
      term(term.scrutinee()).out.append(" (");
      separated(term.cases(), this::matchCase);
      out.append("))");
      return null;
    }

    @Override
    public Void visitAnnotated(Term.Annotated term) {
      out.append("(! ");
      term(term.term());
      for (Attribute attribute : term.attributes()) {
        space();
        attribute(attribute);
      }
      out.append(')');
      return null;
    }

    private void quantifier(String binder, List<SortedVar> variables, Term body) {
      out.append('(').append(binder).append(" (");
      separated(variables, this::sortedVar);
      out.append(") ");
      term(body).out.append(')');
    }

    private void binding(VarBinding binding) {
      out.append('(');
      symbol(binding.symbol()).space().term(binding.term()).out.append(')');
    }

    private void matchCase(MatchCase matchCase) {
      out.append('(');
      MatchCase.Pattern pattern = matchCase.pattern();
      if (pattern.variables().isEmpty()) {
        symbol(pattern.constructor());
      } else {
        out.append('(');
        symbol(pattern.constructor());
        for (Symbol variable : pattern.variables()) {
          space().symbol(variable);
        }
        out.append(')');
      }
      space().term(matchCase.term()).out.append(')');
    }

    private void functionDef(FunctionDef definition) {
      functionDec(definition.signature());
      space().term(definition.body());
    }

    private void functionDec(FunctionDec declaration) {
      symbol(declaration.name()).space().out.append('(');
      separated(declaration.parameters(), this::sortedVar);
      out.append(") ");
      sort(declaration.result());
    }

    private void sortedVar(SortedVar variable) {
      out.append('(');
      symbol(variable.symbol()).space().sort(variable.sort()).out.append(')');
    }

    private void sortDec(SortDec sortDec) {
      out.append('(');
      symbol(sortDec.symbol()).space().numeral(sortDec.arity()).out.append(')');
    }

    private void datatype(DatatypeDec datatype) {
      if (datatype.isParametric()) {
        out.append("(par (");
        separated(datatype.parameters(), this::symbol);
        out.append(") ");
      }
      out.append('(');
      separated(datatype.constructors(), this::constructor);
      out.append(')');
      if (datatype.isParametric()) {
        out.append(')');
      }
    }

    private void constructor(DatatypeDec.ConstructorDec constructor) {
      out.append('(');
      symbol(constructor.symbol());
      for (DatatypeDec.SelectorDec selector : constructor.selectors()) {
        out.append(" (");
        symbol(selector.symbol()).space().sort(selector.sort()).out.append(')');
      }
      out.append(')');
    }

    private void propLiteral(PropLiteral literal) {
      if (literal.negated()) {
        out.append("(not ");
        symbol(literal.symbol()).out.append(')');
      } else {
        symbol(literal.symbol());
      }
    }

    private void attribute(Attribute attribute) {
      out.append(attribute.keyword().lexeme());
      if (attribute.hasValue()) {
        space();
        SExprPrinter.append(out, attribute.value());
      }
    }

    private void qualIdentifier(QualIdentifier identifier) {
      if (identifier.isQualified()) {
        out.append("(as ");
        identifier(identifier.identifier()).space().sort(identifier.sort()).out.append(')');
      } else {
        identifier(identifier.identifier());
      }
    }

    private Renderer identifier(Identifier identifier) {
      if (!identifier.isIndexed()) {
        return symbol(identifier.symbol());
      }
      out.append("(_ ");
      symbol(identifier.symbol());
      for (Index index : identifier.indices()) {
        space().out.append(index.lexeme());
      }
      out.append(')');
      return this;
    }

    private Renderer sort(Sort sort) {
      if (!sort.isParameterized()) {
        return identifier(sort.identifier());
      }
      out.append('(');
      identifier(sort.identifier());
      for (Sort parameter : sort.parameters()) {
        space().sort(parameter);
      }
      out.append(')');
      return this;
    }

    private Renderer term(Term term) {
      term.accept(this);
      return this;
    }

    private Renderer symbol(Symbol symbol) {
      out.append(symbol.lexeme());
      return this;
    }

    private Renderer numeral(NumeralLiteral numeral) {
      out.append(numeral.lexeme());
      return this;
    }

    private Renderer open(String name) {
      out.append('(').append(name);
      return this;
    }

    private Renderer space() {
      out.append(' ');
      return this;
    }

    private void close() {
      out.append(')');
    }

    private <T> void separated(List<T> items, Consumer<T> action) {
      for (int i = 0; i < items.size(); i++) {
        if (i > 0) {
          out.append(' ');
        }
        action.accept(items.get(i));
      }
    }
  }
}
