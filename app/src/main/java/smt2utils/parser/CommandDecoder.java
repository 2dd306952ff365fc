package smt2utils.parser;

import java.util.ArrayList;
import java.util.List;
import smt2utils.SyntaxException;
import smt2utils.concrete.Attribute;
import smt2utils.concrete.Command;
import smt2utils.concrete.DatatypeDec;
import smt2utils.concrete.DatatypeDec.ConstructorDec;
import smt2utils.concrete.DatatypeDec.SelectorDec;
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
import smt2utils.concrete.VarBinding;
import smt2utils.model.Keyword;
import smt2utils.model.NumeralLiteral;
import smt2utils.model.StringLiteral;
import smt2utils.model.Symbol;
import smt2utils.sexpr.SExpr;
import smt2utils.sexpr.SExpr.ConstantAtom;
import smt2utils.sexpr.SExpr.KeywordAtom;
import smt2utils.sexpr.SExpr.ListExpr;
import smt2utils.sexpr.SExpr.SymbolAtom;

/**
 * Matches a complete top-level S-expression against the closed set of command shapes.
 *
 * <p>Decoding never reads input: by the time it runs the form has been consumed in full, so a
 * {@link SyntaxException} here leaves the input positioned at the next form.
 */
final class CommandDecoder {
  private final int maxDepth;

  CommandDecoder(int maxDepth) {
    this.maxDepth = maxDepth;
  }

  Command decode(SExpr form) {
    ListExpr list = expectList(form, "command");
    if (list.isEmpty()) {
      throw new SyntaxException("command", "()", list.position());
    }
    if (!(list.get(0) instanceof SymbolAtom head) || head.symbol().quoted()) {
      throw new SyntaxException("command name", describe(list.get(0)), list.get(0).position());
    }
    String name = head.symbol().name();
    return switch (name) {
      case "assert" -> {
        expectSize(list, 2, name);
        yield new Command.Assert(term(list.get(1), 0));
      }
      case "check-sat" -> {
        expectSize(list, 1, name);
        yield new Command.CheckSat();
      }
      case "check-sat-assuming" -> {
        expectSize(list, 2, name);
        List<PropLiteral> literals = new ArrayList<>();
        for (SExpr literal : expectList(list.get(1), "list of literals").elements()) {
          literals.add(propLiteral(literal));
        }
        yield new Command.CheckSatAssuming(literals);
      }
      case "declare-const" -> {
        expectSize(list, 3, name);
        yield new Command.DeclareConst(symbol(list.get(1)), sort(list.get(2), 0));
      }
      case "declare-datatype" -> {
        expectSize(list, 3, name);
        yield new Command.DeclareDatatype(symbol(list.get(1)), datatype(list.get(2)));
      }
      case "declare-datatypes" -> declareDatatypes(list);
      case "declare-fun" -> {
        expectSize(list, 4, name);
        List<Sort> parameters = new ArrayList<>();
        for (SExpr parameter : expectList(list.get(2), "list of parameter sorts").elements()) {
          parameters.add(sort(parameter, 0));
        }
        yield new Command.DeclareFun(symbol(list.get(1)), parameters, sort(list.get(3), 0));
      }
      case "declare-sort" -> {
        expectSizeBetween(list, 2, 3, name);
        NumeralLiteral arity = list.size() == 3 ? numeral(list.get(2)) : null;
        yield new Command.DeclareSort(symbol(list.get(1)), arity);
      }
      case "define-fun" -> {
        expectSize(list, 5, name);
        yield new Command.DefineFun(functionDef(list));
      }
      case "define-fun-rec" -> {
        expectSize(list, 5, name);
        yield new Command.DefineFunRec(functionDef(list));
      }
      case "define-funs-rec" -> defineFunsRec(list);
      case "define-sort" -> {
        expectSize(list, 4, name);
        List<Symbol> parameters = new ArrayList<>();
        for (SExpr parameter : expectList(list.get(2), "list of sort parameters").elements()) {
          parameters.add(symbol(parameter));
        }
        yield new Command.DefineSort(symbol(list.get(1)), parameters, sort(list.get(3), 0));
      }
      case "echo" -> {
        expectSize(list, 2, name);
        yield new Command.Echo(string(list.get(1)));
      }
      case "exit" -> noArguments(list, new Command.Exit());
      case "get-assertions" -> noArguments(list, new Command.GetAssertions());
      case "get-assignment" -> noArguments(list, new Command.GetAssignment());
      case "get-info" -> {
        expectSize(list, 2, name);
        yield new Command.GetInfo(keyword(list.get(1)));
      }
      case "get-model" -> noArguments(list, new Command.GetModel());
      case "get-option" -> {
        expectSize(list, 2, name);
        yield new Command.GetOption(keyword(list.get(1)));
      }
      case "get-proof" -> noArguments(list, new Command.GetProof());
      case "get-unsat-assumptions" -> noArguments(list, new Command.GetUnsatAssumptions());
      case "get-unsat-core" -> noArguments(list, new Command.GetUnsatCore());
      case "get-value" -> {
        expectSize(list, 2, name);
        ListExpr terms = expectList(list.get(1), "non-empty list of terms");
        if (terms.isEmpty()) {
          throw new SyntaxException("non-empty list of terms", "()", terms.position());
        }
        List<Term> decoded = new ArrayList<>();
        for (SExpr term : terms.elements()) {
          decoded.add(term(term, 0));
        }
        yield new Command.GetValue(decoded);
      }
      case "pop" -> {
        expectSizeBetween(list, 1, 2, name);
        yield new Command.Pop(list.size() == 2 ? numeral(list.get(1)) : null);
      }
      case "push" -> {
        expectSizeBetween(list, 1, 2, name);
        yield new Command.Push(list.size() == 2 ? numeral(list.get(1)) : null);
      }
      case "reset" -> noArguments(list, new Command.Reset());
      case "reset-assertions" -> noArguments(list, new Command.ResetAssertions());
      case "set-info" -> {
        expectSizeBetween(list, 2, 3, name);
        yield new Command.SetInfo(singleAttribute(list));
      }
      case "set-logic" -> {
        expectSize(list, 2, name);
        yield new Command.SetLogic(symbol(list.get(1)));
      }
      case "set-option" -> {
        expectSizeBetween(list, 2, 3, name);
        yield new Command.SetOption(singleAttribute(list));
      }
      default -> throw new SyntaxException("command name", "'" + name + "'", head.position());
    };
  }

  private Command declareDatatypes(ListExpr list) {
    expectSize(list, 3, "declare-datatypes");
    ListExpr sortDecs = expectList(list.get(1), "list of sort declarations");
    ListExpr datatypeDecs = expectList(list.get(2), "list of datatype declarations");
    if (sortDecs.size() != datatypeDecs.size() || sortDecs.isEmpty()) {
      throw new SyntaxException(
          sortDecs.size() + " datatype declaration(s)",
          String.valueOf(datatypeDecs.size()),
          datatypeDecs.position());
    }
    List<SortDec> sorts = new ArrayList<>();
    for (SExpr element : sortDecs.elements()) {
      ListExpr sortDec = expectList(element, "(symbol numeral)");
      expectSize(sortDec, 2, "sort declaration");
      sorts.add(new SortDec(symbol(sortDec.get(0)), numeral(sortDec.get(1))));
    }
    List<DatatypeDec> datatypes = new ArrayList<>();
    for (SExpr element : datatypeDecs.elements()) {
      datatypes.add(datatype(element));
    }
    return new Command.DeclareDatatypes(sorts, datatypes);
  }

  private Command defineFunsRec(ListExpr list) {
    expectSize(list, 3, "define-funs-rec");
    ListExpr decs = expectList(list.get(1), "list of function declarations");
    ListExpr bodies = expectList(list.get(2), "list of function bodies");
    if (decs.size() != bodies.size() || decs.isEmpty()) {
      throw new SyntaxException(
          decs.size() + " function body(ies)", String.valueOf(bodies.size()), bodies.position());
    }
    List<FunctionDec> declarations = new ArrayList<>();
    for (SExpr element : decs.elements()) {
      ListExpr dec = expectList(element, "function declaration");
      expectSize(dec, 3, "function declaration");
      declarations.add(functionDec(dec.get(0), dec.get(1), dec.get(2)));
    }
    List<Term> terms = new ArrayList<>();
    for (SExpr body : bodies.elements()) {
      terms.add(term(body, 0));
    }
    return new Command.DefineFunsRec(declarations, terms);
  }

  private FunctionDef functionDef(ListExpr list) {
    FunctionDec signature = functionDec(list.get(1), list.get(2), list.get(3));
    return new FunctionDef(signature, term(list.get(4), 0));
  }

  private FunctionDec functionDec(SExpr name, SExpr parameters, SExpr result) {
    List<SortedVar> vars = new ArrayList<>();
    for (SExpr parameter : expectList(parameters, "list of sorted variables").elements()) {
      vars.add(sortedVar(parameter, 0));
    }
    return new FunctionDec(symbol(name), vars, sort(result, 0));
  }

  private DatatypeDec datatype(SExpr expr) {
    ListExpr list = expectList(expr, "datatype declaration");
    if (!list.isEmpty() && isReserved(list.get(0), "par")) {
      expectSize(list, 3, "par");
      List<Symbol> parameters = new ArrayList<>();
      for (SExpr parameter : expectList(list.get(1), "list of sort parameters").elements()) {
        parameters.add(symbol(parameter));
      }
      if (parameters.isEmpty()) {
        throw new SyntaxException("at least one sort parameter", "()", list.get(1).position());
      }
      return new DatatypeDec(parameters, constructors(expectList(list.get(2), "constructors")));
    }
    return new DatatypeDec(List.of(), constructors(list));
  }

  private List<ConstructorDec> constructors(ListExpr list) {
    if (list.isEmpty()) {
      throw new SyntaxException("at least one constructor", "()", list.position());
    }
    List<ConstructorDec> constructors = new ArrayList<>();
    for (SExpr element : list.elements()) {
      ListExpr constructor = expectList(element, "constructor declaration");
      if (constructor.isEmpty()) {
        throw new SyntaxException("constructor name", "()", constructor.position());
      }
      List<SelectorDec> selectors = new ArrayList<>();
      for (int i = 1; i < constructor.size(); i++) {
        ListExpr selector = expectList(constructor.get(i), "selector declaration");
        expectSize(selector, 2, "selector declaration");
        selectors.add(new SelectorDec(symbol(selector.get(0)), sort(selector.get(1), 0)));
      }
      constructors.add(new ConstructorDec(symbol(constructor.get(0)), selectors));
    }
    return constructors;
  }

  private PropLiteral propLiteral(SExpr expr) {
    if (expr instanceof SymbolAtom) {
      return new PropLiteral(symbol(expr), false);
    }
    ListExpr list = expectList(expr, "literal");
    if (list.size() != 2 || !(list.get(0) instanceof SymbolAtom not)
        || !"not".equals(not.symbol().name())) {
      throw new SyntaxException("(not symbol)", describe(expr), expr.position());
    }
    return new PropLiteral(symbol(list.get(1)), true);
  }

  private Attribute singleAttribute(ListExpr list) {
    Keyword keyword = keyword(list.get(1));
    SExpr value = list.size() == 3 ? attributeValue(list.get(2)) : null;
    return new Attribute(keyword, value);
  }

  private List<Attribute> attributes(ListExpr list, int from) {
    List<Attribute> attributes = new ArrayList<>();
    int i = from;
    while (i < list.size()) {
      Keyword keyword = keyword(list.get(i));
      i++;
      SExpr value = null;
      if (i < list.size() && !(list.get(i) instanceof KeywordAtom)) {
        value = attributeValue(list.get(i));
        i++;
      }
      attributes.add(new Attribute(keyword, value));
    }
    return attributes;
  }

  private SExpr attributeValue(SExpr value) {
    if (value instanceof KeywordAtom) {
      throw new SyntaxException("attribute value", describe(value), value.position());
    }
    return value;
  }

  Term term(SExpr expr, int depth) {
    checkDepth(expr, depth);
    if (expr instanceof ConstantAtom constant) {
      return new Term.ConstantTerm(constant.constant());
    }
    if (expr instanceof SymbolAtom) {
      return new Term.IdentifierTerm(QualIdentifier.simple(symbol(expr)));
    }
    if (expr instanceof KeywordAtom) {
      throw new SyntaxException("term", describe(expr), expr.position());
    }
    ListExpr list = (ListExpr) expr;
    if (list.isEmpty()) {
      throw new SyntaxException("term", "()", list.position());
    }
    SExpr head = list.get(0);
    if (head instanceof SymbolAtom atom && atom.symbol().isReserved()) {
      return switch (atom.symbol().name()) {
        case "_" -> new Term.IdentifierTerm(new QualIdentifier(identifier(list), null));
        case "as" -> new Term.IdentifierTerm(qualIdentifier(list, depth));
        case "let" -> let(list, depth);
        case "forall" -> {
          expectSize(list, 3, "forall");
          yield new Term.Forall(sortedVars(list.get(1), depth), term(list.get(2), depth + 1));
        }
        case "exists" -> {
          expectSize(list, 3, "exists");
          yield new Term.Exists(sortedVars(list.get(1), depth), term(list.get(2), depth + 1));
        }
        case "match" -> match(list, depth);
        case "!" -> {
          if (list.size() < 3) {
            throw new SyntaxException(
                "term followed by attributes", describe(list), list.position());
          }
          yield new Term.Annotated(term(list.get(1), depth + 1), attributes(list, 2));
        }
        default ->
            throw new SyntaxException(
                "term", "reserved word '" + atom.symbol().name() + "'", atom.position());
      };
    }
    if (list.size() < 2) {
      throw new SyntaxException(
          "function application with arguments", describe(list), list.position());
    }
    QualIdentifier function = qualIdentifierHead(head, depth);
    List<Term> arguments = new ArrayList<>(list.size() - 1);
    for (int i = 1; i < list.size(); i++) {
      arguments.add(term(list.get(i), depth + 1));
    }
    return new Term.Application(function, arguments);
  }

  private Term let(ListExpr list, int depth) {
    expectSize(list, 3, "let");
    ListExpr bindings = expectList(list.get(1), "list of bindings");
    if (bindings.isEmpty()) {
      throw new SyntaxException("at least one binding", "()", bindings.position());
    }
    List<VarBinding> decoded = new ArrayList<>();
    for (SExpr element : bindings.elements()) {
      ListExpr binding = expectList(element, "(symbol term)");
      expectSize(binding, 2, "binding");
      decoded.add(new VarBinding(symbol(binding.get(0)), term(binding.get(1), depth + 1)));
    }
    return new Term.Let(decoded, term(list.get(2), depth + 1));
  }

  private Term match(ListExpr list, int depth) {
    expectSize(list, 3, "match");
    Term scrutinee = term(list.get(1), depth + 1);
    ListExpr cases = expectList(list.get(2), "list of match cases");
    if (cases.isEmpty()) {
      throw new SyntaxException("at least one match case", "()", cases.position());
    }
    List<MatchCase> decoded = new ArrayList<>();
    for (SExpr element : cases.elements()) {
      ListExpr matchCase = expectList(element, "(pattern term)");
      expectSize(matchCase, 2, "match case");
      decoded.add(new MatchCase(pattern(matchCase.get(0)), term(matchCase.get(1), depth + 1)));
    }
    return new Term.Match(scrutinee, decoded);
  }

  private MatchCase.Pattern pattern(SExpr expr) {
    if (expr instanceof SymbolAtom) {
      return new MatchCase.Pattern(symbol(expr), List.of());
    }
    ListExpr list = expectList(expr, "pattern");
    if (list.size() < 2) {
      throw new SyntaxException("(constructor variable+)", describe(list), list.position());
    }
    List<Symbol> variables = new ArrayList<>();
    for (int i = 1; i < list.size(); i++) {
      variables.add(symbol(list.get(i)));
    }
    return new MatchCase.Pattern(symbol(list.get(0)), variables);
  }

  private List<SortedVar> sortedVars(SExpr expr, int depth) {
    ListExpr list = expectList(expr, "list of sorted variables");
    if (list.isEmpty()) {
      throw new SyntaxException("at least one sorted variable", "()", list.position());
    }
    List<SortedVar> vars = new ArrayList<>();
    for (SExpr element : list.elements()) {
      vars.add(sortedVar(element, depth));
    }
    return vars;
  }

  private SortedVar sortedVar(SExpr expr, int depth) {
    ListExpr list = expectList(expr, "(symbol sort)");
    expectSize(list, 2, "sorted variable");
    return new SortedVar(symbol(list.get(0)), sort(list.get(1), depth + 1));
  }

  private QualIdentifier qualIdentifierHead(SExpr head, int depth) {
    if (head instanceof SymbolAtom) {
      return QualIdentifier.simple(symbol(head));
    }
    ListExpr list = expectList(head, "function identifier");
    if (!list.isEmpty() && isReserved(list.get(0), "_")) {
      return new QualIdentifier(identifier(list), null);
    }
    if (!list.isEmpty() && isReserved(list.get(0), "as")) {
      return qualIdentifier(list, depth);
    }
    throw new SyntaxException("function identifier", describe(head), head.position());
  }

  private QualIdentifier qualIdentifier(ListExpr list, int depth) {
    expectSize(list, 3, "as");
    return new QualIdentifier(identifier(list.get(1)), sort(list.get(2), depth + 1));
  }

  private Identifier identifier(SExpr expr) {
    if (expr instanceof SymbolAtom) {
      return Identifier.simple(symbol(expr));
    }
    ListExpr list = expectList(expr, "identifier");
    if (list.isEmpty() || !isReserved(list.get(0), "_")) {
      throw new SyntaxException("identifier", describe(expr), expr.position());
    }
    if (list.size() < 3) {
      throw new SyntaxException("(_ symbol index+)", describe(list), list.position());
    }
    List<Index> indices = new ArrayList<>();
    for (int i = 2; i < list.size(); i++) {
      SExpr index = list.get(i);
      if (index instanceof ConstantAtom constant
          && constant.constant() instanceof NumeralLiteral numeral
          && numeral.form() == NumeralLiteral.Form.NUMERAL) {
        indices.add(new Index.NumeralIndex(numeral));
      } else if (index instanceof SymbolAtom) {
        indices.add(new Index.SymbolIndex(symbol(index)));
      } else {
        throw new SyntaxException("numeral or symbol index", describe(index), index.position());
      }
    }
    return new Identifier(symbol(list.get(1)), indices);
  }

  Sort sort(SExpr expr, int depth) {
    checkDepth(expr, depth);
    if (expr instanceof SymbolAtom) {
      return Sort.simple(symbol(expr));
    }
    ListExpr list = expectList(expr, "sort");
    if (list.isEmpty()) {
      throw new SyntaxException("sort", "()", list.position());
    }
    if (isReserved(list.get(0), "_")) {
      return new Sort(identifier(list), List.of());
    }
    if (list.size() < 2) {
      throw new SyntaxException("(identifier sort+)", describe(list), list.position());
    }
    List<Sort> parameters = new ArrayList<>(list.size() - 1);
    for (int i = 1; i < list.size(); i++) {
      parameters.add(sort(list.get(i), depth + 1));
    }
    return new Sort(identifier(list.get(0)), parameters);
  }

  private void checkDepth(SExpr expr, int depth) {
    if (depth > maxDepth) {
      throw new SyntaxException(
          "nesting of at most " + maxDepth + " levels", "deeper nesting", expr.position());
    }
  }

  private static Command noArguments(ListExpr list, Command command) {
    expectSize(list, 1, command.name());
    return command;
  }

  private static ListExpr expectList(SExpr expr, String what) {
    if (expr instanceof ListExpr list) {
      return list;
    }
    throw new SyntaxException(what, describe(expr), expr.position());
  }

  private static Symbol symbol(SExpr expr) {
    if (expr instanceof SymbolAtom atom && !atom.symbol().isReserved()) {
      return atom.symbol();
    }
    throw new SyntaxException("symbol", describe(expr), expr.position());
  }

  private static Keyword keyword(SExpr expr) {
    if (expr instanceof KeywordAtom atom) {
      return atom.keyword();
    }
    throw new SyntaxException("keyword", describe(expr), expr.position());
  }

  private static NumeralLiteral numeral(SExpr expr) {
    if (expr instanceof ConstantAtom atom
        && atom.constant() instanceof NumeralLiteral numeral
        && numeral.form() == NumeralLiteral.Form.NUMERAL) {
      return numeral;
    }
    throw new SyntaxException("numeral", describe(expr), expr.position());
  }

  private static StringLiteral string(SExpr expr) {
    if (expr instanceof ConstantAtom atom && atom.constant() instanceof StringLiteral string) {
      return string;
    }
    throw new SyntaxException("string literal", describe(expr), expr.position());
  }

  private static boolean isReserved(SExpr expr, String word) {
    return expr instanceof SymbolAtom atom
        && atom.symbol().isReserved()
        && atom.symbol().name().equals(word);
  }

  private static void expectSize(ListExpr list, int size, String form) {
    if (list.size() != size) {
      throw new SyntaxException(
          (size - 1) + " argument(s) for " + form,
          String.valueOf(list.size() - 1),
          list.position());
    }
  }

  private static void expectSizeBetween(ListExpr list, int min, int max, String form) {
    if (list.size() < min || list.size() > max) {
      throw new SyntaxException(
          (min - 1) + " to " + (max - 1) + " argument(s) for " + form,
          String.valueOf(list.size() - 1),
          list.position());
    }
  }

  static String describe(SExpr expr) {
    if (expr instanceof SymbolAtom atom) {
      return "symbol '" + atom.symbol().lexeme() + "'";
    }
    if (expr instanceof KeywordAtom atom) {
      return "keyword '" + atom.keyword().lexeme() + "'";
    }
    if (expr instanceof ConstantAtom atom) {
      return "constant '" + atom.constant().lexeme() + "'";
    }
    ListExpr list = (ListExpr) expr;
    return list.isEmpty() ? "()" : "list of " + list.size() + " element(s)";
  }
}
