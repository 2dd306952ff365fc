package smt2utils.vmt;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import smt2utils.concrete.Attribute;
import smt2utils.concrete.Command;
import smt2utils.concrete.Term;
import smt2utils.parser.CommandParser;
import smt2utils.printer.SyntaxPrinter;
import smt2utils.sexpr.SExpr;

/**
 * Transition system in VMT form: an SMT-LIB-2 file whose last three {@code define-fun}s are the
 * initial condition, the transition relation and the invariant property, annotated {@code
 * :init}, {@code :trans} and {@code :invar-property}.
 *
 * <p>The commands before them are sort declarations, variable declarations and relationship
 * definitions. A relationship {@code (define-fun .x () T (! x :next x.next))} pairs a state
 * variable with its next-state copy; {@code (! a :action 0)} marks an action variable.
 */
public final class VmtModel {
  private static final Logger LOG = LoggerFactory.getLogger(VmtModel.class);

  static final String INIT = "init";
  static final String TRANS = "trans";
  static final String PROPERTY = "invar-property";
  static final String NEXT = "next";
  static final String ACTION = "action";

  private final List<Command> sorts;
  private final List<StateVariable> stateVariables;
  private final List<Action> actions;
  private final Term initialCondition;
  private final Term transitionCondition;
  private final Term propertyCondition;

  private VmtModel(
      List<Command> sorts,
      List<StateVariable> stateVariables,
      List<Action> actions,
      Term initialCondition,
      Term transitionCondition,
      Term propertyCondition) {
    this.sorts = List.copyOf(sorts);
    this.stateVariables = List.copyOf(stateVariables);
    this.actions = List.copyOf(actions);
    this.initialCondition = initialCondition;
    this.transitionCondition = transitionCondition;
    this.propertyCondition = propertyCondition;
  }

  public static VmtModel parse(CharSequence input) {
    return checkedFrom(CommandParser.parse(input));
  }

  /**
   * Builds a model from parsed commands.
   *
   * @throws IllegalArgumentException when the commands do not describe a transition system
   */
  public static VmtModel checkedFrom(List<Command> commands) {
    Objects.requireNonNull(commands, "commands");
    int count = commands.size();
    if (count <= 3) {
      throw new IllegalArgumentException(
          "A VMT model needs more than 3 commands, found " + count);
    }
    Term property = component(commands.get(count - 1), PROPERTY);
    Term transition = component(commands.get(count - 2), TRANS);
    Term initial = component(commands.get(count - 3), INIT);

    Map<String, Command.DeclareFun> declarations = new HashMap<>();
    List<Command> sorts = new ArrayList<>();
    List<Command.DefineFun> relationships = new ArrayList<>();
    for (Command command : commands.subList(0, count - 3)) {
      if (command instanceof Command.DeclareFun declaration) {
        declarations.put(declaration.symbol().name(), declaration);
      } else if (command instanceof Command.DefineFun definition) {
        relationships.add(definition);
      } else if (command instanceof Command.DeclareSort) {
        sorts.add(command);
      } else {
        throw new IllegalArgumentException(
            "Unexpected VMT command: " + SyntaxPrinter.render(command));
      }
    }

    List<StateVariable> stateVariables = new ArrayList<>();
    List<Action> actions = new ArrayList<>();
    for (Command.DefineFun relationship : relationships) {
      Term.Annotated annotated = singleAnnotation(relationship);
      Attribute attribute = annotated.attributes().get(0);
      String subject = variableName(annotated.term(), relationship);
      switch (attribute.keyword().name()) {
        case NEXT -> {
          if (!(attribute.value() instanceof SExpr.SymbolAtom next)) {
            throw new IllegalArgumentException(
                "The :next attribute must name a variable in "
                    + SyntaxPrinter.render(relationship));
          }
          Command.DeclareFun current = declaration(declarations, subject);
          stateVariables.add(
              new StateVariable(current, declaration(declarations, next.symbol().name())));
        }
        case ACTION -> actions.add(new Action(declaration(declarations, subject)));
        default ->
            throw new IllegalArgumentException(
                "Only :next and :action relationships are allowed, found "
                    + attribute.keyword().lexeme());
      }
    }
    VmtModel model =
        new VmtModel(sorts, stateVariables, actions, initial, transition, property);
    LOG.debug(
        "VMT model with {} state variables, {} actions and {} sorts",
        stateVariables.size(),
        actions.size(),
        sorts.size());
    return model;
  }

  /**
   * Unrolls the transition relation {@code length} times. The result asserts the initial
   * condition at step 0, the transition from step {@code i} to {@code i+1} for every {@code i <
   * length} and the negated property at step {@code length}.
   */
  public BmcProblem unroll(int length) {
    if (length < 0) {
      throw new IllegalArgumentException("Unrolling length must be non-negative: " + length);
    }
    Set<String> currentNames = new LinkedHashSet<>();
    stateVariables.forEach(variable -> currentNames.add(variable.currentName().name()));
    actions.forEach(action -> currentNames.add(action.name().name()));
    Map<String, String> nextToCurrent = new LinkedHashMap<>();
    stateVariables.forEach(
        variable -> nextToCurrent.put(variable.nextName().name(), variable.currentName().name()));

    List<Command> definitions = new ArrayList<>();
    List<Term> conditions = new ArrayList<>();
    conditions.add(new StepRenamer(currentNames, nextToCurrent, 0).rewrite(initialCondition));
    for (int step = 0; step < length; step++) {
      StepRenamer renamer = new StepRenamer(currentNames, nextToCurrent, step);
      addDefinitions(definitions, renamer);
      conditions.add(renamer.rewrite(transitionCondition));
    }
    StepRenamer last = new StepRenamer(currentNames, nextToCurrent, length);
    addDefinitions(definitions, last);
    BmcProblem problem =
        new BmcProblem(sorts, definitions, conditions, last.rewrite(propertyCondition));
    LOG.debug("Unrolled {} steps into {} definitions", length, definitions.size());
    return problem;
  }

  private void addDefinitions(List<Command> definitions, StepRenamer renamer) {
    for (StateVariable variable : stateVariables) {
      definitions.add(renamer.rewrite(variable.current()));
    }
    for (Action action : actions) {
      definitions.add(renamer.rewrite(action.declaration()));
    }
  }

  /** Human-readable listing of the model's parts. */
  public String describe() {
    StringBuilder out = new StringBuilder();
    sorts.forEach(sort -> out.append(SyntaxPrinter.render(sort)).append('\n'));
    stateVariables.forEach(
        variable -> out.append(SyntaxPrinter.render(variable.current())).append('\n'));
    actions.forEach(action -> out.append(SyntaxPrinter.render(action.declaration())).append('\n'));
    out.append("INIT: ").append(SyntaxPrinter.render(initialCondition)).append('\n');
    out.append("TRANS: ").append(SyntaxPrinter.render(transitionCondition)).append('\n');
    out.append("PROP: ").append(SyntaxPrinter.render(propertyCondition)).append('\n');
    return out.toString();
  }

  public List<Command> sorts() {
    return sorts;
  }

  public List<StateVariable> stateVariables() {
    return stateVariables;
  }

  public List<Action> actions() {
    return actions;
  }

  public Term initialCondition() {
    return initialCondition;
  }

  public Term transitionCondition() {
    return transitionCondition;
  }

  public Term propertyCondition() {
    return propertyCondition;
  }

  private static Term component(Command command, String attribute) {
    if (command instanceof Command.DefineFun definition
        && definition.definition().body() instanceof Term.Annotated annotated
        && annotated.attributes().size() == 1
        && annotated.attributes().get(0).keyword().name().equals(attribute)) {
      return annotated.term();
    }
    throw new IllegalArgumentException(
        "Ill-formed system component " + SyntaxPrinter.render(command) + ", expected :"
            + attribute + " as attribute");
  }

  private static Term.Annotated singleAnnotation(Command.DefineFun relationship) {
    if (relationship.definition().body() instanceof Term.Annotated annotated
        && annotated.attributes().size() == 1) {
      return annotated;
    }
    throw new IllegalArgumentException(
        "A variable relationship must carry exactly one attribute: "
            + SyntaxPrinter.render(relationship));
  }

  private static String variableName(Term term, Command relationship) {
    if (term instanceof Term.IdentifierTerm identifier
        && !identifier.identifier().isQualified()
        && !identifier.identifier().identifier().isIndexed()) {
      return identifier.identifier().symbol().name();
    }
    throw new IllegalArgumentException(
        "A variable relationship must annotate a variable: " + SyntaxPrinter.render(relationship));
  }

  private static Command.DeclareFun declaration(
      Map<String, Command.DeclareFun> declarations, String name) {
    Command.DeclareFun declaration = declarations.get(name);
    if (declaration == null) {
      throw new IllegalArgumentException("Variable " + name + " is not declared");
    }
    return declaration;
  }
}
