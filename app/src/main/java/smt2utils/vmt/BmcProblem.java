package smt2utils.vmt;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import smt2utils.concrete.Command;
import smt2utils.concrete.QualIdentifier;
import smt2utils.concrete.Term;
import smt2utils.model.Symbol;
import smt2utils.printer.SyntaxPrinter;

/**
 * Bounded-model-checking query obtained by unrolling a {@link VmtModel}. It is satisfiable iff
 * the property can be violated within {@link #steps()} transitions.
 *
 * @param sorts sort declarations of the model, unchanged
 * @param definitions per-step copies of the state and action variables
 * @param initAndTransitions the initial condition at step 0 followed by one transition per step
 * @param property the property at the last step; it is asserted negated
 */
public record BmcProblem(
    List<Command> sorts, List<Command> definitions, List<Term> initAndTransitions, Term property) {

  public BmcProblem {
    sorts = List.copyOf(Objects.requireNonNull(sorts, "sorts"));
    definitions = List.copyOf(Objects.requireNonNull(definitions, "definitions"));
    initAndTransitions =
        List.copyOf(Objects.requireNonNull(initAndTransitions, "initAndTransitions"));
    Objects.requireNonNull(property, "property");
    if (initAndTransitions.isEmpty()) {
      throw new IllegalArgumentException("The initial condition is missing");
    }
  }

  public int steps() {
    return initAndTransitions.size() - 1;
  }

  /** All commands of the query, in the order {@link #toSmtLib2()} prints them. */
  public List<Command> commands() {
    List<Command> commands = new ArrayList<>(sorts);
    commands.addAll(definitions);
    for (Term condition : initAndTransitions) {
      commands.add(new Command.Assert(condition));
    }
    commands.add(
        new Command.Assert(
            new Term.Application(QualIdentifier.simple(Symbol.of("not")), List.of(property))));
    return commands;
  }

  public String toSmtLib2() {
    return commands().stream().map(SyntaxPrinter::render).collect(Collectors.joining("\n"));
  }
}
