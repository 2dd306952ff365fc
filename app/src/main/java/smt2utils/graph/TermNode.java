package smt2utils.graph;

import java.util.List;
import java.util.Objects;
import smt2utils.model.Symbol;

/**
 * Immutable vertex of the term graph.
 *
 * @param id dense node id, assigned once
 * @param kind term kind
 * @param symbol function symbol, quantifier name or proof rule; {@code null} for variables
 * @param arguments ids of argument nodes; for binders the patterns followed by the body, for
 *     proofs the premises followed by the conclusion
 * @param variableCount number of bound variables of a binder, the index of a variable, else 0
 * @param createdAt line of the event that created the node
 */
public record TermNode(
    int id,
    TermKind kind,
    Symbol symbol,
    List<Integer> arguments,
    int variableCount,
    long createdAt) {

  public TermNode {
    Objects.requireNonNull(kind, "kind");
    arguments = List.copyOf(Objects.requireNonNull(arguments, "arguments"));
    if (kind != TermKind.VAR) {
      Objects.requireNonNull(symbol, "symbol");
    }
  }

  public StructuralKey key() {
    return new StructuralKey(kind, symbol, arguments, variableCount);
  }

  /** Label used when rendering the node. */
  public String label() {
    return kind == TermKind.VAR ? "?" + variableCount : symbol.name();
  }
}
