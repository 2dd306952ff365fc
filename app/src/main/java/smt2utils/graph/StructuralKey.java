package smt2utils.graph;

import java.util.List;
import java.util.Objects;
import smt2utils.model.Symbol;

/** Shape of a term. Two creation events with equal keys denote the same node. */
public record StructuralKey(
    TermKind kind, Symbol symbol, List<Integer> arguments, int variableCount) {

  public StructuralKey {
    Objects.requireNonNull(kind, "kind");
    arguments = List.copyOf(Objects.requireNonNull(arguments, "arguments"));
  }
}
