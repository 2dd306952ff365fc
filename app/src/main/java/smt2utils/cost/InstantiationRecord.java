package smt2utils.cost;

import java.util.List;
import java.util.Objects;
import smt2utils.trace.TraceEvent;

/**
 * One quantifier instantiation.
 *
 * @param quantifierId node id of the instantiated quantifier
 * @param bindings node ids substituted for the bound variables
 * @param trigger event that caused the instantiation
 * @param producedTerms node ids created while the instance was processed
 * @param cost number of new nodes reachable from the produced terms
 */
public record InstantiationRecord(
    int quantifierId,
    List<Integer> bindings,
    TraceEvent trigger,
    List<Integer> producedTerms,
    long cost) {

  public InstantiationRecord {
    bindings = List.copyOf(Objects.requireNonNull(bindings, "bindings"));
    Objects.requireNonNull(trigger, "trigger");
    producedTerms = List.copyOf(Objects.requireNonNull(producedTerms, "producedTerms"));
    if (cost < 0) {
      throw new IllegalArgumentException("Negative cost: " + cost);
    }
  }
}
