package smt2utils.cost;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;
import smt2utils.graph.TermGraphBuilder;
import smt2utils.trace.TraceEvent;
import smt2utils.trace.TraceLineParser;

final class InstantiationCostModelTest {
  private static final int Q1 = 3;
  private static final int Q2 = 4;

  @Test
  void costCountsOnlyNodesCreatedSinceTheTrigger() {
    TermGraphBuilder builder = graph();
    InstantiationCostModel model = new InstantiationCostModel(builder.graph(), 100);
    assertEquals(
        1, model.recordInstantiation(Q1, List.of(0), trigger(6), List.of(5)).cost(), "p(a)");
    assertEquals(
        2, model.recordInstantiation(Q2, List.of(0), trigger(7), List.of(7)).cost(), "h(g(a))");
    assertEquals(
        1, model.recordInstantiation(Q2, List.of(0), trigger(7), List.of(6)).cost(), "g(a)");
    assertEquals(3, model.instantiationCount(), "Three instantiations");
    assertEquals(4, model.totalCost(), "Sum of all costs");
  }

  @Test
  void reportOrdersByCostThenId() {
    InstantiationCostModel model = new InstantiationCostModel(graph().graph(), 100);
    model.recordInstantiation(Q1, List.of(), trigger(6), List.of(5));
    model.recordInstantiation(Q2, List.of(), trigger(7), List.of(7));
    model.recordInstantiation(Q2, List.of(), trigger(7), List.of(6));
    assertEquals(
        List.of(new QuantifierCost(Q2, 2, 3), new QuantifierCost(Q1, 1, 1)),
        model.report(),
        "Costliest first");
    assertEquals(
        List.of(new QuantifierCost(Q2, 2, 3)), model.mostInstantiated(1), "Most instantiated");

    InstantiationCostModel tie = new InstantiationCostModel(graph().graph(), 100);
    tie.recordInstantiation(Q2, List.of(), trigger(6), List.of(5));
    tie.recordInstantiation(Q1, List.of(), trigger(7), List.of(6));
    assertEquals(
        List.of(new QuantifierCost(Q1, 1, 1), new QuantifierCost(Q2, 1, 1)),
        tie.report(),
        "Equal costs are ordered by quantifier id");
  }

  @Test
  void reportDoesNotDependOnRecordingOrder() {
    InstantiationCostModel forward = new InstantiationCostModel(graph().graph(), 100);
    forward.recordInstantiation(Q1, List.of(), trigger(6), List.of(5));
    forward.recordInstantiation(Q2, List.of(), trigger(7), List.of(7));
    forward.recordInstantiation(Q2, List.of(), trigger(7), List.of(6));
    InstantiationCostModel backward = new InstantiationCostModel(graph().graph(), 100);
    backward.recordInstantiation(Q2, List.of(), trigger(7), List.of(6));
    backward.recordInstantiation(Q2, List.of(), trigger(7), List.of(7));
    backward.recordInstantiation(Q1, List.of(), trigger(6), List.of(5));
    assertEquals(forward.report(), backward.report(), "Same totals in any order");
  }

  @Test
  void traversalStopsAtTheBudget() {
    InstantiationCostModel model = new InstantiationCostModel(graph().graph(), 1);
    assertEquals(
        1, model.recordInstantiation(Q2, List.of(), trigger(7), List.of(7)).cost(), "Capped");
    assertEquals(1, model.truncatedTraversals(), "Truncation is counted");
  }

  @Test
  void rejectsUnknownQuantifiers() {
    InstantiationCostModel model = new InstantiationCostModel(graph().graph(), 100);
    assertThrows(
        IllegalArgumentException.class,
        () -> model.recordInstantiation(42, List.of(), trigger(6), List.of()),
        "No such node");
    assertThrows(
        IllegalArgumentException.class,
        () -> new InstantiationCostModel(graph().graph(), 0),
        "Budget must be positive");
  }

  /** a, ?0, p(?0), q1, q2 exist before line 6; p(a), g(a) and h(g(a)) appear later. */
  private static TermGraphBuilder graph() {
    TermGraphBuilder builder = new TermGraphBuilder();
    String[] lines = {
      "[mk-app] #1 a",
      "[mk-var] #2 0",
      "[mk-app] #3 p #2",
      "[mk-quant] #4 q1 1 #3",
      "[mk-quant] #5 q2 1 #3",
      "[mk-app] #6 p #1",
      "[mk-app] #7 g #1",
      "[mk-app] #8 h #7"
    };
    for (int i = 0; i < lines.length; i++) {
      builder.ingest(TraceLineParser.parse(i + 1, lines[i]));
    }
    return builder;
  }

  private static TraceEvent trigger(long line) {
    return TraceLineParser.parse(line, "[instance] 0x1");
  }
}
