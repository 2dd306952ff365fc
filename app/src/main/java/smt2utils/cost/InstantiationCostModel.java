package smt2utils.cost;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import smt2utils.graph.TermGraphView;
import smt2utils.trace.TraceEvent;

/**
 * Per-quantifier instantiation accounting over a term graph.
 *
 * <p>The cost of an instantiation is the number of nodes reachable from its produced terms that
 * were created at or after the triggering event. The breadth-first traversal stops at nodes
 * that already existed, since those are shared structure, and visits at most {@code
 * maxTraversal} nodes.
 */
public final class InstantiationCostModel {
  private static final Logger LOG = LoggerFactory.getLogger(InstantiationCostModel.class);

  /** Descending cost, then ascending quantifier id. */
  public static final Comparator<QuantifierCost> BY_COST =
      Comparator.comparingLong(QuantifierCost::cost)
          .reversed()
          .thenComparingInt(QuantifierCost::quantifierId);

  /** Descending count, then ascending quantifier id. */
  public static final Comparator<QuantifierCost> BY_COUNT =
      Comparator.comparingLong(QuantifierCost::count)
          .reversed()
          .thenComparingInt(QuantifierCost::quantifierId);

  private final TermGraphView graph;
  private final int maxTraversal;
  private final List<InstantiationRecord> records = new ArrayList<>();
  private final Map<Integer, long[]> totals = new LinkedHashMap<>();
  private long truncatedTraversals;

  public InstantiationCostModel(TermGraphView graph, int maxTraversal) {
    this.graph = Objects.requireNonNull(graph, "graph");
    if (maxTraversal <= 0) {
      throw new IllegalArgumentException("maxTraversal must be positive: " + maxTraversal);
    }
    this.maxTraversal = maxTraversal;
  }

  /**
   * Appends one instantiation and updates the running totals of its quantifier.
   *
   * @param producedTerms nodes the instantiation created; the cost traversal starts here
   */
  public InstantiationRecord recordInstantiation(
      int quantifierId,
      List<Integer> bindings,
      TraceEvent triggeringEvent,
      List<Integer> producedTerms) {
    if (quantifierId < 0 || quantifierId >= graph.nodeCount()) {
      throw new IllegalArgumentException("Unknown quantifier node " + quantifierId);
    }
    Objects.requireNonNull(triggeringEvent, "triggeringEvent");
    long cost = cost(producedTerms, triggeringEvent.line());
    InstantiationRecord record =
        new InstantiationRecord(quantifierId, bindings, triggeringEvent, producedTerms, cost);
    records.add(record);
    long[] total = totals.computeIfAbsent(quantifierId, id -> new long[2]);
    total[0]++;
    total[1] += cost;
    LOG.trace(
        "Instantiation of {} at line {} cost {}", quantifierId, triggeringEvent.line(), cost);
    return record;
  }

  private long cost(List<Integer> producedTerms, long since) {
    Set<Integer> visited = new HashSet<>();
    Deque<Integer> queue = new ArrayDeque<>();
    for (Integer term : producedTerms) {
      if (isNew(term, since) && visited.add(term)) {
        queue.add(term);
      }
    }
    long count = 0;
    while (!queue.isEmpty()) {
      if (count == maxTraversal) {
        truncatedTraversals++;
        break;
      }
      int current = queue.poll();
      count++;
      for (int argument : graph.arguments(current)) {
        if (isNew(argument, since) && visited.add(argument)) {
          queue.add(argument);
        }
      }
    }
    return count;
  }

  private boolean isNew(int id, long since) {
    return graph.node(id).createdAt() >= since;
  }

  /** Totals per quantifier, by descending cost and then ascending quantifier id. */
  public List<QuantifierCost> report() {
    return sorted(BY_COST);
  }

  /** The {@code limit} most instantiated quantifiers. */
  public List<QuantifierCost> mostInstantiated(int limit) {
    if (limit < 0) {
      throw new IllegalArgumentException("limit must be non-negative: " + limit);
    }
    List<QuantifierCost> rows = sorted(BY_COUNT);
    return rows.subList(0, Math.min(limit, rows.size()));
  }

  private List<QuantifierCost> sorted(Comparator<QuantifierCost> order) {
    List<QuantifierCost> rows = new ArrayList<>(totals.size());
    for (Map.Entry<Integer, long[]> entry : totals.entrySet()) {
      rows.add(new QuantifierCost(entry.getKey(), entry.getValue()[0], entry.getValue()[1]));
    }
    rows.sort(order);
    return Collections.unmodifiableList(rows);
  }

  public List<InstantiationRecord> records() {
    return Collections.unmodifiableList(records);
  }

  public long instantiationCount() {
    return records.size();
  }

  public long totalCost() {
    long sum = 0;
    for (long[] total : totals.values()) {
      sum += total[1];
    }
    return sum;
  }

  /** Traversals that stopped at the node budget. */
  public long truncatedTraversals() {
    return truncatedTraversals;
  }
}
