package smt2utils.analysis;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import smt2utils.cost.InstantiationCostModel;
import smt2utils.cost.QuantifierCost;
import smt2utils.graph.TermGraphView;

/**
 * Outcome of analyzing one trace log.
 *
 * @param toolVersion solver and version named by the log, or {@code null}
 * @param eventCounts number of events per tag, in tag order
 * @param costs per-quantifier totals by descending cost, then ascending id
 * @param diagnostics retained diagnostics, in line order
 * @param diagnosticCount all diagnostics, including those beyond the retention limit
 */
public record TraceAnalysis(
    String toolVersion,
    long lineCount,
    long eventCount,
    Map<String, Long> eventCounts,
    long conflicts,
    long pushes,
    long pops,
    long checks,
    List<String> queryResults,
    TermGraphView graph,
    long creationEvents,
    int classCount,
    long instantiations,
    long totalCost,
    List<QuantifierCost> costs,
    List<TraceDiagnostic> diagnostics,
    long diagnosticCount,
    long elapsedMillis) {

  public TraceAnalysis {
    eventCounts = Map.copyOf(Objects.requireNonNull(eventCounts, "eventCounts"));
    queryResults = List.copyOf(Objects.requireNonNull(queryResults, "queryResults"));
    Objects.requireNonNull(graph, "graph");
    costs = List.copyOf(Objects.requireNonNull(costs, "costs"));
    diagnostics = List.copyOf(Objects.requireNonNull(diagnostics, "diagnostics"));
  }

  /** Event counts ordered by tag. */
  public Map<String, Long> sortedEventCounts() {
    return new TreeMap<>(eventCounts);
  }

  public List<QuantifierCost> mostInstantiated(int limit) {
    List<QuantifierCost> rows = new ArrayList<>(costs);
    rows.sort(InstantiationCostModel.BY_COUNT);
    return List.copyOf(rows.subList(0, Math.min(Math.max(0, limit), rows.size())));
  }

  public boolean hasDiagnostics() {
    return diagnosticCount > 0;
  }
}
