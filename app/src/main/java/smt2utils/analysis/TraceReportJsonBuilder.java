package smt2utils.analysis;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import smt2utils.cost.QuantifierCost;
import smt2utils.graph.TermGraphView;
import smt2utils.graph.TermNode;

/** Renders a {@link TraceAnalysis} as the JSON document handed to report renderers. */
public final class TraceReportJsonBuilder {
  private static final String VERSION = "1.0.0";
  private static final int DEFAULT_TOP = 20;
  private static final int RENDER_DEPTH = 3;

  private final Gson gson = new GsonBuilder().setPrettyPrinting().serializeNulls().create();
  private final int top;

  public TraceReportJsonBuilder() {
    this(DEFAULT_TOP);
  }

  /** @param top number of quantifiers listed in each ranking */
  public TraceReportJsonBuilder(int top) {
    if (top < 0) {
      throw new IllegalArgumentException("top must be non-negative: " + top);
    }
    this.top = top;
  }

  public String build(TraceAnalysis analysis) {
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("meta", meta(analysis));
    root.put("graph", graph(analysis));
    root.put("solver", solver(analysis));
    root.put("events", analysis.sortedEventCounts());
    root.put("costliest_quantifiers", quantifiers(analysis, analysis.costs()));
    root.put(
        "most_instantiated_quantifiers",
        quantifiers(analysis, analysis.mostInstantiated(top)));
    if (analysis.hasDiagnostics()) {
      root.put("diagnostics", diagnosticSummaries(analysis));
    }
    return gson.toJson(root);
  }

  private Map<String, Object> meta(TraceAnalysis analysis) {
    Map<String, Object> meta = new LinkedHashMap<>();
    meta.put("version", VERSION);
    meta.put("tool_version", analysis.toolVersion());
    meta.put("time_ms", analysis.elapsedMillis());
    meta.put("lines", analysis.lineCount());
    meta.put("events", analysis.eventCount());
    return meta;
  }

  private Map<String, Object> graph(TraceAnalysis analysis) {
    Map<String, Object> graph = new LinkedHashMap<>();
    graph.put("nodes", analysis.graph().nodeCount());
    graph.put("creation_events", analysis.creationEvents());
    graph.put("equivalence_classes", analysis.classCount());
    return graph;
  }

  private Map<String, Object> solver(TraceAnalysis analysis) {
    Map<String, Object> solver = new LinkedHashMap<>();
    solver.put("conflicts", analysis.conflicts());
    solver.put("pushes", analysis.pushes());
    solver.put("pops", analysis.pops());
    solver.put("checks", analysis.checks());
    solver.put("query_results", analysis.queryResults());
    solver.put("instantiations", analysis.instantiations());
    solver.put("total_cost", analysis.totalCost());
    return solver;
  }

  private List<Map<String, Object>> quantifiers(TraceAnalysis analysis, List<QuantifierCost> rows) {
    TermGraphView graph = analysis.graph();
    List<Map<String, Object>> list = new ArrayList<>();
    for (QuantifierCost row : rows.subList(0, Math.min(top, rows.size()))) {
      TermNode node = graph.node(row.quantifierId());
      Map<String, Object> map = new LinkedHashMap<>();
      map.put("id", row.quantifierId());
      map.put("name", node.label());
      map.put("count", row.count());
      map.put("cost", row.cost());
      map.put("term", graph.render(row.quantifierId(), RENDER_DEPTH));
      list.add(map);
    }
    return list;
  }

  private List<Map<String, Object>> diagnosticSummaries(TraceAnalysis analysis) {
    List<Map<String, Object>> summaries = new ArrayList<>();
    for (TraceDiagnostic diagnostic : analysis.diagnostics()) {
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("line", diagnostic.line());
      entry.put("reason", diagnostic.reason().name().toLowerCase(Locale.ROOT));
      entry.put("message", diagnostic.message());
      if (!diagnostic.attributes().isEmpty()) {
        entry.put("attributes", diagnostic.attributes());
      }
      summaries.add(entry);
    }
    if (analysis.diagnosticCount() > analysis.diagnostics().size()) {
      Map<String, Object> omitted = new LinkedHashMap<>();
      omitted.put("reason", "omitted");
      omitted.put("count", analysis.diagnosticCount() - analysis.diagnostics().size());
      summaries.add(omitted);
    }
    return summaries;
  }
}
