package smt2utils.trace;

/**
 * Configuration for a trace analysis session.
 *
 * @param strict rethrow the first malformed line or graph violation instead of recording it
 * @param skipVersionCheck do not report logs written by an unexpected solver version
 * @param maxCostTraversal node budget of one instantiation cost traversal
 * @param maxDiagnostics number of diagnostics retained; later ones are only counted
 * @param warnLimit number of skipped lines logged at warn level before switching to debug
 */
public record TraceOptions(
    boolean strict,
    boolean skipVersionCheck,
    int maxCostTraversal,
    int maxDiagnostics,
    int warnLimit) {

  public static TraceOptions defaults() {
    return new TraceOptions(false, false, 10_000, 1_000, 20);
  }

  public static TraceOptions strictDefaults() {
    TraceOptions defaults = defaults();
    return new TraceOptions(
        true,
        defaults.skipVersionCheck(),
        defaults.maxCostTraversal(),
        defaults.maxDiagnostics(),
        defaults.warnLimit());
  }

  public static TraceOptions normalize(TraceOptions options) {
    if (options == null) {
      return defaults();
    }
    TraceOptions defaults = defaults();
    int maxCostTraversal =
        options.maxCostTraversal() > 0 ? options.maxCostTraversal() : defaults.maxCostTraversal();
    int maxDiagnostics = Math.max(0, options.maxDiagnostics());
    int warnLimit = Math.max(0, options.warnLimit());
    return new TraceOptions(
        options.strict(), options.skipVersionCheck(), maxCostTraversal, maxDiagnostics, warnLimit);
  }
}
