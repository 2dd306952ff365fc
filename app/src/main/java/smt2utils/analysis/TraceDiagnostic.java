package smt2utils.analysis;

import java.util.Map;
import java.util.Objects;
import smt2utils.graph.GraphIntegrityException;
import smt2utils.trace.TraceParseException;

/** Structured diagnostic entry describing a trace line that was skipped or looked suspicious. */
public record TraceDiagnostic(
    long line, TraceDiagnosticReason reason, String message, Map<String, Object> attributes) {

  public static final String ATTR_PARSE_REASON = "parseReason";
  public static final String ATTR_INTEGRITY_REASON = "integrityReason";
  public static final String ATTR_TERM = "term";
  public static final String ATTR_KEY = "key";
  public static final String ATTR_TOOL = "tool";
  public static final String ATTR_VERSION = "version";

  public TraceDiagnostic {
    Objects.requireNonNull(reason, "reason");
    Objects.requireNonNull(message, "message");
    attributes = (attributes == null || attributes.isEmpty()) ? Map.of() : Map.copyOf(attributes);
  }

  public static TraceDiagnostic malformedLine(TraceParseException error) {
    return new TraceDiagnostic(
        error.line(),
        TraceDiagnosticReason.MALFORMED_LINE,
        error.getMessage(),
        Map.of(ATTR_PARSE_REASON, error.reason().name()));
  }

  public static TraceDiagnostic graphIntegrity(GraphIntegrityException error) {
    return new TraceDiagnostic(
        error.line(),
        TraceDiagnosticReason.GRAPH_INTEGRITY,
        error.getMessage(),
        Map.of(
            ATTR_INTEGRITY_REASON, error.reason().name(),
            ATTR_TERM, String.valueOf(error.ident())));
  }

  public static TraceDiagnostic unmatchedInstance(long line, long key) {
    String hex = "0x" + Long.toHexString(key);
    return new TraceDiagnostic(
        line,
        TraceDiagnosticReason.UNMATCHED_INSTANCE,
        "Line " + line + ": instance of unknown match " + hex,
        Map.of(ATTR_KEY, hex));
  }

  public static TraceDiagnostic unexpectedEndOfInstance(long line) {
    return new TraceDiagnostic(
        line,
        TraceDiagnosticReason.UNEXPECTED_END_OF_INSTANCE,
        "Line " + line + ": end of instance without an open instance",
        Map.of());
  }

  public static TraceDiagnostic unsupportedToolVersion(long line, String tool, String version) {
    return new TraceDiagnostic(
        line,
        TraceDiagnosticReason.UNSUPPORTED_TOOL_VERSION,
        "Line " + line + ": log written by " + tool + " " + version
            + ", expected Z3 4.8 or later",
        Map.of(ATTR_TOOL, tool, ATTR_VERSION, version));
  }
}
