package smt2utils.analysis;

/** Enumerates structured reasons why part of a trace was skipped or flagged. */
public enum TraceDiagnosticReason {
  MALFORMED_LINE,
  GRAPH_INTEGRITY,
  UNMATCHED_INSTANCE,
  UNEXPECTED_END_OF_INSTANCE,
  UNSUPPORTED_TOOL_VERSION;
}
