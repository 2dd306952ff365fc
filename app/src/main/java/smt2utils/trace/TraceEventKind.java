package smt2utils.trace;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/** Event tags of the trace log, keyed by the text between the brackets. */
public enum TraceEventKind {
  TOOL_VERSION("tool-version"),
  MK_APP("mk-app"),
  MK_VAR("mk-var"),
  MK_QUANT("mk-quant"),
  MK_LAMBDA("mk-lambda"),
  MK_PROOF("mk-proof"),
  ATTACH_MEANING("attach-meaning"),
  ATTACH_VAR_NAMES("attach-var-names"),
  ATTACH_ENODE("attach-enode"),
  EQ_EXPL("eq-expl"),
  NEW_MATCH("new-match"),
  INST_DISCOVERED("inst-discovered"),
  INSTANCE("instance"),
  END_OF_INSTANCE("end-of-instance"),
  DECIDE_AND_OR("decide-and-or"),
  ASSIGN("assign"),
  CONFLICT("conflict"),
  PUSH("push"),
  POP("pop"),
  BEGIN_CHECK("begin-check"),
  QUERY_DONE("query-done"),
  RESOLVE_LIT("resolve-lit"),
  RESOLVE_PROCESS("resolve-process"),
  EOF("eof");

  private static final Map<String, TraceEventKind> BY_TAG = new HashMap<>();

  static {
    for (TraceEventKind kind : values()) {
      BY_TAG.put(kind.tag, kind);
    }
  }

  private final String tag;

  TraceEventKind(String tag) {
    this.tag = tag;
  }

  public String tag() {
    return tag;
  }

  public static Optional<TraceEventKind> fromTag(String tag) {
    return Optional.ofNullable(BY_TAG.get(tag));
  }

  /** Whether events of this kind define a term. */
  public boolean createsTerm() {
    return this == MK_APP
        || this == MK_VAR
        || this == MK_QUANT
        || this == MK_LAMBDA
        || this == MK_PROOF;
  }
}
