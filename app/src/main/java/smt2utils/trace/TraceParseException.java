package smt2utils.trace;

import java.util.Objects;

/** Malformed trace line. The reader has already moved past it. */
public final class TraceParseException extends RuntimeException {
  private final long line;
  private final Reason reason;

  public TraceParseException(long line, Reason reason, String detail) {
    super("Line " + line + ": " + Objects.requireNonNull(reason, "reason").description()
        + (detail == null || detail.isEmpty() ? "" : " (" + detail + ")"));
    this.line = line;
    this.reason = reason;
  }

  public long line() {
    return line;
  }

  public Reason reason() {
    return reason;
  }

  /** Why a line was rejected. */
  public enum Reason {
    MISSING_TAG("line does not start with a [tag]"),
    UNKNOWN_TAG("unknown event tag"),
    MISSING_FIELD("missing field"),
    UNEXPECTED_FIELD("unexpected trailing field"),
    MALFORMED_IDENT("malformed term identifier"),
    MALFORMED_NUMBER("malformed number"),
    MALFORMED_KEY("malformed match key"),
    MALFORMED_LITERAL("malformed literal"),
    MALFORMED_SYMBOL("malformed symbol"),
    MALFORMED_EXPLANATION("malformed equality explanation");

    private final String description;

    Reason(String description) {
      this.description = description;
    }

    public String description() {
      return description;
    }
  }
}
