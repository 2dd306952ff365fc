package smt2utils.graph;

import java.util.Objects;
import smt2utils.trace.Ident;

/** Event that would corrupt the term graph. The event was dropped and the graph is unchanged. */
public final class GraphIntegrityException extends RuntimeException {
  private final long line;
  private final Reason reason;
  private final Ident ident;

  public GraphIntegrityException(long line, Reason reason, Ident ident) {
    super("Line " + line + ": " + Objects.requireNonNull(reason, "reason").description() + " "
        + ident);
    this.line = line;
    this.reason = reason;
    this.ident = ident;
  }

  public long line() {
    return line;
  }

  public Reason reason() {
    return reason;
  }

  public Ident ident() {
    return ident;
  }

  public enum Reason {
    UNKNOWN_TERM("reference to undefined term"),
    SELF_REFERENCE("term refers to itself");

    private final String description;

    Reason(String description) {
      this.description = description;
    }

    public String description() {
      return description;
    }
  }
}
