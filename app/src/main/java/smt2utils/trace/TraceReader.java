package smt2utils.trace;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.Objects;
import java.util.Optional;

/**
 * Pull-based reader of trace events, one physical line at a time. Blank lines are skipped.
 *
 * <p>The underlying reader stays owned by the caller. Nothing is buffered beyond the current
 * line, so arbitrarily large logs are read in constant memory.
 */
public final class TraceReader {
  private final BufferedReader input;
  private long lineNumber;
  private boolean finished;

  public TraceReader(Reader input) {
    Objects.requireNonNull(input, "input");
    this.input = input instanceof BufferedReader buffered ? buffered : new BufferedReader(input);
  }

  public static TraceReader of(CharSequence text) {
    return new TraceReader(new StringReader(text.toString()));
  }

  /**
   * Reads the next event.
   *
   * @return the event, or empty at end of stream
   * @throws TraceParseException when the line is malformed; the reader has moved past it
   * @throws IOException when the underlying reader fails
   */
  public Optional<TraceEvent> nextEvent() throws IOException {
    while (!finished) {
      String line = input.readLine();
      if (line == null) {
        finished = true;
        break;
      }
      lineNumber++;
      if (!line.isBlank()) {
        return Optional.of(TraceLineParser.parse(lineNumber, line));
      }
    }
    return Optional.empty();
  }

  /** Number of physical lines consumed so far. */
  public long lineNumber() {
    return lineNumber;
  }
}
