package smt2utils.trace;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import org.junit.jupiter.api.Test;

final class TraceReaderTest {

  @Test
  void skipsBlankLinesAndCountsPhysicalLines() throws IOException {
    TraceReader reader = TraceReader.of("[push] 1\n\n   \n[pop] 1 0\n");
    assertEquals(1, reader.nextEvent().orElseThrow().line(), "First event on line 1");
    assertEquals(4, reader.nextEvent().orElseThrow().line(), "Blank lines still count");
    assertTrue(reader.nextEvent().isEmpty(), "End of stream");
    assertEquals(4, reader.lineNumber(), "Four physical lines");
    assertTrue(reader.nextEvent().isEmpty(), "End of stream is sticky");
  }

  @Test
  void continuesAfterMalformedLine() throws IOException {
    TraceReader reader = TraceReader.of("[push] 1\ngarbage\n[eof]");
    reader.nextEvent();
    TraceParseException error = assertThrows(TraceParseException.class, reader::nextEvent);
    assertEquals(2, error.line(), "Error reported on line 2");
    TraceEvent next = reader.nextEvent().orElseThrow();
    assertEquals(TraceEventKind.EOF, next.kind(), "Reader has moved past the bad line");
  }
}
