package smt2utils.analysis;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import smt2utils.cost.InstantiationCostModel;
import smt2utils.graph.GraphDelta;
import smt2utils.graph.GraphIntegrityException;
import smt2utils.graph.TermGraphBuilder;
import smt2utils.trace.Ident;
import smt2utils.trace.TraceEvent;
import smt2utils.trace.TraceOptions;
import smt2utils.trace.TraceParseException;
import smt2utils.trace.TraceReader;

/**
 * Drives a trace log through the event parser, the term graph builder and the instantiation
 * cost model.
 *
 * <p>Matches ({@code new-match}, {@code inst-discovered}) are held by key until an {@code
 * instance} line selects one. Terms created until the matching {@code end-of-instance} are the
 * instance's produced terms. An instance still open when the next one starts, or when the log
 * ends, is recorded as it stands. Matches registered inside a scope are dropped when a {@code pop}
 * leaves that scope.
 *
 * <p>By default malformed lines and graph violations become {@link TraceDiagnostic}s and the
 * analysis continues with the next line. With {@link TraceOptions#strict()} the first one is
 * rethrown.
 */
public final class TraceAnalyzer {
  private static final Logger LOG = LoggerFactory.getLogger(TraceAnalyzer.class);
  private static final String SUPPORTED_TOOL = "Z3";
  private static final int MIN_MAJOR = 4;
  private static final int MIN_MINOR = 8;

  private final TraceOptions options;

  public TraceAnalyzer() {
    this(TraceOptions.defaults());
  }

  public TraceAnalyzer(TraceOptions options) {
    this.options = TraceOptions.normalize(options);
  }

  public TraceAnalysis analyze(Reader input) throws IOException {
    return analyze(new TraceReader(input));
  }

  public TraceAnalysis analyze(CharSequence text) throws IOException {
    return analyze(TraceReader.of(text));
  }

  /**
   * Consumes {@code reader} to its end.
   *
   * @throws TraceParseException in strict mode, for the first malformed line
   * @throws GraphIntegrityException in strict mode, for the first graph violation
   */
  public TraceAnalysis analyze(TraceReader reader) throws IOException {
    Objects.requireNonNull(reader, "reader");
    return new Session(reader).run();
  }

  private final class Session {
    private final TraceReader reader;
    private final TermGraphBuilder builder = new TermGraphBuilder();
    private final InstantiationCostModel costs;
    private final Map<Long, PendingMatch> pendingMatches = new HashMap<>();
    private final Map<String, Long> eventCounts = new HashMap<>();
    private final List<String> queryResults = new ArrayList<>();
    private final List<TraceDiagnostic> diagnostics = new ArrayList<>();
    private OpenInstance open;
    private String toolVersion;
    private long events;
    private long conflicts;
    private long pushes;
    private long pops;
    private long checks;
    private long diagnosticCount;
    private int depth;

    Session(TraceReader reader) {
      this.reader = reader;
      this.costs = new InstantiationCostModel(builder.graph(), options.maxCostTraversal());
    }

    TraceAnalysis run() throws IOException {
      long start = System.nanoTime();
      while (true) {
        Optional<TraceEvent> next;
        try {
          next = reader.nextEvent();
        } catch (TraceParseException ex) {
          if (options.strict()) {
            throw ex;
          }
          report(TraceDiagnostic.malformedLine(ex));
          continue;
        }
        if (next.isEmpty()) {
          break;
        }
        TraceEvent event = next.get();
        events++;
        eventCounts.merge(event.kind().tag(), 1L, Long::sum);
        try {
          handle(event);
        } catch (GraphIntegrityException ex) {
          if (options.strict()) {
            throw ex;
          }
          report(TraceDiagnostic.graphIntegrity(ex));
        }
      }
      closeInstance();
      long elapsedMillis = (System.nanoTime() - start) / 1_000_000;
      TraceAnalysis analysis =
          new TraceAnalysis(
              toolVersion,
              reader.lineNumber(),
              events,
              eventCounts,
              conflicts,
              pushes,
              pops,
              checks,
              queryResults,
              builder.graph(),
              builder.creationEvents(),
              builder.graph().classCount(),
              costs.instantiationCount(),
              costs.totalCost(),
              costs.report(),
              diagnostics,
              diagnosticCount,
              elapsedMillis);
      LOG.info(
          "Analyzed {} lines: {} nodes from {} term events, {} instantiations, {} diagnostics",
          analysis.lineCount(),
          builder.graph().nodeCount(),
          analysis.creationEvents(),
          analysis.instantiations(),
          diagnosticCount);
      return analysis;
    }

    private void handle(TraceEvent event) {
      GraphDelta delta = builder.ingest(event);
      if (open != null && delta.kind() == GraphDelta.Kind.CREATED) {
        open.produced.add(delta.nodeId());
      }
      if (event instanceof TraceEvent.ToolVersion version) {
        checkVersion(version);
      } else if (event instanceof TraceEvent.NewMatch match) {
        registerMatch(match, match.key(), match.quantifier(), match.bindings());
      } else if (event instanceof TraceEvent.InstDiscovered discovered) {
        registerMatch(
            discovered, discovered.key(), discovered.quantifier(), discovered.bindings());
      } else if (event instanceof TraceEvent.Instance instance) {
        closeInstance();
        PendingMatch match = pendingMatches.remove(instance.key());
        if (match == null) {
          report(TraceDiagnostic.unmatchedInstance(instance.line(), instance.key()));
        } else {
          open = new OpenInstance(match, instance);
        }
      } else if (event instanceof TraceEvent.EndOfInstance end) {
        if (open == null) {
          report(TraceDiagnostic.unexpectedEndOfInstance(end.line()));
        } else {
          closeInstance();
        }
      } else if (event instanceof TraceEvent.Conflict) {
        conflicts++;
      } else if (event instanceof TraceEvent.Push) {
        pushes++;
        depth++;
      } else if (event instanceof TraceEvent.Pop pop) {
        pops++;
        depth = Math.max(0, depth - pop.levels());
        dropMatchesAbove(depth);
      } else if (event instanceof TraceEvent.BeginCheck) {
        checks++;
      } else if (event instanceof TraceEvent.QueryDone done) {
        queryResults.add(done.result());
      }
    }

    private void registerMatch(
        TraceEvent event, long key, Ident quantifier, List<Ident> bindingIdents) {
      int quantifierId = builder.resolve(event.line(), quantifier);
      List<Integer> bindings = new ArrayList<>(bindingIdents.size());
      for (Ident binding : bindingIdents) {
        bindings.add(builder.resolve(event.line(), binding));
      }
      pendingMatches.put(key, new PendingMatch(quantifierId, bindings, depth));
    }

    private void dropMatchesAbove(int scope) {
      int before = pendingMatches.size();
      pendingMatches.values().removeIf(match -> match.depth() > scope);
      if (pendingMatches.size() < before) {
        LOG.debug(
            "Dropped {} pending matches above scope {}", before - pendingMatches.size(), scope);
      }
    }

    private void closeInstance() {
      if (open == null) {
        return;
      }
      costs.recordInstantiation(
          open.match.quantifierId(), open.match.bindings(), open.instance, open.produced);
      open = null;
    }

    private void checkVersion(TraceEvent.ToolVersion version) {
      toolVersion = version.tool() + " " + version.version();
      if (options.skipVersionCheck() || isSupported(version)) {
        return;
      }
      report(
          TraceDiagnostic.unsupportedToolVersion(
              version.line(), version.tool(), version.version()));
    }

    private boolean isSupported(TraceEvent.ToolVersion version) {
      if (!SUPPORTED_TOOL.equals(version.tool())) {
        return false;
      }
      String[] parts = version.version().split("\\.");
      try {
        int major = Integer.parseInt(parts[0]);
        int minor = parts.length > 1 ? Integer.parseInt(parts[1]) : 0;
        return major > MIN_MAJOR || (major == MIN_MAJOR && minor >= MIN_MINOR);
      } catch (NumberFormatException ex) {
        LOG.debug("Unreadable tool version '{}'", version.version(), ex);
        return false;
      }
    }

    private void report(TraceDiagnostic diagnostic) {
      diagnosticCount++;
      if (diagnosticCount <= options.warnLimit()) {
        LOG.warn("Trace diagnostic: {}", diagnostic.message());
      } else {
        LOG.debug("Trace diagnostic: {}", diagnostic.message());
      }
      if (diagnostics.size() < options.maxDiagnostics()) {
        diagnostics.add(diagnostic);
      }
    }
  }

  private record PendingMatch(int quantifierId, List<Integer> bindings, int depth) {}

  private static final class OpenInstance {
    private final PendingMatch match;
    private final TraceEvent.Instance instance;
    private final List<Integer> produced = new ArrayList<>();

    private OpenInstance(PendingMatch match, TraceEvent.Instance instance) {
      this.match = match;
      this.instance = instance;
    }
  }
}
