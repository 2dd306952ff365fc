package smt2utils.graph;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import smt2utils.model.Symbol;
import smt2utils.model.SymbolTable;
import smt2utils.trace.Ident;
import smt2utils.trace.TraceEvent;

/**
 * Folds trace events into a {@link TermGraph}.
 *
 * <p>Raw trace identifiers are bound to node ids as terms are defined. The solver reuses
 * identifiers after a scope is popped, so a later definition rebinds the identifier; nodes
 * themselves are never replaced. Every event is checked in full before the graph is touched:
 * a rejected event leaves no trace.
 */
public final class TermGraphBuilder {
  private static final Logger LOG = LoggerFactory.getLogger(TermGraphBuilder.class);

  private final TermGraph graph = new TermGraph();
  private final SymbolTable symbols;
  private final Map<Ident, Integer> bindings = new HashMap<>();
  private long creationEvents;

  public TermGraphBuilder() {
    this(new SymbolTable());
  }

  public TermGraphBuilder(SymbolTable symbols) {
    this.symbols = Objects.requireNonNull(symbols, "symbols");
  }

  /**
   * Applies {@code event} to the graph.
   *
   * @throws GraphIntegrityException when the event references an undefined term or the term it
   *     defines; the graph is left unchanged
   */
  public GraphDelta ingest(TraceEvent event) {
    Objects.requireNonNull(event, "event");
    if (event instanceof TraceEvent.MkApp app) {
      List<Integer> arguments = resolveAll(app.line(), app.id(), app.arguments());
      return define(
          app.id(), graph.intern(TermKind.APP, symbol(app.name()), arguments, 0, app.line()));
    }
    if (event instanceof TraceEvent.MkVar variable) {
      return define(
          variable.id(),
          graph.intern(TermKind.VAR, null, List.of(), variable.index(), variable.line()));
    }
    if (event instanceof TraceEvent.MkQuant quant) {
      List<Ident> terms = new ArrayList<>(quant.patterns());
      terms.add(quant.body());
      List<Integer> arguments = resolveAll(quant.line(), quant.id(), terms);
      TermKind kind = quant.lambda() ? TermKind.LAMBDA : TermKind.QUANT;
      return define(
          quant.id(),
          graph.intern(
              kind, symbol(quant.name()), arguments, quant.variableCount(), quant.line()));
    }
    if (event instanceof TraceEvent.MkProof proof) {
      List<Ident> terms = new ArrayList<>(proof.premises());
      terms.add(proof.conclusion());
      List<Integer> arguments = resolveAll(proof.line(), proof.id(), terms);
      return define(
          proof.id(),
          graph.intern(TermKind.PROOF, symbol(proof.rule()), arguments, 0, proof.line()));
    }
    if (event instanceof TraceEvent.AttachMeaning meaning) {
      int id = resolve(meaning.line(), meaning.id());
      graph.attachMeaning(
          id, new TermMeaning(meaning.theory(), meaning.payload(), meaning.numeral()));
      return GraphDelta.annotated(id);
    }
    if (event instanceof TraceEvent.AttachVarNames names) {
      int id = resolve(names.line(), names.id());
      graph.attachVariableNames(id, names.names());
      return GraphDelta.annotated(id);
    }
    if (event instanceof TraceEvent.AttachEnode enode) {
      return GraphDelta.unchanged(resolve(enode.line(), enode.id()));
    }
    if (event instanceof TraceEvent.EqExpl equality) {
      return merge(equality);
    }
    return GraphDelta.none();
  }

  private GraphDelta merge(TraceEvent.EqExpl equality) {
    int id = resolve(equality.line(), equality.id());
    if (equality.isRoot()) {
      return GraphDelta.unchanged(id);
    }
    for (Ident evidence : equality.evidence()) {
      resolve(equality.line(), evidence);
    }
    int target = resolve(equality.line(), equality.target());
    GraphDelta delta = graph.merge(id, target);
    LOG.trace("Line {}: {} ~ {} ({})", equality.line(), id, target, delta.kind());
    return delta;
  }

  private GraphDelta define(Ident ident, GraphDelta delta) {
    creationEvents++;
    bindings.put(ident, delta.nodeId());
    return delta;
  }

  private List<Integer> resolveAll(long line, Ident defined, List<Ident> references) {
    List<Integer> ids = new ArrayList<>(references.size());
    for (Ident reference : references) {
      if (reference.equals(defined)) {
        throw new GraphIntegrityException(
            line, GraphIntegrityException.Reason.SELF_REFERENCE, reference);
      }
      ids.add(resolve(line, reference));
    }
    return ids;
  }

  /**
   * Node currently bound to {@code ident}.
   *
   * @throws GraphIntegrityException when {@code ident} has not been defined
   */
  public int resolve(long line, Ident ident) {
    Integer id = bindings.get(ident);
    if (id == null) {
      throw new GraphIntegrityException(line, GraphIntegrityException.Reason.UNKNOWN_TERM, ident);
    }
    return id;
  }

  public OptionalInt lookup(Ident ident) {
    Integer id = bindings.get(ident);
    return id == null ? OptionalInt.empty() : OptionalInt.of(id);
  }

  private Symbol symbol(String name) {
    return symbols.intern(name);
  }

  public TermGraph graph() {
    return graph;
  }

  /** Number of accepted term-creating events; never less than the node count. */
  public long creationEvents() {
    return creationEvents;
  }
}
