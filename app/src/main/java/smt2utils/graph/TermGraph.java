package smt2utils.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import smt2utils.model.Symbol;
import smt2utils.trace.TraceEvent.VarName;

/**
 * Append-only, structurally deduplicated term graph with equivalence classes layered on top.
 *
 * <p>Nodes are never removed or modified, so node ids stay valid for the lifetime of the graph.
 * Equalities only join classes in {@link EquivalenceClasses}; node identity is untouched.
 */
public final class TermGraph implements TermGraphView {
  private static final String ELIDED = "...";

  private final List<TermNode> nodes = new ArrayList<>();
  private final Map<StructuralKey, Integer> byKey = new HashMap<>();
  private final EquivalenceClasses classes = new EquivalenceClasses();
  private final Map<Integer, TermMeaning> meanings = new HashMap<>();
  private final Map<Integer, List<VarName>> variableNames = new HashMap<>();

  /** Returns the node with this shape, allocating it if it is new. Arguments must exist. */
  GraphDelta intern(
      TermKind kind, Symbol symbol, List<Integer> arguments, int variableCount, long line) {
    StructuralKey key = new StructuralKey(kind, symbol, arguments, variableCount);
    Integer existing = byKey.get(key);
    if (existing != null) {
      return GraphDelta.deduplicated(existing);
    }
    int id = classes.add();
    nodes.add(new TermNode(id, kind, symbol, key.arguments(), variableCount, line));
    byKey.put(key, id);
    return GraphDelta.created(id);
  }

  GraphDelta merge(int a, int b) {
    return classes.union(a, b) ? GraphDelta.merged(a, b) : GraphDelta.unchanged(a);
  }

  void attachMeaning(int id, TermMeaning meaning) {
    checkId(id);
    meanings.put(id, meaning);
  }

  void attachVariableNames(int id, List<VarName> names) {
    checkId(id);
    variableNames.put(id, List.copyOf(names));
  }

  public Optional<Integer> find(StructuralKey key) {
    return Optional.ofNullable(byKey.get(key));
  }

  @Override
  public int nodeCount() {
    return nodes.size();
  }

  @Override
  public TermNode node(int id) {
    checkId(id);
    return nodes.get(id);
  }

  @Override
  public int representative(int id) {
    return classes.find(id);
  }

  @Override
  public Optional<TermMeaning> meaning(int id) {
    checkId(id);
    return Optional.ofNullable(meanings.get(id));
  }

  @Override
  public List<VarName> variableNames(int id) {
    checkId(id);
    return variableNames.getOrDefault(id, List.of());
  }

  public int classCount() {
    return classes.classCount();
  }

  public boolean sameClass(int a, int b) {
    return classes.same(a, b);
  }

  @Override
  public String render(int id, int maxDepth) {
    checkId(id);
    StringBuilder out = new StringBuilder();
    Deque<Object> work = new ArrayDeque<>();
    work.push(new Pending(id, 0));
    while (!work.isEmpty()) {
      Object item = work.pop();
      if (item instanceof String text) {
        out.append(text);
        continue;
      }
      Pending pending = (Pending) item;
      TermNode node = nodes.get(pending.id());
      if (node.arguments().isEmpty()) {
        out.append(node.label());
        continue;
      }
      if (pending.depth() >= maxDepth) {
        out.append(ELIDED);
        continue;
      }
      out.append('(').append(node.label());
      work.push(")");
      List<Integer> arguments = node.arguments();
      for (int i = arguments.size() - 1; i >= 0; i--) {
        work.push(new Pending(arguments.get(i), pending.depth() + 1));
        work.push(" ");
      }
    }
    return out.toString();
  }

  private void checkId(int id) {
    if (id < 0 || id >= nodes.size()) {
      throw new IndexOutOfBoundsException("Unknown node id " + id + " of " + nodes.size());
    }
  }

  private record Pending(int id, int depth) {}
}
