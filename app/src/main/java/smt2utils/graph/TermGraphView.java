package smt2utils.graph;

import java.util.List;
import java.util.Optional;
import smt2utils.trace.TraceEvent.VarName;

/** Read-only access to a term graph by node id, for reporting. */
public interface TermGraphView {

  int nodeCount();

  /**
   * @throws IndexOutOfBoundsException when {@code id} is not a node id
   */
  TermNode node(int id);

  default List<Integer> arguments(int id) {
    return node(id).arguments();
  }

  /** Representative of the equivalence class of {@code id}. */
  int representative(int id);

  Optional<TermMeaning> meaning(int id);

  List<VarName> variableNames(int id);

  /** Renders {@code id} as an S-expression, eliding subterms below {@code maxDepth}. */
  String render(int id, int maxDepth);
}
