package smt2utils.graph;

import java.util.Objects;

/**
 * Effect of ingesting one event.
 *
 * @param nodeId affected node, or -1 when the event touched no node
 * @param otherId node merged with {@code nodeId}, or -1
 */
public record GraphDelta(Kind kind, int nodeId, int otherId) {
  private static final GraphDelta NONE = new GraphDelta(Kind.UNCHANGED, -1, -1);

  public GraphDelta {
    Objects.requireNonNull(kind, "kind");
  }

  public static GraphDelta created(int nodeId) {
    return new GraphDelta(Kind.CREATED, nodeId, -1);
  }

  public static GraphDelta deduplicated(int nodeId) {
    return new GraphDelta(Kind.DEDUPLICATED, nodeId, -1);
  }

  public static GraphDelta merged(int nodeId, int otherId) {
    return new GraphDelta(Kind.MERGED, nodeId, otherId);
  }

  public static GraphDelta annotated(int nodeId) {
    return new GraphDelta(Kind.ANNOTATED, nodeId, -1);
  }

  public static GraphDelta unchanged(int nodeId) {
    return new GraphDelta(Kind.UNCHANGED, nodeId, -1);
  }

  public static GraphDelta none() {
    return NONE;
  }

  public enum Kind {
    /** A new node was allocated. */
    CREATED,
    /** The event described an existing node. */
    DEDUPLICATED,
    /** Two equivalence classes were joined. */
    MERGED,
    /** A side table entry was attached to a node. */
    ANNOTATED,
    UNCHANGED
  }
}
