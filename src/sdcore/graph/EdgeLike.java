package sdcore.graph;

import java.util.List;
import java.util.Optional;

/**
 * A hyperedge: one producer feeding any number of consumers.
 * @param <W> the operation weight
 */
public interface EdgeLike<W> {
  /** The producing node, or empty for an edge entering from the graph boundary. */
  Optional<NodeLike<W>> source();

  /**
   * The consuming nodes. Consumers may be nested inside thunks deeper than the source.
   * An empty entry stands for a consumer outside the current view, such as a graph output.
   */
  List<Optional<NodeLike<W>>> targets();

  /** The node a selection may pull in to avoid a dangling input. Defaults to the source. */
  default Optional<NodeLike<W>> extendSource() { return source(); }

  /** The nodes a selection may pull in to avoid a dangling output. Defaults to the present targets. */
  default List<NodeLike<W>> extendTargets() {
    return targets().stream().flatMap(Optional::stream).toList();
  }
}
