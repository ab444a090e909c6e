package sdcore.graph;

import java.util.List;
import java.util.Optional;

/**
 * A read-only view of one graph level, for algorithms that should run unchanged over a raw hypergraph,
 * a collapsed view or an extracted subgraph.
 * @param <W> the operation weight
 */
public interface Graph<W> {
  /** Boundary inputs visible to the enclosing scope (the captured variables, for a thunk). */
  List<EdgeLike<W>> freeGraphInputs();

  /** Inputs bound by the graph itself (a thunk's own parameters). Empty at the top level. */
  List<EdgeLike<W>> boundGraphInputs();

  /** The edges leaving the graph, in declared order. */
  List<EdgeLike<W>> graphOutputs();

  /** The operations and thunks of this level (not recursive), in a deterministic order. */
  List<NodeLike<W>> nodes();

  /** The thunk owning this graph, or empty at the top level. */
  Optional<ThunkLike<W>> graphBacklink();
}
