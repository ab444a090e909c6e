package sdcore.graph;

import java.util.List;
import java.util.Optional;

/**
 * A node as seen through a {@link Graph}: either an operation or a thunk.
 * Boundary markers are not nodes in this view; they show up as absent edge sources and targets.
 * @param <W> the operation weight
 */
public interface NodeLike<W> {
  enum Kind { Operation, Thunk }

  List<EdgeLike<W>> inputs();

  List<EdgeLike<W>> outputs();

  /** The thunk this node is nested inside, or empty at the top level. */
  Optional<ThunkLike<W>> backlink();

  /** Present iff this node is a thunk in the current view. */
  Optional<ThunkLike<W>> asThunk();

  /** The weight of an operation. Empty for thunks, including thunks folded into an opaque operation. */
  Optional<W> weight();

  default Kind kind() { return asThunk().isPresent() ? Kind.Thunk : Kind.Operation; }

  default int numberOfInputs() { return inputs().size(); }

  default int numberOfOutputs() { return outputs().size(); }

  /** Number of thunks enclosing this node. */
  default int nestingDepth() {
    int depth = 0;
    Optional<ThunkLike<W>> cur = backlink();
    while (cur.isPresent()) {
      ++depth;
      cur = cur.get().backlink();
    }
    return depth;
  }
}
