package sdcore.graph;

/**
 * A thunk node, which is at the same time the graph of its body.
 * As a graph, its free inputs are the captured edges it consumes and its backlink is itself.
 */
public interface ThunkLike<W> extends NodeLike<W>, Graph<W> {
  /** Number of parameters bound by the thunk. */
  default int args() { return boundGraphInputs().size(); }
}
