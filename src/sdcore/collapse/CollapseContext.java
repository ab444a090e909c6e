package sdcore.collapse;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import sdcore.graph.EdgeLike;
import sdcore.graph.NodeLike;
import sdcore.graph.ThunkLike;
import sdcore.hypergraph.NodeIndex;

/** The expansion snapshot shared by all wrappers handed out from one {@link CollapseGraph} state. */
record CollapseContext<W>(ExpansionState state, Function<ThunkLike<W>, List<NodeIndex>> identity) {

  boolean isExpanded(ThunkLike<W> thunk) { return state.isExpanded(identity.apply(thunk)); }

  /** Wraps a node of the inner graph; a collapsed thunk becomes an opaque operation. */
  NodeLike<W> node(NodeLike<W> node) {
    Optional<ThunkLike<W>> thunk = node.asThunk();
    if (thunk.isPresent() && isExpanded(thunk.get()))
      return new CollapseThunk<>(thunk.get(), this);
    return new CollapseOperation<>(node, this);
  }

  ThunkLike<W> thunk(ThunkLike<W> thunk) { return new CollapseThunk<>(thunk, this); }

  EdgeLike<W> edge(EdgeLike<W> edge) { return new CollapseEdge<>(edge, this); }

  List<EdgeLike<W>> edges(List<EdgeLike<W>> edges) { return edges.stream().map(this::edge).toList(); }

  /** Replaces a node nested inside collapsed thunks by the outermost of them. */
  NodeLike<W> visible(NodeLike<W> node) {
    NodeLike<W> ret = node;
    Optional<ThunkLike<W>> cur = node.backlink();
    while (cur.isPresent()) {
      if (!isExpanded(cur.get()))
        ret = cur.get();
      cur = cur.get().backlink();
    }
    return ret;
  }
}
