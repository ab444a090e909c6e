package sdcore.collapse;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import sdcore.graph.EdgeLike;
import sdcore.graph.Graph;
import sdcore.graph.HyperGraphView;
import sdcore.graph.NodeLike;
import sdcore.graph.ThunkLike;
import sdcore.hypergraph.NodeIndex;

/**
 * Read-only view of a {@link Graph} in which collapsed thunks appear as opaque operations.
 * <p>
 * The view holds an {@link ExpansionState} snapshot. {@link #toggle(List)} and {@link #setAll(boolean)} replace the
 *  snapshot as a whole; nodes and edges obtained earlier keep answering for the snapshot they were created from.
 */
public class CollapseGraph<W> implements Graph<W> {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final Graph<W> graph;
  private final Function<ThunkLike<W>, List<NodeIndex>> identity;
  private volatile CollapseContext<W> context;

  /**
   * @param graph the graph to wrap
   * @param expanded the initial expansion state
   * @param identity the stable key of a thunk of {@code graph}, as used by the expansion state
   */
  public CollapseGraph(Graph<W> graph, ExpansionState expanded, Function<ThunkLike<W>, List<NodeIndex>> identity) {
    this.graph = graph;
    this.identity = identity;
    this.context = new CollapseContext<>(expanded, identity);
  }

  /** Wraps a raw hypergraph view, identifying thunks by their node path. */
  public static <W> CollapseGraph<W> of(HyperGraphView<W> view, ExpansionState expanded) {
    return new CollapseGraph<>(view, expanded, CollapseGraph::viewPath);
  }

  private static <W> List<NodeIndex> viewPath(ThunkLike<W> thunk) {
    if (!(thunk instanceof HyperGraphView.ViewThunk))
      throw new IllegalArgumentException("Not a thunk of a hypergraph view: " + thunk);
    return ((HyperGraphView.ViewThunk<W>)thunk).path();
  }

  public Graph<W> inner() { return graph; }

  public ExpansionState expanded() { return context.state(); }

  /** The stable key of a thunk of the inner graph. */
  public List<NodeIndex> identify(ThunkLike<W> thunk) {
    if (thunk instanceof CollapseThunk)
      return identity.apply(((CollapseThunk<W>)thunk).inner());
    return identity.apply(thunk);
  }

  /** A view over the same graph with a different expansion state; this view is unchanged. */
  public CollapseGraph<W> withState(ExpansionState expanded) { return new CollapseGraph<>(graph, expanded, identity); }

  public void setState(ExpansionState expanded) {
    context = new CollapseContext<>(expanded, identity);
  }

  public void toggle(List<NodeIndex> thunk) {
    ExpansionState next = context.state().toggle(thunk);
    logger.debug("Toggled thunk {} to {}", thunk, next.isExpanded(thunk) ? "expanded" : "collapsed");
    setState(next);
  }

  public void setAll(boolean expanded) {
    logger.debug("Setting all thunks to {}", expanded ? "expanded" : "collapsed");
    setState(context.state().setAll(expanded));
  }

  @Override
  public List<EdgeLike<W>> freeGraphInputs() {
    return context.edges(graph.freeGraphInputs());
  }
  @Override
  public List<EdgeLike<W>> boundGraphInputs() {
    return context.edges(graph.boundGraphInputs());
  }
  @Override
  public List<EdgeLike<W>> graphOutputs() {
    return context.edges(graph.graphOutputs());
  }
  @Override
  public List<NodeLike<W>> nodes() {
    CollapseContext<W> snapshot = context;
    return graph.nodes().stream().map(snapshot::node).toList();
  }
  @Override
  public Optional<ThunkLike<W>> graphBacklink() {
    return Optional.empty();
  }

  /**
   * Wraps a node of the inner graph for the current state.
   * A node hidden inside collapsed thunks is replaced by the outermost of them.
   */
  public NodeLike<W> wrap(NodeLike<W> node) {
    CollapseContext<W> snapshot = context;
    return snapshot.node(snapshot.visible(node));
  }
}
