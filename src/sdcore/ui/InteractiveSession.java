package sdcore.ui;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import sdcore.collapse.CollapseGraph;
import sdcore.collapse.CollapseOperation;
import sdcore.collapse.CollapseThunk;
import sdcore.collapse.ExpansionState;
import sdcore.graph.HyperGraphView;
import sdcore.graph.NodeLike;
import sdcore.hypergraph.HyperGraph;
import sdcore.hypergraph.NodeIndex;
import sdcore.language.ConstructionException;
import sdcore.language.Expr;
import sdcore.language.HyperGraphBuilder;
import sdcore.monoidal.EmptyGraphException;
import sdcore.monoidal.MonoidalGraph;
import sdcore.monoidal.MonoidalOp;
import sdcore.monoidal.Slice;
import sdcore.monoidal.SliceOp;
import sdcore.reachability.NReachable;
import sdcore.subgraph.ExtractedSubgraph;
import sdcore.subgraph.Selection;
import sdcore.subgraph.SubgraphExtractor;

/**
 * The state an interactive host keeps for one diagram: which thunks are expanded (with undo and redo),
 *  and which nodes are selected.
 * <p>
 * Nodes and thunks are addressed by their path (enclosing thunks outermost first, then the node itself),
 *  which stays valid for the lifetime of the graph.
 */
public class InteractiveSession<W> {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final SDCoreConfig config;
  private final HyperGraph<W> graph;
  private final HyperGraphView<W> view;
  private final CollapseGraph<W> collapsed;
  private final Deque<ExpansionState> undo = new ArrayDeque<>();
  private final Deque<ExpansionState> redo = new ArrayDeque<>();
  private final Set<List<NodeIndex>> selection = new LinkedHashSet<>();

  public InteractiveSession(HyperGraph<W> graph, SDCoreConfig config) {
    this.config = config;
    this.graph = graph;
    this.view = new HyperGraphView<>(graph);
    this.collapsed = CollapseGraph.of(view, ExpansionState.all(config.default_expanded));
  }

  public static <W> InteractiveSession<W> fromExpr(Expr<W> expr, SDCoreConfig config) throws ConstructionException {
    return new InteractiveSession<>(HyperGraphBuilder.tryFrom(expr), config);
  }

  public HyperGraph<W> getGraph() { return graph; }

  /** The collapsed view for the current expansion state. */
  public CollapseGraph<W> getView() { return collapsed; }

  public ExpansionState getExpansion() { return collapsed.expanded(); }

  public boolean isExpanded(List<NodeIndex> thunk) { return collapsed.expanded().isExpanded(thunk); }

  /**
   * Flips the expansion flag of a thunk.
   * @throws IllegalArgumentException if the path does not address a thunk
   */
  public void toggle(List<NodeIndex> thunk) {
    NodeLike<W> node = find(thunk);
    if (node.asThunk().isEmpty())
      throw new IllegalArgumentException("Not a thunk: " + thunk);
    record();
    collapsed.toggle(thunk);
  }

  public void setAll(boolean expanded) {
    record();
    collapsed.setAll(expanded);
  }

  /** @return false if there is nothing to undo */
  public boolean undo() {
    if (undo.isEmpty())
      return false;
    redo.push(collapsed.expanded());
    collapsed.setState(undo.pop());
    return true;
  }

  /** @return false if there is nothing to redo */
  public boolean redo() {
    if (redo.isEmpty())
      return false;
    undo.push(collapsed.expanded());
    collapsed.setState(redo.pop());
    return true;
  }

  private void record() {
    redo.clear();
    if (config.history_limit == 0)
      return;
    undo.push(collapsed.expanded());
    while (undo.size() > config.history_limit)
      undo.removeLast();
  }

  /**
   * Adds a node to the selection.
   * @throws IllegalArgumentException if the path does not address a node
   */
  public void select(List<NodeIndex> node) {
    find(node);
    selection.add(List.copyOf(node));
  }

  public void deselect(List<NodeIndex> node) { selection.remove(node); }

  public void clearSelection() { selection.clear(); }

  public Set<List<NodeIndex>> getSelection() { return Collections.unmodifiableSet(selection); }

  /**
   * The dependency slice connecting a node with the current selection in the collapsed view: the nodes both forward
   *  and backward reachable from the node or a selected node, within the configured highlight depth.
   * Without a selection, this is the node itself.
   */
  public Set<List<NodeIndex>> highlight(List<NodeIndex> node) {
    Set<NodeLike<W>> seeds = new LinkedHashSet<>();
    seeds.add(collapsed.wrap(find(node)));
    for (List<NodeIndex> path : selection)
      seeds.add(collapsed.wrap(find(path)));
    Set<List<NodeIndex>> ret = new LinkedHashSet<>();
    for (NodeLike<W> reached : NReachable.bidirectionalFrom(seeds, config.highlight_depth))
      ret.add(pathOf(reached));
    return ret;
  }

  /** Normalizes the current selection in the collapsed view and copies it into a new hypergraph. */
  public ExtractedSubgraph<W> extractSelection() {
    if (selection.isEmpty())
      throw new IllegalStateException("Nothing is selected");
    List<NodeLike<W>> nodes = selection.stream().map(path -> collapsed.wrap(find(path))).toList();
    Selection.Options options = new Selection.Options(config.selection_extend_sources, config.selection_convex_closure);
    return new SubgraphExtractor<>(collapsed).extract(nodes, options);
  }

  /** The diagram of the whole graph, with every expanded thunk unfolded in place. */
  public MonoidalGraph<W> diagram() throws EmptyGraphException {
    MonoidalGraph<W> ret = MonoidalGraph.fromHyperGraph(graph, config.wireOrdering());
    Optional<List<NodeIndex>> next = nextExpandedThunk(ret);
    while (next.isPresent()) {
      ret = ret.unfold(next.get());
      next = nextExpandedThunk(ret);
    }
    return ret;
  }

  private Optional<List<NodeIndex>> nextExpandedThunk(MonoidalGraph<W> diagram) {
    for (Slice<W> slice : diagram.slices())
      for (SliceOp<W> entry : slice.ops())
        if (entry.op().getKind() == MonoidalOp.Kind.Thunk && isExpanded(entry.path()))
          return Optional.of(entry.path());
    return Optional.empty();
  }

  private NodeLike<W> find(List<NodeIndex> path) {
    return view.lookup(path).orElseThrow(() -> new IllegalArgumentException("No node at " + path));
  }

  private static <W> List<NodeIndex> pathOf(NodeLike<W> node) {
    NodeLike<W> inner = node;
    if (inner instanceof CollapseOperation)
      inner = ((CollapseOperation<W>)inner).inner();
    else if (inner instanceof CollapseThunk)
      inner = ((CollapseThunk<W>)inner).inner();
    if (!(inner instanceof HyperGraphView.ViewNode))
      throw new IllegalStateException("Unexpected node type " + inner.getClass().getName());
    return ((HyperGraphView.ViewNode<W>)inner).path();
  }
}
