package sdcore.subgraph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import sdcore.collapse.CollapseOperation;
import sdcore.graph.EdgeLike;
import sdcore.graph.Graph;
import sdcore.graph.NodeLike;
import sdcore.graph.ThunkLike;
import sdcore.hypergraph.HyperGraph;
import sdcore.hypergraph.HyperGraphException;
import sdcore.hypergraph.Node;
import sdcore.hypergraph.NodeIndex;
import sdcore.hypergraph.Port;
import sdcore.hypergraph.PortIndex;
import sdcore.reachability.Reachability;

/**
 * Copies a {@link Selection} out of a {@link Graph} into a new, independent {@link HyperGraph}.
 * <p>
 * Edges entering the selection become the ports of a synthesized Input node, in the order they are first consumed.
 * Edges of selected nodes consumed outside the selection, or leaving the graph, feed a synthesized Output node.
 * Selected thunks are copied with their whole body, collapsed or not.
 */
public class SubgraphExtractor<W> {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final Graph<W> graph;

  /** @param graph the graph the selections are taken from */
  public SubgraphExtractor(Graph<W> graph) { this.graph = graph; }

  /** Normalizes a raw node set and extracts it. */
  public ExtractedSubgraph<W> extract(Collection<? extends NodeLike<W>> raw, Selection.Options options) {
    return extract(Selection.normalize(raw, options));
  }

  public ExtractedSubgraph<W> extract(Selection<W> selection) {
    if (selection.isEmpty())
      throw new IllegalArgumentException("Cannot extract an empty selection");
    Optional<ThunkLike<W>> level = selection.getLevel();
    Set<NodeLike<W>> selected = selection.getNodes();
    List<NodeLike<W>> ordered = levelNodes(level).stream().filter(selected::contains).toList();
    if (ordered.size() != selected.size())
      throw new IllegalArgumentException("Selection contains nodes outside of level " + level.map(String::valueOf).orElse("top"));

    List<EdgeLike<W>> inputs = new ArrayList<>();
    Set<EdgeLike<W>> seenInputs = new LinkedHashSet<>();
    for (NodeLike<W> node : ordered) {
      for (EdgeLike<W> edge : node.inputs()) {
        boolean internal = edge.source().filter(selected::contains).isPresent();
        if (!internal && seenInputs.add(edge))
          inputs.add(edge);
      }
    }

    HyperGraph<W> ret = HyperGraph.empty();
    Map<EdgeLike<W>, Port> ports = new HashMap<>();
    NodeIndex inputNode = add(ret, Node.input(), List.of(), inputs.size());
    for (int i = 0; i < inputs.size(); ++i)
      ports.put(inputs.get(i), new Port(inputNode, new PortIndex(i)));

    List<EdgeLike<W>> outputs = new ArrayList<>();
    for (NodeLike<W> node : ordered) {
      copyNode(ret, node, ports);
      for (EdgeLike<W> edge : node.outputs()) {
        if (leavesSelection(edge, selected, level))
          outputs.add(edge);
      }
    }
    add(ret, Node.output(), lookup(ports, outputs), 0);

    logger.debug("Extracted {} nodes with {} inputs and {} outputs", ordered.size(), inputs.size(), outputs.size());
    return new ExtractedSubgraph<>(ret, inputs, outputs);
  }

  private List<NodeLike<W>> levelNodes(Optional<ThunkLike<W>> level) {
    if (level.isPresent())
      return level.get().nodes();
    return graph.nodes();
  }

  private static <W> boolean leavesSelection(EdgeLike<W> edge, Set<NodeLike<W>> selected, Optional<ThunkLike<W>> level) {
    for (Optional<NodeLike<W>> target : edge.targets()) {
      Optional<NodeLike<W>> lifted = target.flatMap(node -> Reachability.liftTo(node, level));
      if (lifted.isEmpty() || !selected.contains(lifted.get()))
        return true;
    }
    return false;
  }

  /** The thunk structure behind a node, including a thunk hidden by a collapsed view. */
  private static <W> Optional<ThunkLike<W>> thunkOf(NodeLike<W> node) {
    Optional<ThunkLike<W>> thunk = node.asThunk();
    if (thunk.isEmpty() && node instanceof CollapseOperation)
      thunk = ((CollapseOperation<W>)node).folded();
    return thunk;
  }

  /** Appends a copy of {@code node}, wiring its inputs through {@code ports} and registering its outputs there. */
  private static <W> void copyNode(HyperGraph<W> target, NodeLike<W> node, Map<EdgeLike<W>, Port> ports) {
    Optional<ThunkLike<W>> thunk = thunkOf(node);
    Node<W> data;
    if (thunk.isPresent())
      data = Node.thunk(thunk.get().args(), copyBody(thunk.get()));
    else
      data = Node.weight(node.weight().orElseThrow(() -> new IllegalStateException("Operation without weight: " + node)));
    List<EdgeLike<W>> outputs = node.outputs();
    NodeIndex index = add(target, data, lookup(ports, node.inputs()), outputs.size());
    for (int i = 0; i < outputs.size(); ++i)
      ports.put(outputs.get(i), new Port(index, new PortIndex(i)));
  }

  /** Copies a thunk body: Input ports for the captured edges followed by the parameters, then all nodes in order. */
  private static <W> HyperGraph<W> copyBody(ThunkLike<W> thunk) {
    HyperGraph<W> body = HyperGraph.empty();
    Map<EdgeLike<W>, Port> ports = new HashMap<>();
    List<EdgeLike<W>> bodyInputs = new ArrayList<>(thunk.freeGraphInputs());
    bodyInputs.addAll(thunk.boundGraphInputs());
    NodeIndex inputNode = add(body, Node.input(), List.of(), bodyInputs.size());
    for (int i = 0; i < bodyInputs.size(); ++i)
      ports.putIfAbsent(bodyInputs.get(i), new Port(inputNode, new PortIndex(i)));
    for (NodeLike<W> node : thunk.nodes())
      copyNode(body, node, ports);
    add(body, Node.output(), lookup(ports, thunk.graphOutputs()), 0);
    return body;
  }

  private static <W> List<Port> lookup(Map<EdgeLike<W>, Port> ports, List<EdgeLike<W>> edges) {
    List<Port> ret = new ArrayList<>();
    for (EdgeLike<W> edge : edges) {
      Port port = ports.get(edge);
      if (port == null)
        throw new IllegalStateException("Edge " + edge + " is used before it is defined");
      ret.add(port);
    }
    return ret;
  }

  private static <W> NodeIndex add(HyperGraph<W> target, Node<W> data, List<Port> inputs, int outputs) {
    try {
      return target.addNode(data, inputs, outputs);
    } catch (HyperGraphException e) {
      throw new IllegalStateException("Extracted graph refers to a missing port", e);
    }
  }
}
