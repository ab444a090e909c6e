package sdcore.hypergraph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Hypergraph whose nodes carry weights W and whose hyperedges connect one output port to any number of input ports.
 * <p>
 * Each node stores, per input port, the single source {@link Port} it is wired from,
 *  and per output port, the set of consumer ports (node, input index) currently wired to it.
 * Nodes are appended in construction order and never removed, so node indices are stable
 *  and the insertion order is a topological order of the consumer relation.
 * <p>
 * A {@link Node.Thunk} exclusively owns its nested HyperGraph; the whole structure is a tree of graphs, each a DAG.
 */
public class HyperGraph<W> {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private static class NodeInfo<W> {
    final Node<W> data;
    final List<Port> inputs;
    final List<TreeSet<Port>> outputs;

    NodeInfo(Node<W> data, List<Port> inputs, int outputPorts) {
      this.data = data;
      this.inputs = List.copyOf(inputs);
      this.outputs = new ArrayList<>(outputPorts);
      for (int i = 0; i < outputPorts; ++i)
        outputs.add(new TreeSet<>());
    }
  }

  /** A node together with its index, as enumerated by {@link HyperGraph#nodes()}. */
  public record NodeEntry<W>(NodeIndex index, Node<W> node) {}

  /** One hyperedge: an output port and the input ports consuming it. */
  public record EdgeEntry(Port source, Set<Port> targets) {}

  /**
   * Result of {@link HyperGraph#ranksFromEnd()}.
   * @param inputs the Input nodes
   * @param ranks the remaining nodes by level, ranks.get(0) being closest to the outputs
   * @param outputs the Output nodes
   */
  public record Ranks(Set<NodeIndex> inputs, List<Set<NodeIndex>> ranks, Set<NodeIndex> outputs) {}

  private final ArrayList<NodeInfo<W>> nodes = new ArrayList<>();

  /**
   * Constructs the degenerate graph: one Input and one Output node, neither with ports.
   */
  public HyperGraph() {
    addNodeUnchecked(Node.input(), List.of(), 0);
    addNodeUnchecked(Node.output(), List.of(), 0);
  }

  private HyperGraph(boolean empty) {}

  /** Constructs a graph without any nodes, to be filled via {@link HyperGraph#addNode(Node, List, int)}. */
  public static <W> HyperGraph<W> empty() { return new HyperGraph<>(true); }

  private NodeIndex addNodeUnchecked(Node<W> data, List<Port> inputs, int outputPorts) {
    NodeIndex next = new NodeIndex(nodes.size());
    for (int i = 0; i < inputs.size(); ++i) {
      Port source = inputs.get(i);
      nodes.get(source.node().index()).outputs.get(source.index().index()).add(new Port(next, new PortIndex(i)));
    }
    nodes.add(new NodeInfo<>(data, inputs, outputPorts));
    return next;
  }

  /**
   * Adds a node, wiring each of its input ports to the given source port.
   * All inputs are validated before anything is modified; on failure, the graph is unchanged.
   * @param data the node data
   * @param inputs for each input port of the new node, the output port it is wired from
   * @param outputPorts the number of output ports of the new node
   * @return the index of the new node
   * @throws UnknownNodeException if an input refers to a node that does not exist
   * @throws UnknownPortException if an input refers to an output port the node does not have
   */
  public NodeIndex addNode(Node<W> data, List<Port> inputs, int outputPorts) throws HyperGraphException {
    if (outputPorts < 0)
      throw new IllegalArgumentException("outputPorts must not be negative");
    if (data.isInput() && !inputs.isEmpty())
      throw new IllegalArgumentException("Input nodes cannot have inputs");
    if (data.isOutput() && outputPorts != 0)
      throw new IllegalArgumentException("Output nodes cannot have outputs");
    for (Port source : inputs) {
      NodeInfo<W> sourceInfo = getInfo(source.node());
      if (source.index().index() >= sourceInfo.outputs.size())
        throw new UnknownPortException(source);
    }
    return addNodeUnchecked(data, inputs, outputPorts);
  }

  private NodeInfo<W> getInfo(NodeIndex key) throws UnknownNodeException {
    if (key.index() >= nodes.size())
      throw new UnknownNodeException(key);
    return nodes.get(key.index());
  }

  public boolean contains(NodeIndex key) { return key.index() < nodes.size(); }

  public int size() { return nodes.size(); }

  public Node<W> get(NodeIndex key) throws UnknownNodeException { return getInfo(key).data; }

  /** Returns, per output port, an unmodifiable view of the consumer ports. */
  public List<Set<Port>> getOutputs(NodeIndex key) throws UnknownNodeException {
    return getInfo(key).outputs.stream().map(Collections::unmodifiableSet).collect(Collectors.toUnmodifiableList());
  }

  /** Returns the consumers of a single output port. */
  public Set<Port> getConsumers(Port output) throws HyperGraphException {
    NodeInfo<W> info = getInfo(output.node());
    if (output.index().index() >= info.outputs.size())
      throw new UnknownPortException(output);
    return Collections.unmodifiableSet(info.outputs.get(output.index().index()));
  }

  public int numberOfOutputs(NodeIndex key) throws UnknownNodeException { return getInfo(key).outputs.size(); }

  /** Returns, per input port, the output port it is wired from. */
  public List<Port> getInputs(NodeIndex key) throws UnknownNodeException { return getInfo(key).inputs; }

  public int numberOfInputs(NodeIndex key) throws UnknownNodeException { return getInfo(key).inputs.size(); }

  /** Enumerates all nodes in insertion order. */
  public List<NodeEntry<W>> nodes() {
    return IntStream.range(0, nodes.size()).mapToObj(i -> new NodeEntry<>(new NodeIndex(i), nodes.get(i).data)).toList();
  }

  /** Enumerates all hyperedges in insertion order of their source node, then by port. */
  public List<EdgeEntry> edges() {
    List<EdgeEntry> ret = new ArrayList<>();
    for (int i = 0; i < nodes.size(); ++i) {
      List<TreeSet<Port>> outputs = nodes.get(i).outputs;
      for (int port = 0; port < outputs.size(); ++port)
        ret.add(new EdgeEntry(Port.of(i, port), Collections.unmodifiableSet(outputs.get(port))));
    }
    return ret;
  }

  /** The Input nodes in insertion order. */
  public List<NodeIndex> inputNodes() {
    return nodes().stream().filter(entry -> entry.node().isInput()).map(NodeEntry::index).toList();
  }

  /** The Output nodes in insertion order. */
  public List<NodeIndex> outputNodes() {
    return nodes().stream().filter(entry -> entry.node().isOutput()).map(NodeEntry::index).toList();
  }

  /** The output ports of all Input nodes, in declared order. */
  public List<Port> graphInputPorts() {
    List<Port> ret = new ArrayList<>();
    for (NodeIndex input : inputNodes())
      for (int i = 0; i < nodes.get(input.index()).outputs.size(); ++i)
        ret.add(new Port(input, new PortIndex(i)));
    return ret;
  }

  /** The sources feeding all Output nodes, in declared order. */
  public List<Port> graphOutputSources() {
    return outputNodes().stream().flatMap(output -> nodes.get(output.index()).inputs.stream()).toList();
  }

  /** Sum of the output port counts of all Input nodes. */
  public int numberOfGraphInputs() { return graphInputPorts().size(); }

  /** Number of wires consumed by all Output nodes. */
  public int numberOfGraphOutputs() { return graphOutputSources().size(); }

  /**
   * Walks through nested thunk bodies along a path of node indices.
   * @param path the thunk node at each level, outermost first
   * @return the graph at the end of the path, or empty if a step is not a thunk
   */
  public Optional<HyperGraph<W>> recurse(List<NodeIndex> path) {
    HyperGraph<W> cur = this;
    for (NodeIndex step : path) {
      if (!cur.contains(step))
        return Optional.empty();
      Optional<Node.Thunk<W>> thunk = cur.nodes.get(step.index()).data.asThunk();
      if (thunk.isEmpty())
        return Optional.empty();
      cur = thunk.get().getBody();
    }
    return Optional.of(cur);
  }

  /**
   * Partitions the nodes into layers by distance from the outputs.
   * A node joins the next rank once all of its consumers are in earlier ranks (or are Output nodes).
   * @return the Input nodes, the ranks (closest to the outputs first), and the Output nodes
   * @throws IllegalStateException if no progress can be made, i.e. the graph has a cycle
   */
  public Ranks ranksFromEnd() {
    Set<NodeIndex> inputs = new TreeSet<>();
    Set<NodeIndex> outputs = new TreeSet<>();
    List<NodeIndex> remaining = new ArrayList<>();
    for (NodeEntry<W> entry : nodes()) {
      if (entry.node().isInput())
        inputs.add(entry.index());
      else if (entry.node().isOutput())
        outputs.add(entry.index());
      else
        remaining.add(entry.index());
    }

    List<Set<NodeIndex>> ranks = new ArrayList<>();
    Set<NodeIndex> collected = new TreeSet<>(outputs);
    while (!remaining.isEmpty()) {
      Set<NodeIndex> nextRank = new TreeSet<>();
      for (NodeIndex candidate : remaining) {
        boolean ready = nodes.get(candidate.index())
                            .outputs.stream()
                            .flatMap(consumers -> consumers.stream())
                            .allMatch(consumer -> collected.contains(consumer.node()));
        if (ready)
          nextRank.add(candidate);
      }
      if (nextRank.isEmpty()) {
        logger.error("ranksFromEnd: no progress with {} nodes left, the graph is not acyclic", remaining.size());
        throw new IllegalStateException("Rank computation made no progress on " + remaining);
      }
      collected.addAll(nextRank);
      remaining.removeAll(nextRank);
      logger.trace("ranksFromEnd: rank {} is {}", ranks.size(), nextRank);
      ranks.add(Collections.unmodifiableSet(nextRank));
    }
    return new Ranks(Collections.unmodifiableSet(inputs), Collections.unmodifiableList(ranks), Collections.unmodifiableSet(outputs));
  }

  @Override
  public String toString() {
    return String.format("HyperGraph { nodes: %s, edges: %s }",
                         nodes().stream().map(entry -> entry.index() + "=" + entry.node()).toList(),
                         edges().stream().map(edge -> edge.source() + "->" + edge.targets()).toList());
  }
}
