package sdcore.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import sdcore.hypergraph.HyperGraph;
import sdcore.hypergraph.HyperGraphException;
import sdcore.hypergraph.Node;
import sdcore.hypergraph.NodeIndex;
import sdcore.hypergraph.Port;
import sdcore.hypergraph.PortIndex;

/**
 * The {@link Graph} view of a {@link HyperGraph} and all thunk bodies nested in it.
 * <p>
 * An edge is identified by the output port defining it. A port of a thunk body's Input node that carries a captured
 * variable is not an edge of its own; it resolves to the edge feeding the thunk in the enclosing graph.
 * Consequently, an edge's targets can be nested in thunks at any depth below its source.
 * <p>
 * Node and edge handles compare equal iff they address the same graph level (by identity) and index.
 */
public class HyperGraphView<W> implements Graph<W> {

  /** One nesting level: a graph, and the thunk owning it (non-owning back reference). */
  private static final class Level<W> {
    final HyperGraph<W> graph;
    final Optional<ViewThunk<W>> owner;

    Level(HyperGraph<W> graph, Optional<ViewThunk<W>> owner) {
      this.graph = graph;
      this.owner = owner;
    }

    Node<W> node(NodeIndex index) {
      try {
        return graph.get(index);
      } catch (HyperGraphException e) {
        throw new IllegalStateException("View refers to a missing node", e);
      }
    }
    List<Port> inputsOf(NodeIndex index) {
      try {
        return graph.getInputs(index);
      } catch (HyperGraphException e) {
        throw new IllegalStateException("View refers to a missing node", e);
      }
    }
    int outputCount(NodeIndex index) {
      try {
        return graph.numberOfOutputs(index);
      } catch (HyperGraphException e) {
        throw new IllegalStateException("View refers to a missing node", e);
      }
    }
    Set<Port> consumersOf(Port port) {
      try {
        return graph.getConsumers(port);
      } catch (HyperGraphException e) {
        throw new IllegalStateException("View refers to a missing port", e);
      }
    }

    ViewNode<W> nodeView(NodeIndex index) {
      Node<W> data = node(index);
      if (data.asThunk().isPresent())
        return new ViewThunk<>(this, index);
      return new ViewNode<>(this, index);
    }

    /** Resolves an output port to the edge it belongs to, following captured variables outwards. */
    EdgeLike<W> edgeAt(Port port) {
      if (owner.isPresent() && node(port.node()).isInput()) {
        List<Port> inputPorts = graph.graphInputPorts();
        int position = inputPorts.indexOf(port);
        ViewThunk<W> thunk = owner.get();
        if (position >= 0 && position < thunk.captures()) {
          Port outerSource = thunk.level.inputsOf(thunk.index).get(position);
          return thunk.level.edgeAt(outerSource);
        }
      }
      return new ViewEdge<>(this, port);
    }

    /** Collects the consumers of a port, descending into thunks that capture it. */
    void collectTargets(Port port, List<Optional<NodeLike<W>>> out) {
      for (Port consumer : consumersOf(port)) {
        Node<W> data = node(consumer.node());
        if (data.isOutput()) {
          out.add(Optional.empty());
          continue;
        }
        Optional<Node.Thunk<W>> thunkData = data.asThunk();
        if (thunkData.isPresent()) {
          ViewThunk<W> thunk = new ViewThunk<>(this, consumer.node());
          Level<W> body = thunk.bodyLevel();
          Port bodyPort = body.graph.graphInputPorts().get(consumer.index().index());
          int before = out.size();
          body.collectTargets(bodyPort, out);
          if (out.size() == before)
            out.add(Optional.of(thunk)); // captured, but unused inside the body
          continue;
        }
        out.add(Optional.of(nodeView(consumer.node())));
      }
    }

    List<NodeLike<W>> interiorNodes() {
      List<NodeLike<W>> ret = new ArrayList<>();
      for (HyperGraph.NodeEntry<W> entry : graph.nodes()) {
        if (!entry.node().isBoundary())
          ret.add(nodeView(entry.index()));
      }
      return ret;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Level && ((Level<?>)obj).graph == graph;
    }
    @Override
    public int hashCode() {
      return System.identityHashCode(graph);
    }
  }

  /** A node of the view. Thunks are represented by {@link ViewThunk}. */
  public static class ViewNode<W> implements NodeLike<W> {
    final Level<W> level;
    final NodeIndex index;

    ViewNode(Level<W> level, NodeIndex index) {
      this.level = level;
      this.index = index;
    }

    /** The index of this node in its own graph level. */
    public NodeIndex index() { return index; }

    /** The graph level containing this node. */
    public HyperGraph<W> graph() { return level.graph; }

    /**
     * The indices of the enclosing thunks from the top level down, followed by this node's index.
     * Stable for the lifetime of the underlying graph, so suitable as a persistent key.
     */
    public List<NodeIndex> path() {
      LinkedList<NodeIndex> ret = new LinkedList<>();
      ret.addFirst(index);
      Optional<ViewThunk<W>> cur = level.owner;
      while (cur.isPresent()) {
        ret.addFirst(cur.get().index);
        cur = cur.get().level.owner;
      }
      return Collections.unmodifiableList(ret);
    }

    @Override
    public List<EdgeLike<W>> inputs() {
      return level.inputsOf(index).stream().map(level::edgeAt).toList();
    }
    @Override
    public List<EdgeLike<W>> outputs() {
      List<EdgeLike<W>> ret = new ArrayList<>();
      int count = level.outputCount(index);
      for (int i = 0; i < count; ++i)
        ret.add(new ViewEdge<>(level, new Port(index, new PortIndex(i))));
      return ret;
    }
    @Override
    public int numberOfInputs() {
      return level.inputsOf(index).size();
    }
    @Override
    public int numberOfOutputs() {
      return level.outputCount(index);
    }
    @Override
    public Optional<ThunkLike<W>> backlink() {
      return level.owner.map(thunk -> (ThunkLike<W>)thunk);
    }
    @Override
    public Optional<ThunkLike<W>> asThunk() {
      return Optional.empty();
    }
    @Override
    public Optional<W> weight() {
      return level.node(index).getWeight();
    }

    @Override
    public boolean equals(Object obj) {
      if (this == obj)
        return true;
      if (!(obj instanceof ViewNode))
        return false;
      ViewNode<?> other = (ViewNode<?>)obj;
      return level.equals(other.level) && index.equals(other.index);
    }
    @Override
    public int hashCode() {
      return Objects.hash(level, index);
    }
    @Override
    public String toString() {
      return String.format("%s@%s", weight().map(String::valueOf).orElse("thunk"), path());
    }
  }

  /** A thunk node of the view, which doubles as the view of its body. */
  public static class ViewThunk<W> extends ViewNode<W> implements ThunkLike<W> {
    ViewThunk(Level<W> level, NodeIndex index) { super(level, index); }

    Node.Thunk<W> data() { return level.node(index).asThunk().orElseThrow(); }

    Level<W> bodyLevel() { return new Level<>(data().getBody(), Optional.of(this)); }

    int captures() { return data().getCaptures(); }

    /** The nested graph owned by this thunk. */
    public HyperGraph<W> body() { return data().getBody(); }

    @Override
    public Optional<ThunkLike<W>> asThunk() {
      return Optional.of(this);
    }
    @Override
    public int args() {
      return data().getArgs();
    }
    @Override
    public List<EdgeLike<W>> freeGraphInputs() {
      return inputs();
    }
    @Override
    public List<EdgeLike<W>> boundGraphInputs() {
      Level<W> body = bodyLevel();
      List<Port> inputPorts = body.graph.graphInputPorts();
      return inputPorts.subList(captures(), inputPorts.size()).stream().map(body::edgeAt).toList();
    }
    @Override
    public List<EdgeLike<W>> graphOutputs() {
      Level<W> body = bodyLevel();
      return body.graph.graphOutputSources().stream().map(body::edgeAt).toList();
    }
    @Override
    public List<NodeLike<W>> nodes() {
      return bodyLevel().interiorNodes();
    }
    @Override
    public Optional<ThunkLike<W>> graphBacklink() {
      return Optional.of(this);
    }
  }

  /** An edge of the view, identified by its defining output port. */
  public static class ViewEdge<W> implements EdgeLike<W> {
    final Level<W> level;
    final Port port;

    ViewEdge(Level<W> level, Port port) {
      this.level = level;
      this.port = port;
    }

    /** The output port defining this edge, in the graph level of its source. */
    public Port port() { return port; }

    @Override
    public Optional<NodeLike<W>> source() {
      if (level.node(port.node()).isInput())
        return Optional.empty();
      return Optional.of(level.nodeView(port.node()));
    }
    @Override
    public List<Optional<NodeLike<W>>> targets() {
      List<Optional<NodeLike<W>>> ret = new ArrayList<>();
      level.collectTargets(port, ret);
      return ret;
    }

    @Override
    public boolean equals(Object obj) {
      if (this == obj)
        return true;
      if (!(obj instanceof ViewEdge))
        return false;
      ViewEdge<?> other = (ViewEdge<?>)obj;
      return level.equals(other.level) && port.equals(other.port);
    }
    @Override
    public int hashCode() {
      return Objects.hash(level, port);
    }
    @Override
    public String toString() {
      return "edge" + port;
    }
  }

  private final Level<W> root;

  public HyperGraphView(HyperGraph<W> graph) { this.root = new Level<>(graph, Optional.empty()); }

  public HyperGraph<W> graph() { return root.graph; }

  @Override
  public List<EdgeLike<W>> freeGraphInputs() {
    return root.graph.graphInputPorts().stream().map(root::edgeAt).toList();
  }
  @Override
  public List<EdgeLike<W>> boundGraphInputs() {
    return List.of();
  }
  @Override
  public List<EdgeLike<W>> graphOutputs() {
    return root.graph.graphOutputSources().stream().map(root::edgeAt).toList();
  }
  @Override
  public List<NodeLike<W>> nodes() {
    return root.interiorNodes();
  }
  @Override
  public Optional<ThunkLike<W>> graphBacklink() {
    return Optional.empty();
  }

  /**
   * Looks up the node at the end of a path as returned by {@link ViewNode#path()}.
   * @return the node, or empty if the path does not address a node
   */
  public Optional<NodeLike<W>> lookup(List<NodeIndex> path) {
    if (path.isEmpty())
      return Optional.empty();
    Level<W> level = root;
    for (int i = 0; i < path.size(); ++i) {
      NodeIndex step = path.get(i);
      if (!level.graph.contains(step) || level.node(step).isBoundary())
        return Optional.empty();
      ViewNode<W> node = level.nodeView(step);
      if (i + 1 == path.size())
        return Optional.of(node);
      if (!(node instanceof ViewThunk))
        return Optional.empty();
      level = ((ViewThunk<W>)node).bodyLevel();
    }
    return Optional.empty();
  }
}
