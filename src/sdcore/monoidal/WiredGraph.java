package sdcore.monoidal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import sdcore.hypergraph.HyperGraph;
import sdcore.hypergraph.HyperGraphException;
import sdcore.hypergraph.Node;
import sdcore.hypergraph.NodeIndex;
import sdcore.hypergraph.Port;
import sdcore.hypergraph.PortIndex;

/**
 * A synthesized diagram that still knows which hypergraph port each wire carries.
 * Layers are ordered top to bottom; the first one wires the graph inputs, each further one belongs to a rank.
 */
public record WiredGraph<W>(int inputs, List<WiringLayer<W>> layers) {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public WiredGraph {
    layers = List.copyOf(layers);
  }

  /**
   * Synthesizes one graph level, working from the outputs towards the inputs rank by rank.
   * Thunk bodies are synthesized recursively with the same ordering.
   * @throws EmptyGraphException if this level contains no operations or thunks
   */
  public static <W> WiredGraph<W> fromHyperGraph(HyperGraph<W> graph, WireOrdering ordering) throws EmptyGraphException {
    if (graph.ranksFromEnd().ranks().isEmpty())
      throw new EmptyGraphException("Hypergraph contains no nodes");
    return synthesize(graph, ordering);
  }

  /** A thunk body without operations only routes its inputs onto its outputs, i.e. it is a bare input layer. */
  private static <W> WiredGraph<W> synthesize(HyperGraph<W> graph, WireOrdering ordering) {
    HyperGraph.Ranks ranks = graph.ranksFromEnd();
    List<WiringLayer<W>> layers = new ArrayList<>();
    List<Port> openWires = graph.graphOutputSources();
    for (Set<NodeIndex> rank : ranks.ranks()) {
      WiringLayer<W> layer = rankLayer(graph, rank, openWires, ordering);
      logger.trace("Rank {}: {} wires above, {} swap slices", rank, layer.above().size(), layer.swaps().size());
      layers.add(layer);
      openWires = layer.above();
    }
    layers.add(inputLayer(graph, openWires));
    Collections.reverse(layers);

    int inputs = graph.numberOfGraphInputs();
    logger.debug("Synthesized {} ranks over {} inputs and {} outputs", ranks.ranks().size(), inputs, graph.numberOfGraphOutputs());
    return new WiredGraph<>(inputs, layers);
  }

  private static <W> List<WireOrdering.Demand> demands(List<Port> openWires) {
    TreeMap<NodeIndex, TreeMap<PortIndex, List<Integer>>> byNode = new TreeMap<>();
    for (int wire = 0; wire < openWires.size(); ++wire) {
      Port port = openWires.get(wire);
      byNode.computeIfAbsent(port.node(), node -> new TreeMap<>()).computeIfAbsent(port.index(), index -> new ArrayList<>()).add(wire);
    }
    List<WireOrdering.Demand> ret = new ArrayList<>();
    byNode.forEach((node, wires) -> ret.add(new WireOrdering.Demand(node, wires)));
    return ret;
  }

  private static List<WireOrdering.Demand> ordered(WireOrdering ordering, List<WireOrdering.Demand> demands) {
    List<WireOrdering.Demand> ret = ordering.order(Collections.unmodifiableList(demands));
    if (ret.size() != demands.size() || !new HashSet<>(ret).equals(new HashSet<>(demands)))
      throw new IllegalStateException("Wire ordering " + ordering + " did not return a permutation of its input");
    return ret;
  }

  private static <W> WiringLayer<W> rankLayer(HyperGraph<W> graph, Set<NodeIndex> rank, List<Port> openWires, WireOrdering ordering) {
    List<WireOrdering.Demand> parts = ordered(ordering, demands(openWires));

    List<Integer> permutation = new ArrayList<>();
    List<Port> sorted = new ArrayList<>();
    for (WireOrdering.Demand part : parts) {
      part.wires().forEach((index, wires) -> {
        permutation.addAll(wires);
        for (int i = 0; i < wires.size(); ++i)
          sorted.add(new Port(part.node(), index));
      });
    }

    List<Port> above = new ArrayList<>();
    List<SliceOp<W>> operations = new ArrayList<>();
    List<Port> produced = new ArrayList<>();
    List<SliceOp<W>> copies = new ArrayList<>();
    Set<NodeIndex> remaining = new TreeSet<>(rank);
    for (WireOrdering.Demand part : parts) {
      if (remaining.remove(part.node())) {
        int outputs = lower(graph, part.node(), ordering, above, operations, produced);
        for (int i = 0; i < outputs; ++i)
          copies.add(SliceOp.wiring(MonoidalOp.<W>copy(part.wires().getOrDefault(new PortIndex(i), List.of()).size())));
      } else {
        part.wires().forEach((index, wires) -> {
          Port port = new Port(part.node(), index);
          above.add(port);
          operations.add(SliceOp.id());
          produced.add(port);
          copies.add(SliceOp.wiring(MonoidalOp.<W>copy(wires.size())));
        });
      }
    }
    // Nodes of this rank whose outputs nobody consumes.
    for (NodeIndex node : remaining) {
      int outputs = lower(graph, node, ordering, above, operations, produced);
      for (int i = 0; i < outputs; ++i)
        copies.add(SliceOp.wiring(MonoidalOp.<W>delete()));
    }

    return new WiringLayer<>(above, new Slice<>(operations), produced, new Slice<>(copies), sorted,
                             Permutations.<W>permutationToSwaps(permutation), openWires);
  }

  /** Wires the graph inputs, in declared order, to the wires demanded by the topmost rank. */
  private static <W> WiringLayer<W> inputLayer(HyperGraph<W> graph, List<Port> openWires) {
    Map<Port, List<Integer>> byPort = new LinkedHashMap<>();
    List<Port> inputPorts = graph.graphInputPorts();
    for (Port port : inputPorts)
      byPort.put(port, new ArrayList<>());
    for (int wire = 0; wire < openWires.size(); ++wire) {
      List<Integer> wires = byPort.get(openWires.get(wire));
      if (wires == null) {
        logger.error("Open wire {} is not a graph input after the last rank", openWires.get(wire));
        throw new IllegalStateException("Wire " + openWires.get(wire) + " has no producer");
      }
      wires.add(wire);
    }
    List<Integer> permutation = new ArrayList<>();
    List<Port> sorted = new ArrayList<>();
    List<SliceOp<W>> copies = new ArrayList<>();
    byPort.forEach((port, wires) -> {
      permutation.addAll(wires);
      wires.forEach(wire -> sorted.add(port));
      copies.add(SliceOp.wiring(MonoidalOp.<W>copy(wires.size())));
    });
    return new WiringLayer<>(inputPorts, Slice.<W>identity(inputPorts.size()), inputPorts, new Slice<>(copies), sorted,
                             Permutations.<W>permutationToSwaps(permutation), openWires);
  }

  /**
   * Appends the box for one operation or thunk.
   * @return the number of output ports of the node
   */
  private static <W> int lower(HyperGraph<W> graph, NodeIndex node, WireOrdering ordering, List<Port> above,
                               List<SliceOp<W>> operations, List<Port> produced) {
    Node<W> data;
    List<Port> inputs;
    int outputs;
    try {
      data = graph.get(node);
      inputs = graph.getInputs(node);
      outputs = graph.numberOfOutputs(node);
    } catch (HyperGraphException e) {
      throw new IllegalStateException("Rank refers to a missing node", e);
    }
    List<NodeIndex> path = List.of(node);
    switch (data.getKind()) {
    case Operation:
      operations.add(new SliceOp<>(MonoidalOp.operation(inputs.size(), outputs, data.getWeight().orElseThrow()), path));
      break;
    case Thunk: {
      Node.Thunk<W> thunk = data.asThunk().orElseThrow();
      MonoidalGraph<W> body = synthesize(thunk.getBody(), ordering).flatten();
      operations.add(new SliceOp<>(MonoidalOp.thunk(thunk.getArgs(), outputs, body), path));
      break;
    }
    default:
      throw new IllegalStateException("Boundary node " + node + " in a rank");
    }
    above.addAll(inputs);
    for (int i = 0; i < outputs; ++i)
      produced.add(new Port(node, new PortIndex(i)));
    return outputs;
  }

  /** Interleaves the layers into plain slices, dropping slices made only of identity wires. */
  public MonoidalGraph<W> flatten() {
    List<Slice<W>> slices = new ArrayList<>();
    for (WiringLayer<W> layer : layers) {
      keep(slices, layer.operations());
      keep(slices, layer.copies());
      layer.swaps().forEach(swap -> keep(slices, swap));
    }
    return new MonoidalGraph<>(inputs, slices);
  }

  private static <W> void keep(List<Slice<W>> slices, Slice<W> slice) {
    if (!slice.isIdentity())
      slices.add(slice);
  }

  /** The wire provenance at the bottom of the diagram, i.e. the sources of the graph outputs. */
  public Optional<List<Port>> outputWires() {
    if (layers.isEmpty())
      return Optional.empty();
    return Optional.of(layers.get(layers.size() - 1).below());
  }

}
