package sdcore.monoidal;

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import sdcore.hypergraph.NodeIndex;
import sdcore.hypergraph.PortIndex;

/**
 * Chooses the left-to-right order of the producers of one rank's open wires.
 * Implementations must be pure: the same demands always yield the same order.
 */
@FunctionalInterface
public interface WireOrdering {

  /**
   * The open wires demanded from one producing node.
   * @param node the producer
   * @param wires per output port of the producer, the positions of the open wires it feeds (ascending)
   */
  record Demand(NodeIndex node, SortedMap<PortIndex, List<Integer>> wires) {
    public Demand {
      TreeMap<PortIndex, List<Integer>> copy = new TreeMap<>();
      wires.forEach((port, positions) -> copy.put(port, List.copyOf(positions)));
      wires = Collections.unmodifiableSortedMap(copy);
    }

    /** Number of open wires fed by this producer. */
    public int count() { return wires.values().stream().mapToInt(List::size).sum(); }

    /** Sum of the positions of the open wires fed by this producer. */
    public long positionSum() { return wires.values().stream().flatMap(List::stream).mapToLong(Integer::longValue).sum(); }
  }

  /**
   * @param demands one entry per producer, ordered by node index
   * @return the same entries in the order the producers should be placed
   */
  List<Demand> order(List<Demand> demands);

  /** The default ordering. */
  static WireOrdering barycenter() { return new BarycenterOrdering(); }

  static WireOrdering natural() { return new NaturalOrdering(); }

  /** Looks up a built-in ordering by its configuration name. */
  static Optional<WireOrdering> byName(String name) {
    if (BarycenterOrdering.NAME.equals(name))
      return Optional.of(barycenter());
    if (NaturalOrdering.NAME.equals(name))
      return Optional.of(natural());
    return Optional.empty();
  }
}
