package sdcore.hypergraph;

import java.util.Comparator;

/**
 * Address of one port of a node: the node's index and the slot on that node.
 * Depending on context, this addresses an output (the source of a hyperedge) or an input (one of its consumers).
 */
public record Port(NodeIndex node, PortIndex index) implements Comparable<Port> {
  private static final Comparator<Port> ORDER = Comparator.comparing(Port::node).thenComparing(Port::index);

  public static Port of(int node, int index) { return new Port(new NodeIndex(node), new PortIndex(index)); }

  @Override
  public int compareTo(Port other) {
    return ORDER.compare(this, other);
  }

  @Override
  public String toString() {
    return String.format("(%d, %d)", node.index(), index.index());
  }
}
