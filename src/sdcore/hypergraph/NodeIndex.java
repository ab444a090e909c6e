package sdcore.hypergraph;

/**
 * Index of a node within one {@link HyperGraph} level. Indices are stable for the lifetime of the graph.
 */
public record NodeIndex(int index) implements Comparable<NodeIndex> {
  public NodeIndex {
    if (index < 0)
      throw new IllegalArgumentException("index must not be negative");
  }

  @Override
  public int compareTo(NodeIndex other) {
    return Integer.compare(index, other.index);
  }

  @Override
  public String toString() {
    return "n" + index;
  }
}
