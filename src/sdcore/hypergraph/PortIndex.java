package sdcore.hypergraph;

/** Index of an input or output slot of a node. */
public record PortIndex(int index) implements Comparable<PortIndex> {
  public PortIndex {
    if (index < 0)
      throw new IllegalArgumentException("index must not be negative");
  }

  @Override
  public int compareTo(PortIndex other) {
    return Integer.compare(index, other.index);
  }

  @Override
  public String toString() {
    return "p" + index;
  }
}
