package sdcore.hypergraph;

/** No node at the given index. */
public class UnknownNodeException extends HyperGraphException {
  private static final long serialVersionUID = 1L;

  private final NodeIndex node;

  public UnknownNodeException(NodeIndex node) {
    super(String.format("No node at index %s", node));
    this.node = node;
  }

  public NodeIndex getNode() { return node; }
}
