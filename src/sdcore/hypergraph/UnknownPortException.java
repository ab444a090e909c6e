package sdcore.hypergraph;

/** The node exists, but has no port at the given index. */
public class UnknownPortException extends HyperGraphException {
  private static final long serialVersionUID = 1L;

  private final Port port;

  public UnknownPortException(Port port) {
    super(String.format("Node %s has no port %s", port.node(), port.index()));
    this.port = port;
  }

  public Port getPort() { return port; }
}
