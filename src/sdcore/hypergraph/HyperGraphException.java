package sdcore.hypergraph;

/**
 * Raised when a structural reference (an edge endpoint, a path element) addresses something absent from a {@link HyperGraph}.
 */
public class HyperGraphException extends Exception {
  private static final long serialVersionUID = 1L;

  public HyperGraphException(String message) { super(message); }
}
