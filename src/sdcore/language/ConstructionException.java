package sdcore.language;

/** Raised when an expression cannot be lowered to a hypergraph. */
public class ConstructionException extends Exception {
  private static final long serialVersionUID = 1L;

  public ConstructionException(String message) { super(message); }
  public ConstructionException(String message, Throwable cause) { super(message, cause); }
}
