package sdcore.monoidal;

/** Raised when a graph level has no operations or thunks to lower to a diagram. */
public class EmptyGraphException extends Exception {
  private static final long serialVersionUID = 1L;

  public EmptyGraphException(String message) { super(message); }
}
