package sdcore.hypergraph;

import java.util.Objects;
import java.util.Optional;

/**
 * The data stored for a node of a {@link HyperGraph}.
 * A node is either a leaf operation carrying a weight, one of the two boundary markers, or a thunk owning a nested graph.
 * @param <W> the operation weight (operator identity)
 */
public abstract class Node<W> {

  /** Tag for the node variants, for exhaustive switches. */
  public enum Kind {
    /** A leaf computation with a weight. */
    Operation("operation"),
    /** Boundary marker for free parameters entering a graph. Has no inputs. */
    Input("input"),
    /** Boundary marker for values leaving a graph. Has no outputs. */
    Output("output"),
    /** A nested scope that owns its own graph. */
    Thunk("thunk");

    public final String serialName;

    private Kind(String serialName) { this.serialName = serialName; }
  }

  private Node() {}

  public abstract Kind getKind();

  public boolean isInput() { return getKind() == Kind.Input; }
  public boolean isOutput() { return getKind() == Kind.Output; }
  /** Input and Output nodes are boundary nodes; they are not lowered to operations. */
  public boolean isBoundary() { return isInput() || isOutput(); }

  /** The weight of an {@link Kind#Operation} node, empty for all other kinds. */
  public Optional<W> getWeight() { return Optional.empty(); }

  /** Returns this node as a thunk, or empty if it is not one. */
  public Optional<Thunk<W>> asThunk() { return Optional.empty(); }

  public static <W> Node<W> weight(W weight) { return new Operation<>(weight); }
  public static <W> Node<W> input() { return new Input<>(); }
  public static <W> Node<W> output() { return new Output<>(); }
  public static <W> Node<W> thunk(int args, HyperGraph<W> body) { return new Thunk<>(args, body); }

  public static final class Operation<W> extends Node<W> {
    private final W weight;

    Operation(W weight) { this.weight = Objects.requireNonNull(weight); }

    @Override
    public Kind getKind() {
      return Kind.Operation;
    }
    @Override
    public Optional<W> getWeight() {
      return Optional.of(weight);
    }
    @Override
    public boolean equals(Object obj) {
      return obj instanceof Operation && weight.equals(((Operation<?>)obj).weight);
    }
    @Override
    public int hashCode() {
      return weight.hashCode();
    }
    @Override
    public String toString() {
      return String.valueOf(weight);
    }
  }

  public static final class Input<W> extends Node<W> {
    @Override
    public Kind getKind() {
      return Kind.Input;
    }
    @Override
    public boolean equals(Object obj) {
      return obj instanceof Input;
    }
    @Override
    public int hashCode() {
      return Kind.Input.hashCode();
    }
    @Override
    public String toString() {
      return "Input";
    }
  }

  public static final class Output<W> extends Node<W> {
    @Override
    public Kind getKind() {
      return Kind.Output;
    }
    @Override
    public boolean equals(Object obj) {
      return obj instanceof Output;
    }
    @Override
    public int hashCode() {
      return Kind.Output.hashCode();
    }
    @Override
    public String toString() {
      return "Output";
    }
  }

  /**
   * A nested scope. The body's inputs are the captured free variables followed by the thunk's own {@code args} parameters,
   * so the thunk node itself consumes {@code body inputs - args} wires from the enclosing graph.
   */
  public static final class Thunk<W> extends Node<W> {
    private final int args;
    private final HyperGraph<W> body;

    Thunk(int args, HyperGraph<W> body) {
      if (args < 0)
        throw new IllegalArgumentException("args must not be negative");
      if (args > body.numberOfGraphInputs())
        throw new IllegalArgumentException(
            String.format("thunk declares %d args, but its body only has %d inputs", args, body.numberOfGraphInputs()));
      this.args = args;
      this.body = body;
    }

    /** Number of body inputs bound by the thunk itself. */
    public int getArgs() { return args; }
    /** The nested graph exclusively owned by this thunk. */
    public HyperGraph<W> getBody() { return body; }
    /** Number of body inputs captured from the enclosing scope. */
    public int getCaptures() { return body.numberOfGraphInputs() - args; }

    @Override
    public Kind getKind() {
      return Kind.Thunk;
    }
    @Override
    public Optional<Thunk<W>> asThunk() {
      return Optional.of(this);
    }
    @Override
    public String toString() {
      return String.format("Thunk(args=%d, body=%s)", args, body);
    }
  }
}
