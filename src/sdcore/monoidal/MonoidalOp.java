package sdcore.monoidal;

import java.util.Objects;

/**
 * One box of a {@link Slice}. The arity functions dispatch on the variant.
 * @param <W> the operation weight
 */
public abstract class MonoidalOp<W> {

  public enum Kind {
    /** Fan-out of one wire into {@code copies} wires. One copy is an identity wire, zero copies a delete. */
    Copy("copy"),
    /** Introduces a fresh wire, standing for a thunk parameter in an unfolded body. */
    Unit("unit"),
    Operation("operation"),
    Thunk("thunk"),
    /** Crosses two adjacent wires. */
    Swap("swap");

    public final String serialName;

    private Kind(String serialName) { this.serialName = serialName; }
  }

  private MonoidalOp() {}

  public abstract Kind getKind();

  public abstract int numberOfInputs();

  public abstract int numberOfOutputs();

  /** An identity wire, i.e. a copy with one output. */
  public boolean isIdentity() { return false; }

  public static <W> MonoidalOp<W> copy(int copies) { return new Copy<>(copies); }
  public static <W> MonoidalOp<W> id() { return new Copy<>(1); }
  public static <W> MonoidalOp<W> delete() { return new Copy<>(0); }
  public static <W> MonoidalOp<W> unit() { return new Unit<>(); }
  public static <W> MonoidalOp<W> swap() { return new Swap<>(); }
  public static <W> MonoidalOp<W> operation(int inputs, int outputs, W op) { return new Operation<>(inputs, outputs, op); }
  public static <W> MonoidalOp<W> thunk(int args, int outputs, MonoidalGraph<W> body) { return new Thunk<>(args, outputs, body); }

  public static final class Copy<W> extends MonoidalOp<W> {
    private final int copies;

    Copy(int copies) {
      if (copies < 0)
        throw new IllegalArgumentException("copies must not be negative");
      this.copies = copies;
    }

    public int getCopies() { return copies; }

    @Override
    public Kind getKind() {
      return Kind.Copy;
    }
    @Override
    public int numberOfInputs() {
      return 1;
    }
    @Override
    public int numberOfOutputs() {
      return copies;
    }
    @Override
    public boolean isIdentity() {
      return copies == 1;
    }
    @Override
    public boolean equals(Object obj) {
      return obj instanceof Copy && ((Copy<?>)obj).copies == copies;
    }
    @Override
    public int hashCode() {
      return Objects.hash(Kind.Copy, copies);
    }
    @Override
    public String toString() {
      if (copies == 0)
        return "Delete";
      if (copies == 1)
        return "Id";
      return "Copy(" + copies + ")";
    }
  }

  public static final class Unit<W> extends MonoidalOp<W> {
    @Override
    public Kind getKind() {
      return Kind.Unit;
    }
    @Override
    public int numberOfInputs() {
      return 0;
    }
    @Override
    public int numberOfOutputs() {
      return 1;
    }
    @Override
    public boolean equals(Object obj) {
      return obj instanceof Unit;
    }
    @Override
    public int hashCode() {
      return Kind.Unit.hashCode();
    }
    @Override
    public String toString() {
      return "Unit";
    }
  }

  public static final class Swap<W> extends MonoidalOp<W> {
    @Override
    public Kind getKind() {
      return Kind.Swap;
    }
    @Override
    public int numberOfInputs() {
      return 2;
    }
    @Override
    public int numberOfOutputs() {
      return 2;
    }
    @Override
    public boolean equals(Object obj) {
      return obj instanceof Swap;
    }
    @Override
    public int hashCode() {
      return Kind.Swap.hashCode();
    }
    @Override
    public String toString() {
      return "Swap";
    }
  }

  public static final class Operation<W> extends MonoidalOp<W> {
    private final int inputs;
    private final int outputs;
    private final W op;

    Operation(int inputs, int outputs, W op) {
      if (inputs < 0 || outputs < 0)
        throw new IllegalArgumentException("arity must not be negative");
      this.inputs = inputs;
      this.outputs = outputs;
      this.op = Objects.requireNonNull(op);
    }

    public W getOp() { return op; }

    @Override
    public Kind getKind() {
      return Kind.Operation;
    }
    @Override
    public int numberOfInputs() {
      return inputs;
    }
    @Override
    public int numberOfOutputs() {
      return outputs;
    }
    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Operation))
        return false;
      Operation<?> other = (Operation<?>)obj;
      return inputs == other.inputs && outputs == other.outputs && op.equals(other.op);
    }
    @Override
    public int hashCode() {
      return Objects.hash(Kind.Operation, inputs, outputs, op);
    }
    @Override
    public String toString() {
      return String.format("%s(%d->%d)", op, inputs, outputs);
    }
  }

  /** A thunk box; it consumes the captured wires, i.e. the body inputs not bound by {@code args}. */
  public static final class Thunk<W> extends MonoidalOp<W> {
    private final int args;
    private final int outputs;
    private final MonoidalGraph<W> body;

    Thunk(int args, int outputs, MonoidalGraph<W> body) {
      if (args < 0 || args > body.inputs())
        throw new IllegalArgumentException(String.format("thunk declares %d args, but its body has %d inputs", args, body.inputs()));
      this.args = args;
      this.outputs = outputs;
      this.body = body;
    }

    public int getArgs() { return args; }
    public MonoidalGraph<W> getBody() { return body; }

    @Override
    public Kind getKind() {
      return Kind.Thunk;
    }
    @Override
    public int numberOfInputs() {
      return body.inputs() - args;
    }
    @Override
    public int numberOfOutputs() {
      return outputs;
    }
    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Thunk))
        return false;
      Thunk<?> other = (Thunk<?>)obj;
      return args == other.args && outputs == other.outputs && body.equals(other.body);
    }
    @Override
    public int hashCode() {
      return Objects.hash(Kind.Thunk, args, outputs, body);
    }
    @Override
    public String toString() {
      return String.format("Thunk(args=%d, outputs=%d, slices=%d)", args, outputs, body.slices().size());
    }
  }
}
