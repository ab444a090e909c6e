package sdcore.monoidal;

import java.util.Collections;
import java.util.List;

/** One horizontal layer of a {@link MonoidalGraph}: boxes placed side by side. */
public record Slice<W>(List<SliceOp<W>> ops) {
  public Slice {
    ops = List.copyOf(ops);
  }

  public static <W> Slice<W> identity(int wires) { return new Slice<W>(Collections.nCopies(wires, SliceOp.<W>id())); }

  public int numberOfInputs() { return ops.stream().mapToInt(op -> op.op().numberOfInputs()).sum(); }

  public int numberOfOutputs() { return ops.stream().mapToInt(op -> op.op().numberOfOutputs()).sum(); }

  /** True if every box is an identity wire; such slices carry no information. */
  public boolean isIdentity() { return ops.stream().allMatch(op -> op.op().isIdentity()); }
}
