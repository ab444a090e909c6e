package sdcore.monoidal;

import java.util.List;
import sdcore.hypergraph.NodeIndex;

/**
 * A box of a slice together with its provenance: the path of the hypergraph node it was lowered from,
 *  outermost thunk first. Wiring boxes have an empty path.
 */
public record SliceOp<W>(MonoidalOp<W> op, List<NodeIndex> path) {
  public SliceOp {
    path = List.copyOf(path);
  }

  public static <W> SliceOp<W> wiring(MonoidalOp<W> op) { return new SliceOp<>(op, List.of()); }
  public static <W> SliceOp<W> id() { return wiring(MonoidalOp.<W>id()); }
  public static <W> SliceOp<W> swap() { return wiring(MonoidalOp.<W>swap()); }
}
