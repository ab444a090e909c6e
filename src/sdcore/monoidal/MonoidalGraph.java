package sdcore.monoidal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import sdcore.hypergraph.HyperGraph;
import sdcore.hypergraph.NodeIndex;

/**
 * A string diagram as a sequence of slices, top (inputs) to bottom (outputs).
 * Adjacent slices agree on their wire count, and the first slice consumes {@code inputs} wires.
 */
public record MonoidalGraph<W>(int inputs, List<Slice<W>> slices) {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public MonoidalGraph {
    if (inputs < 0)
      throw new IllegalArgumentException("inputs must not be negative");
    slices = List.copyOf(slices);
  }

  /** Synthesizes the diagram of one graph level with the default wire ordering. */
  public static <W> MonoidalGraph<W> fromHyperGraph(HyperGraph<W> graph) throws EmptyGraphException {
    return fromHyperGraph(graph, WireOrdering.barycenter());
  }

  public static <W> MonoidalGraph<W> fromHyperGraph(HyperGraph<W> graph, WireOrdering ordering) throws EmptyGraphException {
    return WiredGraph.fromHyperGraph(graph, ordering).flatten();
  }

  public int numberOfOutputs() { return slices.isEmpty() ? inputs : slices.get(slices.size() - 1).numberOfOutputs(); }

  /**
   * Verifies that adjacent slices agree on their wire count, recursing into thunk bodies.
   * @throws IllegalStateException on the first mismatch
   */
  public void checkArity() {
    int wires = inputs;
    for (int i = 0; i < slices.size(); ++i) {
      Slice<W> slice = slices.get(i);
      if (slice.numberOfInputs() != wires)
        throw new IllegalStateException(String.format("Slice %d consumes %d wires, but %d are available", i, slice.numberOfInputs(), wires));
      for (SliceOp<W> entry : slice.ops()) {
        if (entry.op() instanceof MonoidalOp.Thunk)
          ((MonoidalOp.Thunk<W>)entry.op()).getBody().checkArity();
      }
      wires = slice.numberOfOutputs();
    }
  }

  /**
   * Replaces the thunk box with the given provenance path by its body, spliced in place.
   * The box's captured wires pass straight into the body, and each parameter is introduced by a {@link MonoidalOp.Unit}.
   * The boxes beside it are padded with identity wires until the body is complete.
   * Boxes inside the body keep their provenance, prefixed with the thunk's path.
   * @return the unfolded graph; equal to this one if no box has that path
   * @throws IllegalArgumentException if the thunk's body does not produce as many wires as the thunk box
   */
  public MonoidalGraph<W> unfold(List<NodeIndex> thunkPath) {
    List<Slice<W>> ret = new ArrayList<>();
    boolean found = false;
    for (Slice<W> slice : slices) {
      if (slice.ops().isEmpty()) {
        ret.add(slice);
        continue;
      }
      List<List<Slice<W>>> columns = new ArrayList<>();
      for (SliceOp<W> entry : slice.ops()) {
        if (entry.op() instanceof MonoidalOp.Thunk && entry.path().equals(thunkPath)) {
          columns.add(unfoldedColumn(entry.path(), (MonoidalOp.Thunk<W>)entry.op()));
          found = true;
        } else {
          columns.add(List.of(new Slice<>(List.of(entry))));
        }
      }
      int height = columns.stream().mapToInt(List::size).max().orElse(0);
      for (int i = 0; i < height; ++i) {
        List<SliceOp<W>> ops = new ArrayList<>();
        for (List<Slice<W>> column : columns) {
          if (i < column.size())
            ops.addAll(column.get(i).ops());
          else
            ops.addAll(Slice.<W>identity(column.get(column.size() - 1).numberOfOutputs()).ops());
        }
        ret.add(new Slice<>(ops));
      }
    }
    if (!found)
      logger.debug("unfold: no thunk at {}", thunkPath);
    return new MonoidalGraph<>(inputs, ret);
  }

  private static <W> List<Slice<W>> unfoldedColumn(List<NodeIndex> path, MonoidalOp.Thunk<W> thunk) {
    MonoidalGraph<W> body = thunk.getBody();
    if (body.numberOfOutputs() != thunk.numberOfOutputs())
      throw new IllegalArgumentException(
          String.format("Thunk at %s has %d outputs, but its body produces %d", path, thunk.numberOfOutputs(), body.numberOfOutputs()));
    List<Slice<W>> column = new ArrayList<>();
    List<SliceOp<W>> entry = new ArrayList<>();
    entry.addAll(Collections.nCopies(thunk.numberOfInputs(), new SliceOp<W>(MonoidalOp.<W>id(), path)));
    entry.addAll(Collections.nCopies(thunk.getArgs(), new SliceOp<W>(MonoidalOp.<W>unit(), path)));
    column.add(new Slice<>(entry));
    for (Slice<W> bodySlice : body.slices()) {
      List<SliceOp<W>> ops = new ArrayList<>();
      for (SliceOp<W> op : bodySlice.ops()) {
        List<NodeIndex> prefixed = new ArrayList<>(path);
        prefixed.addAll(op.path());
        ops.add(new SliceOp<>(op.op(), prefixed));
      }
      column.add(new Slice<>(ops));
    }
    return column;
  }
}
