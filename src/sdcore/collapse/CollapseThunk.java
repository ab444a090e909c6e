package sdcore.collapse;

import java.util.List;
import java.util.Optional;
import sdcore.graph.EdgeLike;
import sdcore.graph.NodeLike;
import sdcore.graph.ThunkLike;

/** An expanded thunk of a {@link CollapseGraph}. */
public class CollapseThunk<W> implements ThunkLike<W> {
  private final ThunkLike<W> thunk;
  private final CollapseContext<W> context;

  CollapseThunk(ThunkLike<W> thunk, CollapseContext<W> context) {
    this.thunk = thunk;
    this.context = context;
  }

  public ThunkLike<W> inner() { return thunk; }

  @Override
  public List<EdgeLike<W>> inputs() {
    return context.edges(thunk.inputs());
  }
  @Override
  public List<EdgeLike<W>> outputs() {
    return context.edges(thunk.outputs());
  }
  @Override
  public Optional<ThunkLike<W>> backlink() {
    return thunk.backlink().map(context::thunk);
  }
  @Override
  public Optional<ThunkLike<W>> asThunk() {
    return Optional.of(this);
  }
  @Override
  public Optional<W> weight() {
    return thunk.weight();
  }
  @Override
  public int numberOfInputs() {
    return thunk.numberOfInputs();
  }
  @Override
  public int numberOfOutputs() {
    return thunk.numberOfOutputs();
  }
  @Override
  public int args() {
    return thunk.args();
  }

  @Override
  public List<EdgeLike<W>> freeGraphInputs() {
    return context.edges(thunk.freeGraphInputs());
  }
  @Override
  public List<EdgeLike<W>> boundGraphInputs() {
    return context.edges(thunk.boundGraphInputs());
  }
  @Override
  public List<EdgeLike<W>> graphOutputs() {
    return context.edges(thunk.graphOutputs());
  }
  @Override
  public List<NodeLike<W>> nodes() {
    return thunk.nodes().stream().map(context::node).toList();
  }
  @Override
  public Optional<ThunkLike<W>> graphBacklink() {
    return Optional.of(this);
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof CollapseThunk && thunk.equals(((CollapseThunk<?>)obj).thunk);
  }
  @Override
  public int hashCode() {
    return thunk.hashCode();
  }
  @Override
  public String toString() {
    return "expanded " + thunk;
  }
}
