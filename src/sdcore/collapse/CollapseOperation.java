package sdcore.collapse;

import java.util.List;
import java.util.Optional;
import sdcore.graph.EdgeLike;
import sdcore.graph.NodeLike;
import sdcore.graph.ThunkLike;

/**
 * An operation of a {@link CollapseGraph}: either an operation of the inner graph,
 *  or a collapsed thunk whose body is hidden from traversal.
 */
public class CollapseOperation<W> implements NodeLike<W> {
  private final NodeLike<W> node;
  private final CollapseContext<W> context;

  CollapseOperation(NodeLike<W> node, CollapseContext<W> context) {
    this.node = node;
    this.context = context;
  }

  public NodeLike<W> inner() { return node; }

  /** The hidden thunk, if this operation stands for a collapsed one. */
  public Optional<ThunkLike<W>> folded() { return node.asThunk(); }

  @Override
  public List<EdgeLike<W>> inputs() {
    return context.edges(node.inputs());
  }
  @Override
  public List<EdgeLike<W>> outputs() {
    return context.edges(node.outputs());
  }
  @Override
  public Optional<ThunkLike<W>> backlink() {
    return node.backlink().map(context::thunk);
  }
  @Override
  public Optional<ThunkLike<W>> asThunk() {
    return Optional.empty();
  }
  @Override
  public Optional<W> weight() {
    return node.weight();
  }
  @Override
  public int numberOfInputs() {
    return node.numberOfInputs();
  }
  @Override
  public int numberOfOutputs() {
    return node.numberOfOutputs();
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof CollapseOperation && node.equals(((CollapseOperation<?>)obj).node);
  }
  @Override
  public int hashCode() {
    return node.hashCode();
  }
  @Override
  public String toString() {
    return folded().isPresent() ? "collapsed " + node : node.toString();
  }
}
