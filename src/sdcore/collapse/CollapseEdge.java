package sdcore.collapse;

import java.util.List;
import java.util.Optional;
import sdcore.graph.EdgeLike;
import sdcore.graph.NodeLike;

/**
 * An edge of a {@link CollapseGraph}. Endpoints inside collapsed thunks are replaced by the outermost such thunk,
 *  not the innermost one, so that no endpoint lies inside a collapsed region when collapsed thunks are nested.
 */
public class CollapseEdge<W> implements EdgeLike<W> {
  private final EdgeLike<W> edge;
  private final CollapseContext<W> context;

  CollapseEdge(EdgeLike<W> edge, CollapseContext<W> context) {
    this.edge = edge;
    this.context = context;
  }

  public EdgeLike<W> inner() { return edge; }

  @Override
  public Optional<NodeLike<W>> source() {
    return edge.source().map(node -> context.node(context.visible(node)));
  }
  @Override
  public List<Optional<NodeLike<W>>> targets() {
    return edge.targets().stream().map(target -> target.map(node -> context.node(context.visible(node)))).toList();
  }
  @Override
  public Optional<NodeLike<W>> extendSource() {
    return edge.extendSource().map(node -> context.node(context.visible(node)));
  }
  @Override
  public List<NodeLike<W>> extendTargets() {
    return edge.extendTargets().stream().map(node -> context.node(context.visible(node))).distinct().toList();
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof CollapseEdge && edge.equals(((CollapseEdge<?>)obj).edge);
  }
  @Override
  public int hashCode() {
    return edge.hashCode();
  }
  @Override
  public String toString() {
    return edge.toString();
  }
}
