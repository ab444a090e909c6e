package sdcore.reachability;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import sdcore.graph.EdgeLike;
import sdcore.graph.NodeLike;
import sdcore.graph.ThunkLike;

/**
 * Neighbourhood queries over any {@link NodeLike} view.
 * All returned sets iterate in discovery order.
 */
public final class Reachability {
  private Reachability() {}

  /** The distinct nodes consuming any output of {@code node}. Consumers outside the view are skipped. */
  public static <W> Set<NodeLike<W>> successors(NodeLike<W> node) {
    Set<NodeLike<W>> ret = new LinkedHashSet<>();
    for (EdgeLike<W> edge : node.outputs())
      for (Optional<NodeLike<W>> target : edge.targets())
        target.ifPresent(ret::add);
    return ret;
  }

  /** The distinct nodes producing any input of {@code node}. Boundary inputs are skipped. */
  public static <W> Set<NodeLike<W>> predecessors(NodeLike<W> node) {
    Set<NodeLike<W>> ret = new LinkedHashSet<>();
    for (EdgeLike<W> edge : node.inputs())
      edge.source().ifPresent(ret::add);
    return ret;
  }

  /**
   * The successors of {@code node}, each replaced by its enclosing thunk at the nesting level of {@code node}.
   * Successors that are not nested inside that level are dropped.
   */
  public static <W> Set<NodeLike<W>> flatSuccessors(NodeLike<W> node) {
    Optional<ThunkLike<W>> level = node.backlink();
    Set<NodeLike<W>> ret = new LinkedHashSet<>();
    for (NodeLike<W> successor : successors(node))
      liftTo(successor, level).ifPresent(ret::add);
    return ret;
  }

  /** The predecessors of {@code node} at its own nesting level; producers in enclosing levels are dropped. */
  public static <W> Set<NodeLike<W>> flatPredecessors(NodeLike<W> node) {
    Optional<ThunkLike<W>> level = node.backlink();
    Set<NodeLike<W>> ret = new LinkedHashSet<>();
    for (NodeLike<W> predecessor : predecessors(node))
      liftTo(predecessor, level).ifPresent(ret::add);
    return ret;
  }

  /**
   * Walks up the backlinks of {@code node} until reaching a node directly inside {@code level}.
   * @return the ancestor (or the node itself), or empty if {@code node} is not nested inside {@code level}
   */
  public static <W> Optional<NodeLike<W>> liftTo(NodeLike<W> node, Optional<ThunkLike<W>> level) {
    NodeLike<W> last = node;
    Optional<ThunkLike<W>> next = last.backlink();
    while (!Objects.equals(next, level)) {
      if (next.isEmpty())
        return Optional.empty();
      last = next.get();
      next = last.backlink();
    }
    return Optional.of(last);
  }

  public static <W> NReachable<W> forward(NodeLike<W> node, int depthLimit) {
    return NReachable.forwardFrom(List.of(node), depthLimit);
  }

  public static <W> NReachable<W> backward(NodeLike<W> node, int depthLimit) {
    return NReachable.backwardFrom(List.of(node), depthLimit);
  }

  /** The nodes both forward and backward reachable from {@code node} within the depth limit. */
  public static <W> Set<NodeLike<W>> bidirectional(NodeLike<W> node, int depthLimit) {
    return NReachable.bidirectionalFrom(List.of(node), depthLimit);
  }

  /** Unlimited forward reachability, including the nodes themselves. */
  public static <W> Set<NodeLike<W>> forwardClosure(Collection<? extends NodeLike<W>> nodes) {
    Set<NodeLike<W>> ret = new LinkedHashSet<>();
    NReachable.forwardFrom(nodes, NReachable.UNLIMITED).forEachRemaining(ret::add);
    return ret;
  }

  /** Unlimited backward reachability, including the nodes themselves. */
  public static <W> Set<NodeLike<W>> backwardClosure(Collection<? extends NodeLike<W>> nodes) {
    Set<NodeLike<W>> ret = new LinkedHashSet<>();
    NReachable.backwardFrom(nodes, NReachable.UNLIMITED).forEachRemaining(ret::add);
    return ret;
  }
}
