package sdcore.subgraph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import sdcore.graph.EdgeLike;
import sdcore.graph.NodeLike;
import sdcore.graph.ThunkLike;
import sdcore.reachability.NReachable;
import sdcore.reachability.Reachability;

/**
 * A normalized node selection: all nodes on one nesting level, ready for {@link SubgraphExtractor}.
 * <p>
 * Normalization repeats the following steps until nothing changes:
 * <ol>
 * <li>nodes nested in a selected thunk are dropped, and the remaining nodes are lifted to the innermost level
 *   enclosing all of them;</li>
 * <li>with convex closure enabled, every node lying on a path between two selected nodes is added;</li>
 * <li>with source extension enabled, the producer of a selected node's input is added
 *   if all of its consumers are selected.</li>
 * </ol>
 */
public final class Selection<W> {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** Switches for the optional normalization steps. */
  public record Options(boolean extendSources, boolean convexClosure) {
    public static final Options DEFAULT = new Options(true, true);
  }

  private final Optional<ThunkLike<W>> level;
  private final Set<NodeLike<W>> nodes;

  private Selection(Optional<ThunkLike<W>> level, Set<NodeLike<W>> nodes) {
    this.level = level;
    this.nodes = nodes;
  }

  /** The thunk whose body holds the selected nodes, or empty for the top level. */
  public Optional<ThunkLike<W>> getLevel() { return level; }

  /** The selected nodes, in selection order followed by the order they were added in. */
  public Set<NodeLike<W>> getNodes() { return nodes; }

  public boolean isEmpty() { return nodes.isEmpty(); }

  public static <W> Selection<W> normalize(Collection<? extends NodeLike<W>> raw) { return normalize(raw, Options.DEFAULT); }

  public static <W> Selection<W> normalize(Collection<? extends NodeLike<W>> raw, Options options) {
    Set<NodeLike<W>> current = new LinkedHashSet<>(raw);
    Optional<ThunkLike<W>> level = Optional.empty();
    int rounds = 0;
    while (true) {
      ++rounds;
      current = dropNested(current);
      level = commonLevel(current);
      current = liftAll(current, level);
      Set<NodeLike<W>> next = new LinkedHashSet<>(current);
      if (options.convexClosure())
        next.addAll(convexClosure(current));
      if (options.extendSources())
        extendSources(next, level);
      if (next.equals(current))
        break;
      current = next;
    }
    logger.debug("Normalized selection of {} nodes to {} nodes in {} rounds", raw.size(), current.size(), rounds);
    return new Selection<>(level, current);
  }

  /** Drops nodes that have a selected thunk among their ancestors. */
  private static <W> Set<NodeLike<W>> dropNested(Set<NodeLike<W>> nodes) {
    Set<NodeLike<W>> ret = new LinkedHashSet<>();
    for (NodeLike<W> node : nodes) {
      boolean nested = false;
      for (Optional<ThunkLike<W>> cur = node.backlink(); cur.isPresent() && !nested; cur = cur.get().backlink())
        nested = nodes.contains(cur.get());
      if (!nested)
        ret.add(node);
    }
    return ret;
  }

  /** The backlinks of a node, outermost first. */
  private static <W> List<ThunkLike<W>> ancestors(NodeLike<W> node) {
    LinkedList<ThunkLike<W>> ret = new LinkedList<>();
    for (Optional<ThunkLike<W>> cur = node.backlink(); cur.isPresent(); cur = cur.get().backlink())
      ret.addFirst(cur.get());
    return ret;
  }

  /** The innermost level enclosing all given nodes. */
  static <W> Optional<ThunkLike<W>> commonLevel(Collection<NodeLike<W>> nodes) {
    List<ThunkLike<W>> common = null;
    for (NodeLike<W> node : nodes) {
      List<ThunkLike<W>> chain = ancestors(node);
      if (common == null) {
        common = new ArrayList<>(chain);
        continue;
      }
      int shared = 0;
      while (shared < common.size() && shared < chain.size() && common.get(shared).equals(chain.get(shared)))
        ++shared;
      common = new ArrayList<>(common.subList(0, shared));
    }
    if (common == null || common.isEmpty())
      return Optional.empty();
    return Optional.of(common.get(common.size() - 1));
  }

  private static <W> Set<NodeLike<W>> liftAll(Set<NodeLike<W>> nodes, Optional<ThunkLike<W>> level) {
    Set<NodeLike<W>> ret = new LinkedHashSet<>();
    for (NodeLike<W> node : nodes) {
      NodeLike<W> lifted = Reachability.liftTo(node, level)
                               .orElseThrow(() -> new IllegalStateException(node + " is not nested in the common level " + level));
      ret.add(lifted);
    }
    return ret;
  }

  /** The nodes of the level lying on a path between two selected nodes (including the selected nodes). */
  private static <W> Set<NodeLike<W>> convexClosure(Set<NodeLike<W>> nodes) {
    Set<NodeLike<W>> forward = new LinkedHashSet<>();
    NReachable.from(nodes, NReachable.UNLIMITED, Reachability::flatSuccessors).forEachRemaining(forward::add);
    Set<NodeLike<W>> backward = new LinkedHashSet<>();
    NReachable.from(nodes, NReachable.UNLIMITED, Reachability::flatPredecessors).forEachRemaining(backward::add);
    forward.retainAll(backward);
    return forward;
  }

  /** Adds the producers on the level that only feed selected nodes. */
  private static <W> void extendSources(Set<NodeLike<W>> nodes, Optional<ThunkLike<W>> level) {
    List<NodeLike<W>> added = new ArrayList<>();
    for (NodeLike<W> node : nodes) {
      for (EdgeLike<W> edge : node.inputs()) {
        Optional<NodeLike<W>> source = edge.extendSource().flatMap(src -> Reachability.liftTo(src, level));
        if (source.isEmpty() || nodes.contains(source.get()) || added.contains(source.get()))
          continue;
        boolean onlyFeedsSelection = true;
        for (EdgeLike<W> output : source.get().outputs()) {
          for (Optional<NodeLike<W>> target : output.targets()) {
            Optional<NodeLike<W>> lifted = target.flatMap(t -> Reachability.liftTo(t, level));
            if (lifted.isEmpty() || !nodes.contains(lifted.get()))
              onlyFeedsSelection = false;
          }
        }
        if (onlyFeedsSelection)
          added.add(source.get());
      }
    }
    nodes.addAll(added);
  }

  @Override
  public String toString() {
    return String.format("Selection { level: %s, nodes: %s }", level.map(String::valueOf).orElse("top"), nodes);
  }
}
