package sdcore.reachability;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Function;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import sdcore.graph.NodeLike;

/**
 * Lazy breadth-first traversal with a depth limit.
 * <p>
 * The start nodes have depth 0. Each node is returned at most once.
 * Once the next frontier entry lies beyond the depth limit, {@link #hasNext()} returns false,
 *  but the frontier is kept: after {@link #increaseDepthLimit(int)}, iteration resumes where it stopped.
 */
public class NReachable<W> implements Iterator<NodeLike<W>> {
  public static final int UNLIMITED = Integer.MAX_VALUE;

  private record Entry<W>(int depth, NodeLike<W> node) {}

  private final Function<NodeLike<W>, Set<NodeLike<W>>> nextNodes;
  private final Set<NodeLike<W>> seen = new HashSet<>();
  // depths are monotonically increasing from head to tail
  private final ArrayDeque<Entry<W>> frontier = new ArrayDeque<>();
  private int depthLimit;

  private NReachable(Collection<? extends NodeLike<W>> start, int depthLimit, Function<NodeLike<W>, Set<NodeLike<W>>> nextNodes) {
    if (depthLimit < 0)
      throw new IllegalArgumentException("depthLimit must not be negative");
    this.nextNodes = nextNodes;
    this.depthLimit = depthLimit;
    for (NodeLike<W> node : start)
      frontier.add(new Entry<>(0, node));
  }

  /** A traversal along an arbitrary neighbour relation, e.g. {@link Reachability#flatSuccessors(NodeLike)}. */
  public static <W> NReachable<W> from(Collection<? extends NodeLike<W>> nodes, int depthLimit,
                                       Function<NodeLike<W>, Set<NodeLike<W>>> nextNodes) {
    return new NReachable<>(nodes, depthLimit, nextNodes);
  }

  public static <W> NReachable<W> forwardFrom(Collection<? extends NodeLike<W>> nodes, int depthLimit) {
    return new NReachable<>(nodes, depthLimit, Reachability::successors);
  }

  public static <W> NReachable<W> backwardFrom(Collection<? extends NodeLike<W>> nodes, int depthLimit) {
    return new NReachable<>(nodes, depthLimit, Reachability::predecessors);
  }

  /** The intersection of forward and backward reachability from the same nodes, in forward discovery order. */
  public static <W> Set<NodeLike<W>> bidirectionalFrom(Collection<? extends NodeLike<W>> nodes, int depthLimit) {
    Set<NodeLike<W>> forward = new LinkedHashSet<>();
    forwardFrom(nodes, depthLimit).forEachRemaining(forward::add);
    Set<NodeLike<W>> backward = new HashSet<>();
    backwardFrom(nodes, depthLimit).forEachRemaining(backward::add);
    forward.retainAll(backward);
    return forward;
  }

  public int getDepthLimit() { return depthLimit; }

  public void bumpDepthLimit() { increaseDepthLimit(1); }

  /** Raises the depth limit, saturating at {@link #UNLIMITED}. */
  public void increaseDepthLimit(int n) {
    if (n < 0)
      throw new IllegalArgumentException("n must not be negative");
    depthLimit = (int)Math.min((long)depthLimit + n, UNLIMITED);
  }

  @Override
  public boolean hasNext() {
    while (!frontier.isEmpty() && seen.contains(frontier.peekFirst().node()))
      frontier.pollFirst();
    return !frontier.isEmpty() && frontier.peekFirst().depth() <= depthLimit;
  }

  @Override
  public NodeLike<W> next() {
    if (!hasNext())
      throw new NoSuchElementException();
    Entry<W> entry = frontier.pollFirst();
    seen.add(entry.node());
    for (NodeLike<W> next : nextNodes.apply(entry.node())) {
      if (!seen.contains(next))
        frontier.addLast(new Entry<>(entry.depth() + 1, next));
    }
    return entry.node();
  }

  /** Streams the remaining nodes up to the current depth limit. */
  public Stream<NodeLike<W>> stream() {
    return StreamSupport.stream(Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL), false);
  }
}
