package sdcore.collapse;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import sdcore.hypergraph.NodeIndex;

/**
 * Immutable map from thunk identity (its node path, outermost thunk first) to its expansion flag.
 * <p>
 * Only the thunks differing from the default are stored, so two states answering every query the same are equal.
 * Every update returns a new state and leaves this one untouched, which makes old states usable as undo snapshots.
 */
public final class ExpansionState {
  private final boolean defaultExpanded;
  private final Map<List<NodeIndex>, Boolean> overrides;

  private ExpansionState(boolean defaultExpanded, Map<List<NodeIndex>, Boolean> overrides) {
    this.defaultExpanded = defaultExpanded;
    this.overrides = overrides;
  }

  /** A state in which every thunk has the given flag. */
  public static ExpansionState all(boolean expanded) { return new ExpansionState(expanded, Collections.emptyMap()); }

  public boolean getDefault() { return defaultExpanded; }

  public boolean isExpanded(List<NodeIndex> thunk) { return overrides.getOrDefault(thunk, defaultExpanded); }

  /** The thunks whose flag differs from the default. */
  public Map<List<NodeIndex>, Boolean> getOverrides() { return overrides; }

  public ExpansionState set(List<NodeIndex> thunk, boolean expanded) {
    if (isExpanded(thunk) == expanded)
      return this;
    Map<List<NodeIndex>, Boolean> copy = new HashMap<>(overrides);
    if (expanded == defaultExpanded)
      copy.remove(thunk);
    else
      copy.put(List.copyOf(thunk), expanded);
    return new ExpansionState(defaultExpanded, Collections.unmodifiableMap(copy));
  }

  public ExpansionState toggle(List<NodeIndex> thunk) { return set(thunk, !isExpanded(thunk)); }

  /** Sets every thunk, known or not, to the given flag. */
  public ExpansionState setAll(boolean expanded) { return all(expanded); }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof ExpansionState))
      return false;
    ExpansionState other = (ExpansionState)obj;
    return defaultExpanded == other.defaultExpanded && overrides.equals(other.overrides);
  }
  @Override
  public int hashCode() {
    return Objects.hash(defaultExpanded, overrides);
  }
  @Override
  public String toString() {
    return String.format("ExpansionState { default: %b, overrides: %s }", defaultExpanded, overrides);
  }
}
