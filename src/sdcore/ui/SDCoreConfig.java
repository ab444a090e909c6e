package sdcore.ui;

import java.io.InputStream;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import sdcore.monoidal.WireOrdering;

/**
 * Data-Class to hold session options.
 */
public class SDCoreConfig {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** Expansion flag of thunks not toggled yet. */
  public boolean default_expanded = false;
  /** Built-in wire ordering for diagram synthesis, "barycenter" or "natural". */
  public String wire_ordering = "barycenter";

  public boolean selection_extend_sources = true;
  public boolean selection_convex_closure = true;

  /** Number of expansion states kept for undo. */
  public int history_limit = 64;
  /** Depth of the dependency neighbourhood shown by highlighting. */
  public int highlight_depth = 1;

  /**
   * Reads options from a YAML mapping. Missing keys keep their defaults, unknown keys are ignored with a warning.
   * @throws IllegalArgumentException if a value has the wrong type or range
   */
  public static SDCoreConfig load(InputStream input) {
    Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
    Object data = yaml.load(input);
    SDCoreConfig ret = new SDCoreConfig();
    if (data == null)
      return ret;
    if (!(data instanceof Map))
      throw new IllegalArgumentException("Config root must be a mapping");
    for (Map.Entry<?, ?> entry : ((Map<?, ?>)data).entrySet()) {
      String key = String.valueOf(entry.getKey());
      Object value = entry.getValue();
      if (key.equals("default_expanded"))
        ret.default_expanded = asBoolean(key, value);
      else if (key.equals("wire_ordering"))
        ret.wire_ordering = String.valueOf(value);
      else if (key.equals("selection_extend_sources"))
        ret.selection_extend_sources = asBoolean(key, value);
      else if (key.equals("selection_convex_closure"))
        ret.selection_convex_closure = asBoolean(key, value);
      else if (key.equals("history_limit"))
        ret.history_limit = asNonNegative(key, value);
      else if (key.equals("highlight_depth"))
        ret.highlight_depth = asNonNegative(key, value);
      else
        logger.warn("Ignoring unknown config key {}", key);
    }
    return ret;
  }

  /** The wire ordering named by {@link #wire_ordering}, falling back to barycenter for unknown names. */
  public WireOrdering wireOrdering() {
    return WireOrdering.byName(wire_ordering).orElseGet(() -> {
      logger.warn("Unknown wire ordering {}, using barycenter", wire_ordering);
      return WireOrdering.barycenter();
    });
  }

  private static boolean asBoolean(String key, Object value) {
    if (!(value instanceof Boolean))
      throw new IllegalArgumentException(String.format("Config key %s expects a boolean, got %s", key, value));
    return (Boolean)value;
  }

  private static int asNonNegative(String key, Object value) {
    if (!(value instanceof Integer) || (Integer)value < 0)
      throw new IllegalArgumentException(String.format("Config key %s expects a non-negative integer, got %s", key, value));
    return (Integer)value;
  }
}
