package sdcore.monoidal;

import java.util.ArrayList;
import java.util.List;

/**
 * Places each producer by the mean position of the wires it feeds, which keeps fan-outs short and crossings low.
 * Ties keep node order.
 */
public class BarycenterOrdering implements WireOrdering {
  public static final String NAME = "barycenter";

  @Override
  public List<Demand> order(List<Demand> demands) {
    List<Demand> ret = new ArrayList<>(demands);
    // compares positionSum/count without division
    ret.sort((a, b) -> Long.compare(a.positionSum() * b.count(), b.positionSum() * a.count()));
    return ret;
  }

  @Override
  public String toString() {
    return NAME;
  }
}
