package sdcore.monoidal;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/** Places producers by node index. */
public class NaturalOrdering implements WireOrdering {
  public static final String NAME = "natural";

  @Override
  public List<Demand> order(List<Demand> demands) {
    List<Demand> ret = new ArrayList<>(demands);
    ret.sort(Comparator.comparing(Demand::node));
    return ret;
  }

  @Override
  public String toString() {
    return NAME;
  }
}
