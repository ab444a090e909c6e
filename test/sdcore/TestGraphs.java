package sdcore;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import sdcore.hypergraph.HyperGraph;
import sdcore.hypergraph.HyperGraphException;
import sdcore.hypergraph.Node;
import sdcore.hypergraph.NodeIndex;
import sdcore.hypergraph.Port;
import sdcore.hypergraph.PortIndex;
import sdcore.language.Bind;
import sdcore.language.ConstructionException;
import sdcore.language.Expr;
import sdcore.language.HyperGraphBuilder;
import sdcore.language.Thunk;
import sdcore.language.Value;
import sdcore.language.Variable;

/** Small expressions shared by the tests, with the node layout the builder gives them. */
public class TestGraphs {

  public static Value<String> v(String name) { return new Value.Var<>(new Variable(name)); }

  @SafeVarargs
  public static Value<String> op(String name, Value<String>... args) {
    return new Value.Op<>(name, Arrays.asList(args), List.of());
  }

  public static Value<String> op(String name, List<Value<String>> args, Thunk<String> thunk) {
    return new Value.Op<>(name, args, List.of(thunk));
  }

  public static Thunk<String> thunk(String arg, Value<String> body) { return Thunk.of(List.of(arg), expr(body)); }

  public static Expr<String> expr(Value<String> value) { return new Expr<>(List.of(), List.of(value)); }

  public static Bind<String> bind(String var, Value<String> value) { return Bind.of(var, value); }

  public static List<NodeIndex> path(int... indices) { return Arrays.stream(indices).mapToObj(NodeIndex::new).toList(); }

  public static HyperGraph<String> build(Expr<String> expr) throws ConstructionException { return HyperGraphBuilder.tryFrom(expr); }

  /**
   * {@code x |- h(g(f(x)))}.
   * Nodes: 0 Input, 1 f, 2 g, 3 h, 4 Output.
   */
  public static Expr<String> chain() { return expr(op("h", op("g", op("f", v("x"))))); }

  /**
   * {@code x |- let a = f(x); b = g(a); c = h(a); d = k(b, c) in d}.
   * Nodes: 0 Input, 1 f, 2 g, 3 h, 4 k, 5 Output.
   */
  public static Expr<String> diamond() {
    return new Expr<>(List.of(bind("a", op("f", v("x"))), bind("b", op("g", v("a"))), bind("c", op("h", v("a"))),
                              bind("d", op("k", v("b"), v("c")))),
                      List.of(v("d")));
  }

  /**
   * {@code y |- let z = neg(y) in map(\x. add(x, z))}.
   * Nodes: 0 Input, 1 neg, 2 thunk, 3 map, 4 Output. Thunk body: 0 Input [z, x], 1 add, 2 Output.
   */
  public static Expr<String> capture() {
    return Expr.of(List.of(bind("z", op("neg", v("y")))), op("map", List.of(), thunk("x", op("add", v("x"), v("z")))));
  }

  /**
   * {@code y |- let t = neg(y) in apply(t, \x. add(x, y))}.
   * Nodes: 0 Input, 1 neg, 2 thunk, 3 apply, 4 Output. Thunk body: 0 Input [y, x], 1 add, 2 Output.
   */
  public static Expr<String> apply() {
    return Expr.of(List.of(bind("t", op("neg", v("y")))), op("apply", List.of(v("t")), thunk("x", op("add", v("x"), v("y")))));
  }

  /**
   * {@code y |- map(\x. map(\w. add(w, y)))}.
   * Nodes: 0 Input, 1 outer thunk, 2 map, 3 Output.
   * Outer body: 0 Input [y, x], 1 inner thunk, 2 map, 3 Output. Inner body: 0 Input [y, w], 1 add, 2 Output.
   */
  public static Expr<String> nested() {
    return expr(op("map", List.of(), thunk("x", op("map", List.of(), thunk("w", op("add", v("w"), v("y")))))));
  }

  /**
   * A random flat DAG: one Input node with 1 to 3 ports, {@code operations} operations with 1 or 2 outputs each,
   *  and one Output node consuming 1 to 3 random ports.
   */
  public static HyperGraph<String> randomGraph(Random rand, int operations) throws HyperGraphException {
    HyperGraph<String> ret = HyperGraph.empty();
    List<Port> available = new ArrayList<>();
    int inputs = 1 + rand.nextInt(3);
    NodeIndex input = ret.addNode(Node.input(), List.of(), inputs);
    for (int i = 0; i < inputs; ++i)
      available.add(new Port(input, new PortIndex(i)));
    for (int n = 0; n < operations; ++n) {
      List<Port> args = new ArrayList<>();
      int numArgs = rand.nextInt(4);
      for (int i = 0; i < numArgs; ++i)
        args.add(available.get(rand.nextInt(available.size())));
      int outputs = 1 + rand.nextInt(2);
      NodeIndex node = ret.addNode(Node.weight("op" + n), args, outputs);
      for (int i = 0; i < outputs; ++i)
        available.add(new Port(node, new PortIndex(i)));
    }
    List<Port> results = new ArrayList<>();
    int numResults = 1 + rand.nextInt(3);
    for (int i = 0; i < numResults; ++i)
      results.add(available.get(rand.nextInt(available.size())));
    ret.addNode(Node.output(), results, 0);
    return ret;
  }
}
