package sdcore.monoidal;

import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import sdcore.TestExprBuilder;
import sdcore.TestGraphs;
import sdcore.hypergraph.HyperGraph;
import sdcore.hypergraph.Port;
import sdcore.language.Expr;

class MonoidalGraphTest {

  private static SliceOp<String> op(String name, int inputs, int... path) {
    return new SliceOp<>(MonoidalOp.operation(inputs, 1, name), TestGraphs.path(path));
  }
  private static SliceOp<String> id(int... path) { return new SliceOp<String>(MonoidalOp.id(), TestGraphs.path(path)); }
  private static SliceOp<String> copy(int copies) { return SliceOp.wiring(MonoidalOp.copy(copies)); }

  @SafeVarargs
  private static Slice<String> slice(SliceOp<String>... ops) {
    return new Slice<>(List.of(ops));
  }

  private static MonoidalGraph<String> synthesize(Expr<String> expr) throws Exception {
    MonoidalGraph<String> ret = MonoidalGraph.fromHyperGraph(TestGraphs.build(expr));
    ret.checkArity();
    return ret;
  }

  @Test
  void testSingleOperation() throws Exception {
    var graph = synthesize(TestGraphs.expr(TestGraphs.op("f", TestGraphs.v("x"), TestGraphs.v("y"))));
    Assertions.assertEquals(new MonoidalGraph<>(2, List.of(slice(op("f", 2, 1)))), graph);
    Assertions.assertEquals(1, graph.numberOfOutputs());
  }

  @Test
  void testInputsAreSwappedIntoPlace() throws Exception {
    // x, y |- let a = g(x) in f(y, a)
    var expr = Expr.of(List.of(TestGraphs.bind("a", TestGraphs.op("g", TestGraphs.v("x")))),
                       TestGraphs.op("f", TestGraphs.v("y"), TestGraphs.v("a")));
    var graph = synthesize(expr);
    Assertions.assertEquals(List.of(slice(SliceOp.swap()), slice(SliceOp.id(), op("g", 1, 1)), slice(op("f", 2, 2))), graph.slices());
    Assertions.assertEquals(2, graph.inputs());
  }

  @Test
  void testSharedInputIsCopied() throws Exception {
    var graph = synthesize(TestGraphs.expr(TestGraphs.op("f", TestGraphs.v("x"), TestGraphs.v("x"))));
    Assertions.assertEquals(List.of(slice(copy(2)), slice(op("f", 2, 1))), graph.slices());
  }

  @Test
  void testUnusedResultIsDeleted() throws Exception {
    // x |- let u = g(x) in f(x)
    var expr = Expr.of(List.of(TestGraphs.bind("u", TestGraphs.op("g", TestGraphs.v("x")))), TestGraphs.op("f", TestGraphs.v("x")));
    var graph = synthesize(expr);
    Assertions.assertEquals(List.of(slice(copy(2)), slice(op("f", 1, 2), op("g", 1, 1)), slice(SliceOp.id(), copy(0))), graph.slices());
    Assertions.assertEquals(1, graph.numberOfOutputs());
  }

  @Test
  void testEmptyGraph() throws Exception {
    HyperGraph<String> graph = TestGraphs.build(TestGraphs.expr(TestGraphs.v("x")));
    Assertions.assertThrows(EmptyGraphException.class, () -> MonoidalGraph.fromHyperGraph(graph));
  }

  @Test
  void testIdentityThunk() throws Exception {
    // map(\x. x): the body has no operations
    var graph = synthesize(TestGraphs.expr(TestGraphs.op("map", List.of(), TestGraphs.thunk("x", TestGraphs.v("x")))));
    var body = new MonoidalGraph<String>(1, List.of());
    var thunk = new SliceOp<>(MonoidalOp.thunk(1, 1, body), TestGraphs.path(1));
    Assertions.assertEquals(new MonoidalGraph<>(0, List.of(slice(thunk), slice(op("map", 1, 2)))), graph);
    Assertions.assertEquals(0, thunk.op().numberOfInputs());

    var unfolded = graph.unfold(TestGraphs.path(1));
    unfolded.checkArity();
    Assertions.assertEquals(List.of(slice(new SliceOp<String>(MonoidalOp.unit(), TestGraphs.path(1))), slice(op("map", 1, 2))),
                            unfolded.slices());
  }

  @Test
  void testThunkBodyOnlyForwardsCapture() throws Exception {
    // y |- map(\x. y): the parameter is deleted, the capture passes through
    var graph = synthesize(TestGraphs.expr(TestGraphs.op("map", List.of(), TestGraphs.thunk("x", TestGraphs.v("y")))));
    var thunk = (MonoidalOp.Thunk<String>)graph.slices().get(0).ops().get(0).op();
    Assertions.assertEquals(new MonoidalGraph<>(2, List.of(slice(SliceOp.id(), copy(0)))), thunk.getBody());
    Assertions.assertEquals(1, thunk.numberOfInputs());
    graph.unfold(TestGraphs.path(1)).checkArity();
  }

  @Test
  void testThunkAndUnfold() throws Exception {
    // y |- map(\x. add(x, y))
    var expr = TestGraphs.expr(TestGraphs.op("map", List.of(),
                                             TestGraphs.thunk("x", TestGraphs.op("add", TestGraphs.v("x"), TestGraphs.v("y")))));
    var graph = synthesize(expr);
    var body = new MonoidalGraph<>(2, List.of(slice(SliceOp.swap()), slice(op("add", 2, 1))));
    var thunk = new SliceOp<>(MonoidalOp.thunk(1, 1, body), TestGraphs.path(1));
    Assertions.assertEquals(new MonoidalGraph<>(1, List.of(slice(thunk), slice(op("map", 1, 2)))), graph);
    Assertions.assertEquals(1, thunk.op().numberOfInputs());

    var unfolded = graph.unfold(TestGraphs.path(1));
    var unit = new SliceOp<String>(MonoidalOp.unit(), TestGraphs.path(1));
    var swap = new SliceOp<String>(MonoidalOp.swap(), TestGraphs.path(1));
    Assertions.assertEquals(List.of(slice(id(1), unit), slice(swap), slice(op("add", 2, 1, 1)), slice(op("map", 1, 2))),
                            unfolded.slices());
    unfolded.checkArity();

    Assertions.assertEquals(graph, graph.unfold(TestGraphs.path(7)), "unknown paths leave the graph unchanged");
    Assertions.assertEquals(graph, graph.unfold(TestGraphs.path(2)), "only thunks are unfolded");
  }

  @Test
  void testUnfoldPadsNeighbours() throws Exception {
    var graph = synthesize(TestGraphs.apply());
    var unfolded = graph.unfold(TestGraphs.path(2));
    var neg = op("neg", 1, 1);
    Assertions.assertEquals(List.of(slice(copy(2)), slice(neg, id(2), new SliceOp<String>(MonoidalOp.unit(), TestGraphs.path(2))),
                                    slice(SliceOp.id(), new SliceOp<String>(MonoidalOp.swap(), TestGraphs.path(2))),
                                    slice(SliceOp.id(), op("add", 2, 2, 1)), slice(op("apply", 2, 3))),
                            unfolded.slices());
    unfolded.checkArity();
  }

  @Test
  void testNestedUnfold() throws Exception {
    var graph = synthesize(TestGraphs.nested());
    var unfolded = graph.unfold(TestGraphs.path(1)).unfold(TestGraphs.path(1, 1));
    unfolded.checkArity();
    Assertions.assertEquals(graph.inputs(), unfolded.inputs());
    Assertions.assertEquals(graph.numberOfOutputs(), unfolded.numberOfOutputs());
    boolean foundAdd = unfolded.slices().stream().flatMap(s -> s.ops().stream())
        .anyMatch(entry -> entry.path().equals(TestGraphs.path(1, 1, 1)) && entry.op().getKind() == MonoidalOp.Kind.Operation);
    Assertions.assertTrue(foundAdd);
    Assertions.assertTrue(unfolded.slices().stream().flatMap(s -> s.ops().stream()).noneMatch(entry -> entry.op().getKind() == MonoidalOp.Kind.Thunk));
  }

  @Test
  void testCheckArityDetectsMismatch() {
    var broken = new MonoidalGraph<>(1, List.of(slice(copy(2)), slice(op("f", 1, 1))));
    Assertions.assertThrows(IllegalStateException.class, broken::checkArity);
  }

  @Test
  void testWiredProvenance() throws Exception {
    var expr = Expr.of(List.of(TestGraphs.bind("a", TestGraphs.op("g", TestGraphs.v("x")))),
                       TestGraphs.op("f", TestGraphs.v("y"), TestGraphs.v("a")));
    var wired = WiredGraph.fromHyperGraph(TestGraphs.build(expr), WireOrdering.natural());
    Assertions.assertEquals(3, wired.layers().size());
    Assertions.assertEquals(List.of(Port.of(0, 1), Port.of(0, 0)), wired.layers().get(0).below());
    Assertions.assertEquals(List.of(Port.of(0, 1), Port.of(1, 0)), wired.layers().get(1).below());
    Assertions.assertEquals(List.of(Port.of(2, 0)), wired.outputWires().orElseThrow());
    for (int i = 0; i + 1 < wired.layers().size(); ++i)
      Assertions.assertEquals(wired.layers().get(i).below(), wired.layers().get(i + 1).above());
  }

  @Test
  void testOrderingMustBePermutation() throws Exception {
    WireOrdering broken = demands -> List.of();
    var graph = TestGraphs.build(TestGraphs.diamond());
    Assertions.assertThrows(IllegalStateException.class, () -> WiredGraph.fromHyperGraph(graph, broken));
    Assertions.assertTrue(WireOrdering.byName("natural").isPresent());
    Assertions.assertTrue(WireOrdering.byName("random").isEmpty());
  }

  @RepeatedTest(20)
  void testSynthesis_random() throws Exception {
    long seed = new Random().nextLong();
    try {
      testSynthesis(seed);
    } catch (Throwable t) {
      System.err.println("FAILED testSynthesis with seed " + seed);
      throw t;
    }
  }

  @ParameterizedTest
  @ValueSource(longs = {3L, 17L, 123456789L})
  void testSynthesis(long seed) throws Exception {
    var rand = new Random(seed);
    HyperGraph<String> graph = TestGraphs.build(new TestExprBuilder(rand).build(2));
    for (WireOrdering ordering : List.of(WireOrdering.barycenter(), WireOrdering.natural())) {
      var synthesized = MonoidalGraph.fromHyperGraph(graph, ordering);
      synthesized.checkArity();
      Assertions.assertEquals(graph.numberOfGraphInputs(), synthesized.inputs());
      Assertions.assertEquals(graph.numberOfGraphOutputs(), synthesized.numberOfOutputs());
    }
    HyperGraph<String> flat = TestGraphs.randomGraph(rand, 1 + rand.nextInt(10));
    var synthesized = MonoidalGraph.fromHyperGraph(flat);
    synthesized.checkArity();
    Assertions.assertEquals(flat.numberOfGraphOutputs(), synthesized.numberOfOutputs());
  }
}
