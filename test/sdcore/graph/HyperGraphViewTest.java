package sdcore.graph;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import sdcore.TestGraphs;
import sdcore.hypergraph.NodeIndex;

class HyperGraphViewTest {

  @Test
  void testTopLevelNodes() throws Exception {
    var view = new HyperGraphView<>(TestGraphs.build(TestGraphs.capture()));
    List<NodeLike<String>> nodes = view.nodes();
    Assertions.assertEquals(3, nodes.size());
    Assertions.assertEquals(Optional.of("neg"), nodes.get(0).weight());
    Assertions.assertEquals(NodeLike.Kind.Thunk, nodes.get(1).kind());
    Assertions.assertEquals(Optional.of("map"), nodes.get(2).weight());
    Assertions.assertTrue(view.graphBacklink().isEmpty());
    Assertions.assertTrue(view.boundGraphInputs().isEmpty());
  }

  @Test
  void testCapturedEdgeTargetsDescendIntoThunk() throws Exception {
    var view = new HyperGraphView<>(TestGraphs.build(TestGraphs.capture()));
    NodeLike<String> neg = view.nodes().get(0);
    NodeLike<String> add = view.lookup(TestGraphs.path(2, 1)).orElseThrow();
    Assertions.assertEquals(Optional.of("add"), add.weight());
    Assertions.assertEquals(1, add.nestingDepth());

    EdgeLike<String> z = neg.outputs().get(0);
    Assertions.assertEquals(List.of(Optional.of(add)), z.targets());
    Assertions.assertEquals(Optional.of(neg), z.source());
    // inside the body, the capture resolves to the same edge
    Assertions.assertEquals(z, add.inputs().get(1));
  }

  @Test
  void testThunkAsGraph() throws Exception {
    var view = new HyperGraphView<>(TestGraphs.build(TestGraphs.capture()));
    ThunkLike<String> thunk = view.nodes().get(1).asThunk().orElseThrow();
    Assertions.assertEquals(1, thunk.args());
    Assertions.assertEquals(thunk.inputs(), thunk.freeGraphInputs());
    Assertions.assertEquals(1, thunk.boundGraphInputs().size());
    Assertions.assertEquals(Optional.of(thunk), thunk.graphBacklink());

    NodeLike<String> add = thunk.nodes().get(0);
    Assertions.assertEquals(Optional.of(thunk), add.backlink());
    EdgeLike<String> x = thunk.boundGraphInputs().get(0);
    Assertions.assertTrue(x.source().isEmpty());
    Assertions.assertEquals(x, add.inputs().get(0));
    Assertions.assertEquals(add.outputs(), thunk.graphOutputs());
  }

  @Test
  void testOutputTargetsAreAbsent() throws Exception {
    var view = new HyperGraphView<>(TestGraphs.build(TestGraphs.chain()));
    NodeLike<String> h = view.nodes().get(2);
    Assertions.assertEquals(List.of(Optional.empty()), h.outputs().get(0).targets());
    Assertions.assertEquals(h.outputs(), view.graphOutputs());
    EdgeLike<String> x = view.freeGraphInputs().get(0);
    Assertions.assertTrue(x.source().isEmpty());
    Assertions.assertEquals(List.of(Optional.of(view.nodes().get(0))), x.targets());
  }

  @Test
  void testCaptureThroughIntermediateThunk() throws Exception {
    var view = new HyperGraphView<>(TestGraphs.build(TestGraphs.nested()));
    // y is captured by the outer thunk only to be passed on to the inner thunk, where add uses it
    EdgeLike<String> y = view.freeGraphInputs().get(0);
    NodeLike<String> add = view.lookup(TestGraphs.path(1, 1, 1)).orElseThrow();
    Assertions.assertEquals(List.of(Optional.of(add)), y.targets());
    Assertions.assertEquals(2, add.nestingDepth());
  }

  @Test
  void testPathsAndLookup() throws Exception {
    var view = new HyperGraphView<>(TestGraphs.build(TestGraphs.nested()));
    for (List<NodeIndex> path : List.of(TestGraphs.path(1), TestGraphs.path(2), TestGraphs.path(1, 1), TestGraphs.path(1, 2),
                                        TestGraphs.path(1, 1, 1))) {
      var node = view.lookup(path).orElseThrow();
      Assertions.assertEquals(path, ((HyperGraphView.ViewNode<String>)node).path());
    }
    Assertions.assertTrue(view.lookup(TestGraphs.path(0)).isEmpty(), "boundary nodes are not part of the view");
    Assertions.assertTrue(view.lookup(TestGraphs.path(2, 1)).isEmpty());
    Assertions.assertTrue(view.lookup(List.of()).isEmpty());
  }
}
