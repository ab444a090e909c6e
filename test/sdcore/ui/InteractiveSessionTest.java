package sdcore.ui;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import sdcore.TestGraphs;
import sdcore.hypergraph.NodeIndex;
import sdcore.monoidal.MonoidalOp;

class InteractiveSessionTest {

  private static SDCoreConfig config(int historyLimit) {
    var config = new SDCoreConfig();
    config.history_limit = historyLimit;
    return config;
  }

  @Test
  void testToggleUndoRedo() throws Exception {
    var session = InteractiveSession.fromExpr(TestGraphs.capture(), new SDCoreConfig());
    List<NodeIndex> thunk = TestGraphs.path(2);
    Assertions.assertFalse(session.isExpanded(thunk));
    Assertions.assertFalse(session.undo());

    session.toggle(thunk);
    Assertions.assertTrue(session.isExpanded(thunk));
    Assertions.assertTrue(session.getView().nodes().get(1).asThunk().isPresent());
    Assertions.assertTrue(session.undo());
    Assertions.assertFalse(session.isExpanded(thunk));
    Assertions.assertTrue(session.getView().nodes().get(1).asThunk().isEmpty());
    Assertions.assertTrue(session.redo());
    Assertions.assertTrue(session.isExpanded(thunk));
    Assertions.assertFalse(session.redo());

    session.undo();
    session.setAll(false);
    Assertions.assertFalse(session.redo(), "a new change discards the redo history");
  }

  @Test
  void testToggleRejectsNonThunks() throws Exception {
    var session = InteractiveSession.fromExpr(TestGraphs.capture(), new SDCoreConfig());
    Assertions.assertThrows(IllegalArgumentException.class, () -> session.toggle(TestGraphs.path(1)));
    Assertions.assertThrows(IllegalArgumentException.class, () -> session.toggle(TestGraphs.path(9)));
    Assertions.assertThrows(IllegalArgumentException.class, () -> session.select(TestGraphs.path(0)));
    Assertions.assertFalse(session.undo(), "rejected toggles are not recorded");
  }

  @Test
  void testHistoryLimit() throws Exception {
    var session = InteractiveSession.fromExpr(TestGraphs.nested(), config(2));
    session.toggle(TestGraphs.path(1));
    session.toggle(TestGraphs.path(1, 1));
    session.setAll(false);
    Assertions.assertTrue(session.undo());
    Assertions.assertTrue(session.undo());
    Assertions.assertFalse(session.undo());
    // the oldest state was dropped
    Assertions.assertTrue(session.isExpanded(TestGraphs.path(1)));

    var noHistory = InteractiveSession.fromExpr(TestGraphs.nested(), config(0));
    noHistory.toggle(TestGraphs.path(1));
    Assertions.assertFalse(noHistory.undo());
    Assertions.assertTrue(noHistory.isExpanded(TestGraphs.path(1)));
  }

  @Test
  void testHighlight() throws Exception {
    var session = InteractiveSession.fromExpr(TestGraphs.diamond(), new SDCoreConfig());
    Assertions.assertEquals(Set.of(TestGraphs.path(2)), session.highlight(TestGraphs.path(2)));

    session.select(TestGraphs.path(1));
    Assertions.assertEquals(Set.of(TestGraphs.path(1), TestGraphs.path(2), TestGraphs.path(3), TestGraphs.path(4)),
                            session.highlight(TestGraphs.path(4)));
    session.clearSelection();
    session.select(TestGraphs.path(4));
    Assertions.assertEquals(Set.of(TestGraphs.path(2), TestGraphs.path(4)), session.highlight(TestGraphs.path(2)));
  }

  @Test
  void testExtractSelection() throws Exception {
    var session = InteractiveSession.fromExpr(TestGraphs.capture(), new SDCoreConfig());
    Assertions.assertThrows(IllegalStateException.class, session::extractSelection);

    session.select(TestGraphs.path(1));
    var neg = session.extractSelection();
    Assertions.assertEquals(3, neg.graph().size());
    Assertions.assertEquals(1, neg.inputs().size());
    Assertions.assertEquals(1, neg.outputs().size());

    // add is hidden in the collapsed thunk, so the thunk is extracted, together with neg which only feeds it
    session.deselect(TestGraphs.path(1));
    session.select(TestGraphs.path(2, 1));
    Assertions.assertEquals(Set.of(TestGraphs.path(2, 1)), session.getSelection());
    var folded = session.extractSelection();
    Assertions.assertEquals(4, folded.graph().size());
    Assertions.assertTrue(folded.graph().get(new NodeIndex(2)).asThunk().isPresent());
  }

  @Test
  void testDiagram() throws Exception {
    var session = InteractiveSession.fromExpr(TestGraphs.nested(), new SDCoreConfig());
    var collapsed = session.diagram();
    collapsed.checkArity();
    Assertions.assertTrue(collapsed.slices().stream().flatMap(s -> s.ops().stream()).anyMatch(op -> op.op().getKind() == MonoidalOp.Kind.Thunk));

    session.setAll(true);
    var expanded = session.diagram();
    expanded.checkArity();
    Assertions.assertTrue(expanded.slices().stream().flatMap(s -> s.ops().stream()).noneMatch(op -> op.op().getKind() == MonoidalOp.Kind.Thunk));
    Assertions.assertEquals(collapsed.inputs(), expanded.inputs());
    Assertions.assertEquals(collapsed.numberOfOutputs(), expanded.numberOfOutputs());

    // only the outer thunk
    session.setAll(false);
    session.toggle(TestGraphs.path(1));
    var outer = session.diagram();
    outer.checkArity();
    Assertions.assertTrue(outer.slices().stream().flatMap(s -> s.ops().stream())
                              .anyMatch(op -> op.op().getKind() == MonoidalOp.Kind.Thunk && op.path().equals(TestGraphs.path(1, 1))));
  }

  @Test
  void testDiagramWithIdentityThunk() throws Exception {
    // y |- map(y, \x. x)
    var expr = TestGraphs.expr(TestGraphs.op("map", List.of(TestGraphs.v("y")), TestGraphs.thunk("x", TestGraphs.v("x"))));
    var session = InteractiveSession.fromExpr(expr, new SDCoreConfig());
    var collapsed = session.diagram();
    collapsed.checkArity();
    Assertions.assertEquals(1, collapsed.inputs());
    Assertions.assertEquals(1, collapsed.numberOfOutputs());
    Assertions.assertTrue(collapsed.slices().stream().flatMap(s -> s.ops().stream())
                              .anyMatch(op -> op.op().getKind() == MonoidalOp.Kind.Thunk && op.path().equals(TestGraphs.path(1))));

    session.toggle(TestGraphs.path(1));
    var expanded = session.diagram();
    expanded.checkArity();
    Assertions.assertEquals(1, expanded.numberOfOutputs());
    Assertions.assertTrue(expanded.slices().stream().flatMap(s -> s.ops().stream()).noneMatch(op -> op.op().getKind() == MonoidalOp.Kind.Thunk));
    Assertions.assertTrue(expanded.slices().stream().flatMap(s -> s.ops().stream()).anyMatch(op -> op.op().getKind() == MonoidalOp.Kind.Unit));
  }
}
