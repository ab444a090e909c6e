package sdcore.language;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import sdcore.hypergraph.HyperGraph;
import sdcore.hypergraph.HyperGraphException;
import sdcore.hypergraph.Node;
import sdcore.hypergraph.NodeIndex;
import sdcore.hypergraph.Port;
import sdcore.hypergraph.PortIndex;

/**
 * Lowers an {@link Expr} to a {@link HyperGraph}.
 * <p>
 * Each scope becomes one graph level with exactly one Input node and one Output node.
 * The top-level Input node has one port per free variable of the expression.
 * A thunk body's Input node has one port per captured variable, followed by one port per thunk parameter;
 *  the thunk node itself consumes the captured variables from the enclosing level.
 * Every operator application becomes an Operation node with one output port,
 *  its inputs being the argument values followed by the outputs of its thunks.
 * A thunk node has one output port per value its body returns.
 */
public class HyperGraphBuilder<O> {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final FreeVariables<O> freeVariables = new FreeVariables<>();

  /** Builds the hypergraph of an expression. */
  public static <O> HyperGraph<O> tryFrom(Expr<O> expr) throws ConstructionException {
    return new HyperGraphBuilder<O>().build(expr);
  }

  /** The variables that became the top-level graph inputs, in port order. */
  public List<Variable> inputsOf(Expr<O> expr) { return new ArrayList<>(freeVariables.of(expr)); }

  public HyperGraph<O> build(Expr<O> expr) throws ConstructionException { return build(expr, inputsOf(expr)); }

  /**
   * Builds the hypergraph of an expression with explicitly declared graph inputs.
   * Declared inputs the expression does not use become unused ports.
   * @throws ConstructionException if the expression refers to a variable that is neither bound nor declared
   */
  public HyperGraph<O> build(Expr<O> expr, List<Variable> inputs) throws ConstructionException {
    if (inputs.stream().distinct().count() != inputs.size())
      throw new IllegalArgumentException("Declared inputs contain duplicates: " + inputs);
    HyperGraph<O> ret = new Scope(expr, inputs).lower();
    logger.debug("Built hypergraph with {} top-level nodes and {} inputs", ret.size(), inputs.size());
    return ret;
  }

  /** Lowering state of one graph level. */
  private class Scope {
    final Expr<O> expr;
    final List<Variable> inputVars;
    final HyperGraph<O> graph = HyperGraph.empty();
    final Map<Variable, Port> inputPorts = new HashMap<>();
    final Map<Variable, Bind<O>> binds = new LinkedHashMap<>();
    final Map<Variable, Port> resolved = new HashMap<>();
    final Set<Variable> resolving = new HashSet<>();

    Scope(Expr<O> expr, List<Variable> inputVars) {
      this.expr = expr;
      this.inputVars = inputVars;
    }

    HyperGraph<O> lower() throws ConstructionException {
      for (Bind<O> bind : expr.binds()) {
        if (binds.put(bind.var(), bind) != null)
          throw new ConstructionException("Variable " + bind.var() + " is bound twice in the same scope");
      }
      NodeIndex inputNode = add(Node.input(), List.of(), inputVars.size());
      for (int i = 0; i < inputVars.size(); ++i)
        inputPorts.put(inputVars.get(i), new Port(inputNode, new PortIndex(i)));
      // Unused bindings are still lowered, so they show up as operations without consumers.
      for (Variable var : binds.keySet())
        resolve(var);
      List<Port> outputs = new ArrayList<>();
      for (Value<O> value : expr.values())
        outputs.add(lowerValue(value));
      add(Node.output(), outputs, 0);
      return graph;
    }

    Port resolve(Variable var) throws ConstructionException {
      Port port = resolved.get(var);
      if (port != null)
        return port;
      Bind<O> bind = binds.get(var);
      if (bind != null) {
        if (!resolving.add(var))
          throw new ConstructionException("Cyclic binding of variable " + var);
        port = lowerValue(bind.value());
        resolving.remove(var);
        resolved.put(var, port);
        return port;
      }
      port = inputPorts.get(var);
      if (port == null)
        throw new ConstructionException("Unbound variable " + var);
      return port;
    }

    Port lowerValue(Value<O> value) throws ConstructionException {
      switch (value.kind()) {
      case Variable:
        return resolve(((Value.Var<O>)value).variable());
      case Op: {
        Value.Op<O> op = (Value.Op<O>)value;
        List<Port> inputs = new ArrayList<>();
        for (Value<O> arg : op.args())
          inputs.add(lowerValue(arg));
        for (Thunk<O> thunk : op.thunks())
          inputs.addAll(lowerThunk(thunk));
        return new Port(add(Node.weight(op.op()), inputs, 1), new PortIndex(0));
      }
      default:
        throw new IllegalStateException("Unhandled value kind " + value.kind());
      }
    }

    /** Adds a thunk node with one output port per value returned by its body. */
    List<Port> lowerThunk(Thunk<O> thunk) throws ConstructionException {
      List<Variable> captures = new ArrayList<>(freeVariables.of(thunk));
      List<Port> capturePorts = new ArrayList<>();
      for (Variable var : captures)
        capturePorts.add(resolve(var));
      List<Variable> bodyInputs = new ArrayList<>(captures);
      bodyInputs.addAll(thunk.args());
      HyperGraph<O> body = new Scope(thunk.body(), bodyInputs).lower();
      int outputs = thunk.body().values().size();
      NodeIndex node = add(Node.thunk(thunk.args().size(), body), capturePorts, outputs);
      List<Port> ret = new ArrayList<>(outputs);
      for (int i = 0; i < outputs; ++i)
        ret.add(new Port(node, new PortIndex(i)));
      return ret;
    }

    NodeIndex add(Node<O> data, List<Port> inputs, int outputPorts) throws ConstructionException {
      try {
        return graph.addNode(data, inputs, outputPorts);
      } catch (HyperGraphException e) {
        throw new ConstructionException("Failed to add node " + data, e);
      }
    }
  }
}
