package sdcore.language;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Free-variable analysis over the expression tree.
 * <p>
 * The variables of a scope are the variables referenced by its bindings and returned values,
 *  minus the variables the scope binds itself; a thunk additionally removes its own parameters.
 * Results are cached per scope instance, so one analysis object computes every nested scope at most once.
 * An instance belongs to a single analysis pass and must not be reused after the tree changes.
 * <p>
 * The returned sets iterate in first-reference order of a depth-first walk, which is deterministic for a given tree.
 */
public class FreeVariables<O> {
  private final IdentityHashMap<Expr<O>, Set<Variable>> exprCache = new IdentityHashMap<>();
  private final IdentityHashMap<Thunk<O>, Set<Variable>> thunkCache = new IdentityHashMap<>();

  public Set<Variable> of(Expr<O> expr) {
    Set<Variable> cached = exprCache.get(expr);
    if (cached != null)
      return cached;
    LinkedHashSet<Variable> ret = new LinkedHashSet<>();
    for (Bind<O> bind : expr.binds())
      collect(bind.value(), ret);
    for (Value<O> value : expr.values())
      collect(value, ret);
    for (Bind<O> bind : expr.binds())
      ret.remove(bind.var());
    Set<Variable> result = Collections.unmodifiableSet(ret);
    exprCache.put(expr, result);
    return result;
  }

  public Set<Variable> of(Thunk<O> thunk) {
    Set<Variable> cached = thunkCache.get(thunk);
    if (cached != null)
      return cached;
    LinkedHashSet<Variable> ret = new LinkedHashSet<>(of(thunk.body()));
    thunk.args().forEach(ret::remove);
    Set<Variable> result = Collections.unmodifiableSet(ret);
    thunkCache.put(thunk, result);
    return result;
  }

  /** Number of scopes analysed so far (expressions and thunks). */
  public int cachedScopes() { return exprCache.size() + thunkCache.size(); }

  private void collect(Value<O> value, Set<Variable> out) {
    switch (value.kind()) {
    case Variable:
      out.add(((Value.Var<O>)value).variable());
      break;
    case Op:
      Value.Op<O> op = (Value.Op<O>)value;
      for (Value<O> arg : op.args())
        collect(arg, out);
      for (Thunk<O> thunk : op.thunks())
        out.addAll(of(thunk));
      break;
    }
  }
}
