package sdcore.language;

import java.util.List;

/**
 * A value is either a variable reference or an operator applied to argument values and thunks.
 * @param <O> the operator type
 */
public interface Value<O> {
  enum Kind { Variable, Op }

  Kind kind();

  record Var<O>(Variable variable) implements Value<O> {
    @Override
    public Kind kind() {
      return Kind.Variable;
    }
  }

  record Op<O>(O op, List<Value<O>> args, List<Thunk<O>> thunks) implements Value<O> {
    public Op {
      args = List.copyOf(args);
      thunks = List.copyOf(thunks);
    }
    @Override
    public Kind kind() {
      return Kind.Op;
    }
  }

  static <O> Value<O> var(String name) { return new Var<>(new Variable(name)); }

  static <O> Value<O> op(O op, List<Value<O>> args) { return new Op<>(op, args, List.of()); }

  static <O> Value<O> op(O op, List<Value<O>> args, List<Thunk<O>> thunks) { return new Op<>(op, args, thunks); }
}
