package sdcore.language;

import java.util.List;

/** A closure: a body expression with its own parameter variables. */
public record Thunk<O>(List<Variable> args, Expr<O> body) {
  public Thunk {
    args = List.copyOf(args);
  }

  public static <O> Thunk<O> of(List<String> args, Expr<O> body) {
    return new Thunk<>(args.stream().map(Variable::new).toList(), body);
  }
}
