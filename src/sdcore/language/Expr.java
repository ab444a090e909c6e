package sdcore.language;

import java.util.List;

/**
 * A scope: a list of bindings followed by the values the scope returns.
 * Bindings may refer to each other in any order, as long as there is no cycle.
 */
public record Expr<O>(List<Bind<O>> binds, List<Value<O>> values) {
  public Expr {
    binds = List.copyOf(binds);
    values = List.copyOf(values);
  }

  public static <O> Expr<O> of(List<Bind<O>> binds, Value<O> value) { return new Expr<>(binds, List.of(value)); }
}
