package sdcore.language;

/** Binds the result of a value to a variable within an {@link Expr}. */
public record Bind<O>(Variable var, Value<O> value) {
  public static <O> Bind<O> of(String var, Value<O> value) { return new Bind<>(new Variable(var), value); }
}
