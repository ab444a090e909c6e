package sdcore.language;

/** A variable name of the expression language. */
public record Variable(String name) {
  public Variable {
    if (name == null || name.isEmpty())
      throw new IllegalArgumentException("variable name must not be empty");
  }

  @Override
  public String toString() {
    return name;
  }
}
