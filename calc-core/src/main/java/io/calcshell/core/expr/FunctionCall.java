package io.calcshell.core.expr;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Call of a built-in function, or a reference to a constant when {@code args} is empty.
 *
 * <p>The name is stored lower-cased, matching the keys of {@link FunctionTable} and {@link
 * Constants}.
 */
public record FunctionCall(String name, List<ValueExpr> args) implements ValueExpr {

  public FunctionCall {
    Objects.requireNonNull(name, "name");
    name = name.toLowerCase(Locale.ROOT);
    args = List.copyOf(args);
  }

  /** Creates a reference to a named constant. */
  public static FunctionCall constant(String name) {
    return new FunctionCall(name, List.of());
  }

  public boolean isConstantRef() {
    return args.isEmpty() && Constants.isConstant(name);
  }

  @Override
  public String toString() {
    if (isConstantRef()) {
      return name;
    }
    return name + args.stream().map(String::valueOf).collect(Collectors.joining(", ", "(", ")"));
  }
}
