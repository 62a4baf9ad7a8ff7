package io.calcshell.core.expr;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Built-in functions callable from expressions.
 *
 * <p>The table is fixed at class initialization and never mutated. Trigonometric functions take
 * their argument in degrees; {@code log} is base 10 and {@code ln} is the natural logarithm.
 */
public final class FunctionTable {

  /** Marker for functions accepting any number of arguments above the minimum. */
  public static final int UNBOUNDED = Integer.MAX_VALUE;

  /** Numeric implementation of a built-in. May throw {@link EvalException}. */
  @FunctionalInterface
  public interface NumericFunction {
    double apply(double[] args);
  }

  /**
   * A function entry.
   *
   * @param name lower-case name
   * @param minArity minimum argument count
   * @param maxArity maximum argument count, or {@link #UNBOUNDED}
   * @param description short help text
   * @param impl implementation
   */
  public record FunctionDef(
      String name, int minArity, int maxArity, String description, NumericFunction impl) {

    public boolean isVariadic() {
      return maxArity == UNBOUNDED;
    }

    public boolean accepts(int argCount) {
      return argCount >= minArity && argCount <= maxArity;
    }

    /** Signature such as {@code pow(x, y)} or {@code min(a, b, ...)}. */
    public String signature() {
      StringBuilder sb = new StringBuilder(name).append('(');
      for (int i = 0; i < minArity; i++) {
        if (i > 0) sb.append(", ");
        sb.append(minArity == 1 ? "x" : String.valueOf((char) ('a' + i)));
      }
      if (isVariadic()) sb.append(", ...");
      return sb.append(')').toString();
    }
  }

  private static final Map<String, FunctionDef> FUNCTIONS;

  static {
    Map<String, FunctionDef> m = new LinkedHashMap<>();
    register(m, "sqrt", 1, 1, "square root", args -> sqrt(args[0]));
    register(m, "sin", 1, 1, "sine, degrees", args -> Math.sin(Math.toRadians(args[0])));
    register(m, "cos", 1, 1, "cosine, degrees", args -> Math.cos(Math.toRadians(args[0])));
    register(m, "tan", 1, 1, "tangent, degrees", args -> Math.tan(Math.toRadians(args[0])));
    register(m, "log", 1, 1, "base-10 logarithm", args -> Math.log10(positive("log", args[0])));
    register(m, "ln", 1, 1, "natural logarithm", args -> Math.log(positive("ln", args[0])));
    register(m, "abs", 1, 1, "absolute value", args -> Math.abs(args[0]));
    register(m, "pow", 2, 2, "a raised to the power b", args -> power("pow", args[0], args[1]));
    register(m, "min", 2, UNBOUNDED, "smallest argument", FunctionTable::min);
    register(m, "max", 2, UNBOUNDED, "largest argument", FunctionTable::max);
    FUNCTIONS = Collections.unmodifiableMap(m);
  }

  private FunctionTable() {}

  private static void register(
      Map<String, FunctionDef> m,
      String name,
      int minArity,
      int maxArity,
      String description,
      NumericFunction impl) {
    m.put(name, new FunctionDef(name, minArity, maxArity, description, impl));
  }

  /**
   * Looks up a function by name, ignoring case.
   *
   * @param name function name
   * @return the entry, or empty if no such function exists
   */
  public static Optional<FunctionDef> lookup(String name) {
    return Optional.ofNullable(FUNCTIONS.get(name.toLowerCase(Locale.ROOT)));
  }

  public static boolean isFunction(String name) {
    return FUNCTIONS.containsKey(name.toLowerCase(Locale.ROOT));
  }

  /** All entries in registration order. */
  public static Map<String, FunctionDef> all() {
    return FUNCTIONS;
  }

  /**
   * Real exponentiation shared by {@code ^} and {@code pow}.
   *
   * @param operation operator or function name reported on failure
   * @throws InvalidOperationException for a negative base with a non-integer exponent
   */
  static double power(String operation, double base, double exponent) {
    if (base < 0 && exponent != Math.rint(exponent)) {
      throw new InvalidOperationException(operation, InvalidOperationException.COMPLEX_RESULT);
    }
    return Math.pow(base, exponent);
  }

  private static double sqrt(double x) {
    if (x < 0) {
      throw new InvalidOperationException("sqrt", InvalidOperationException.NEGATIVE_SQRT);
    }
    return Math.sqrt(x);
  }

  private static double positive(String fn, double x) {
    if (x <= 0) {
      throw new InvalidOperationException(fn, InvalidOperationException.NON_POSITIVE_LOG);
    }
    return x;
  }

  private static double min(double[] args) {
    double r = args[0];
    for (int i = 1; i < args.length; i++) {
      r = Math.min(r, args[i]);
    }
    return r;
  }

  private static double max(double[] args) {
    double r = args[0];
    for (int i = 1; i < args.length; i++) {
      r = Math.max(r, args[i]);
    }
    return r;
  }
}
