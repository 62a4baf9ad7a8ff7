package io.calcshell.core.expr;

/** A function was called with the wrong number of arguments. */
public final class ArityMismatchException extends ParseException {

  private final String name;
  private final int expected;
  private final int got;
  private final boolean variadic;

  /**
   * @param name function name
   * @param expected required argument count, or the minimum when {@code variadic}
   * @param got supplied argument count
   * @param variadic whether {@code expected} is a lower bound
   * @param offset position of the function name
   */
  public ArityMismatchException(String name, int expected, int got, boolean variadic, int offset) {
    super(
        "Function '"
            + name
            + "' expects "
            + (variadic ? "at least " : "")
            + expected
            + " argument"
            + (expected == 1 ? "" : "s")
            + ", got "
            + got,
        offset);
    this.name = name;
    this.expected = expected;
    this.got = got;
    this.variadic = variadic;
  }

  public String name() {
    return name;
  }

  public int expected() {
    return expected;
  }

  public int got() {
    return got;
  }

  public boolean isVariadic() {
    return variadic;
  }
}
