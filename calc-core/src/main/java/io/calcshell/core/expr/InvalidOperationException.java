package io.calcshell.core.expr;

/** An operation has no real-valued result for its operands. */
public final class InvalidOperationException extends EvalException {

  public static final String COMPLEX_RESULT = "complex result";
  public static final String NEGATIVE_SQRT = "negative sqrt";
  public static final String NON_POSITIVE_LOG = "non-positive log";

  private final String operation;
  private final String reason;

  public InvalidOperationException(String operation, String reason) {
    super("Invalid operation in " + operation + ": " + reason);
    this.operation = operation;
    this.reason = reason;
  }

  /** Operator symbol or function name that failed. */
  public String operation() {
    return operation;
  }

  public String reason() {
    return reason;
  }
}
