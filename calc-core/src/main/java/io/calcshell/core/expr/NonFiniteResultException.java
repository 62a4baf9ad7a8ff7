package io.calcshell.core.expr;

/** A step produced an infinite or NaN value. */
public final class NonFiniteResultException extends EvalException {

  private final String operation;

  public NonFiniteResultException(String operation) {
    super("Result of " + operation + " is not a finite number");
    this.operation = operation;
  }

  public String operation() {
    return operation;
  }
}
