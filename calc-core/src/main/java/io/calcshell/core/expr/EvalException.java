package io.calcshell.core.expr;

/** Thrown when a well-formed expression cannot be evaluated to a finite number. */
public abstract sealed class EvalException extends ExpressionException
    permits DivisionByZeroException, InvalidOperationException, NonFiniteResultException {

  protected EvalException(String message) {
    super(message, -1);
  }
}
