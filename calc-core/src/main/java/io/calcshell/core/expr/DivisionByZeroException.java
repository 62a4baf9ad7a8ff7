package io.calcshell.core.expr;

/** The right operand of {@code /} evaluated to zero. */
public final class DivisionByZeroException extends EvalException {

  public DivisionByZeroException() {
    super("Division by zero");
  }
}
