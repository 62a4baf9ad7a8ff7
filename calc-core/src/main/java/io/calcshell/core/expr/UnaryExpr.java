package io.calcshell.core.expr;

import java.util.Objects;

/** Unary arithmetic expression applied to a single operand. */
public record UnaryExpr(ValueExpr.UnaryOp op, ValueExpr operand) implements ValueExpr {

  public UnaryExpr {
    Objects.requireNonNull(op, "op");
    Objects.requireNonNull(operand, "operand");
  }

  @Override
  public String toString() {
    return "(" + op.symbol() + operand + ")";
  }
}
