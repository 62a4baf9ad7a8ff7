package io.calcshell.core.expr;

/** Numeric literal value. */
public record NumberLiteral(double value) implements ValueExpr {

  @Override
  public String toString() {
    if (value == (long) value) {
      return String.valueOf((long) value);
    }
    return String.valueOf(value);
  }
}
