package io.calcshell.core.expr;

/** Input exceeds the length cap configured on {@link ExpressionEngine}. */
public final class ExpressionTooLongException extends ParseException {

  private final int length;
  private final int maxLength;

  public ExpressionTooLongException(int length, int maxLength) {
    super("Expression too long: " + length + " characters (limit " + maxLength + ")", maxLength);
    this.length = length;
    this.maxLength = maxLength;
  }

  public int length() {
    return length;
  }

  public int maxLength() {
    return maxLength;
  }
}
