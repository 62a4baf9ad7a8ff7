package io.calcshell.core.expr;

/**
 * Base of all failures raised while turning expression text into a number.
 *
 * <p>The hierarchy mirrors the pipeline stages: {@link LexException}, {@link ParseException} and
 * {@link EvalException}. Every subtype carries the structured data needed to render a one-line
 * diagnostic; {@link #getMessage()} is that diagnostic.
 */
public abstract sealed class ExpressionException extends RuntimeException
    permits LexException, ParseException, EvalException {

  private final int offset;

  protected ExpressionException(String message, int offset) {
    super(message);
    this.offset = offset;
  }

  /** Zero-based input offset the failure refers to, or {@code -1} if not positional. */
  public int offset() {
    return offset;
  }
}
