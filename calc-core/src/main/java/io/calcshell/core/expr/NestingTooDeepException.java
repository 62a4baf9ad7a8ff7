package io.calcshell.core.expr;

/** Parentheses, unary minus, {@code ^} chains or calls are nested beyond the parser's limit. */
public final class NestingTooDeepException extends ParseException {

  private final int maxDepth;

  public NestingTooDeepException(int maxDepth, int offset) {
    super(
        "Expression nested too deeply at position " + offset + " (limit " + maxDepth + ")",
        offset);
    this.maxDepth = maxDepth;
  }

  public int maxDepth() {
    return maxDepth;
  }
}
