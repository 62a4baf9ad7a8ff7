package io.calcshell.core.expr;

/** Input ended while the parser still needed more tokens. */
public final class UnexpectedEndException extends ParseException {

  private final String expected;

  public UnexpectedEndException(int offset, String expected) {
    super("Unexpected end of input, expected " + expected, offset);
    this.expected = expected;
  }

  public String expected() {
    return expected;
  }
}
