package io.calcshell.core.expr;

/** A token appeared where the grammar expected something else. */
public final class UnexpectedTokenException extends ParseException {

  private final Token token;
  private final String expected;

  public UnexpectedTokenException(Token token, String expected) {
    super(
        "Unexpected "
            + token.describe()
            + " at position "
            + token.offset()
            + ", expected "
            + expected,
        token.offset());
    this.token = token;
    this.expected = expected;
  }

  public Token token() {
    return token;
  }

  /** Description of what the parser was looking for. */
  public String expected() {
    return expected;
  }
}
