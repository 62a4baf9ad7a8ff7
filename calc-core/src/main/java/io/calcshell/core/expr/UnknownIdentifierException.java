package io.calcshell.core.expr;

/** An identifier is neither a built-in function nor a known constant. */
public final class UnknownIdentifierException extends ParseException {

  private final String name;

  public UnknownIdentifierException(String name, int offset) {
    super("Unknown identifier '" + name + "' at position " + offset, offset);
    this.name = name;
  }

  public String name() {
    return name;
  }
}
