package io.calcshell.core.expr;

/** Thrown when the input contains a character or literal the lexer cannot tokenize. */
public final class LexException extends ExpressionException {

  public enum Reason {
    UNEXPECTED_CHARACTER,
    MALFORMED_NUMBER
  }

  private final char character;
  private final Reason reason;

  public LexException(int offset, char character, Reason reason) {
    super(buildMessage(offset, character, reason), offset);
    this.character = character;
    this.reason = reason;
  }

  public char character() {
    return character;
  }

  public Reason reason() {
    return reason;
  }

  private static String buildMessage(int offset, char character, Reason reason) {
    return switch (reason) {
      case UNEXPECTED_CHARACTER ->
          "Unexpected character '" + character + "' at position " + offset;
      case MALFORMED_NUMBER -> "Malformed number at position " + offset + ": no digits";
    };
  }
}
