package io.calcshell.core.expr;

/** Thrown when a token sequence does not form a valid expression. */
public abstract sealed class ParseException extends ExpressionException
    permits UnexpectedTokenException,
        UnexpectedEndException,
        ArityMismatchException,
        UnknownIdentifierException,
        ExpressionTooLongException,
        NestingTooDeepException {

  protected ParseException(String message, int offset) {
    super(message, offset);
  }
}
