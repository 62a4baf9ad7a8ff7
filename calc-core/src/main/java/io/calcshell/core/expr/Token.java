package io.calcshell.core.expr;

import java.util.Objects;

/**
 * A single lexical unit of an expression.
 *
 * @param type token category
 * @param text source text of the token (empty for {@link TokenType#EOF})
 * @param value numeric value, meaningful only for {@link TokenType#NUMBER}
 * @param offset zero-based position of the first character in the input
 */
public record Token(TokenType type, String text, double value, int offset) {

  public Token {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(text, "text");
  }

  static Token of(TokenType type, String text, int offset) {
    return new Token(type, text, 0, offset);
  }

  static Token number(String text, double value, int offset) {
    return new Token(TokenType.NUMBER, text, value, offset);
  }

  static Token eof(int offset) {
    return new Token(TokenType.EOF, "", 0, offset);
  }

  public boolean is(TokenType t) {
    return type == t;
  }

  /** Human-readable form used in diagnostics. */
  public String describe() {
    return type == TokenType.EOF ? "end of input" : "'" + text + "'";
  }

  @Override
  public String toString() {
    return type == TokenType.NUMBER || type == TokenType.IDENTIFIER
        ? type + "(" + text + ")@" + offset
        : type + "@" + offset;
  }
}
