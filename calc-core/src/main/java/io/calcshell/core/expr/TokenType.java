package io.calcshell.core.expr;

/** Lexical categories recognized by {@link ExpressionLexer}. */
public enum TokenType {
  NUMBER,
  IDENTIFIER,
  PLUS,
  MINUS,
  STAR,
  SLASH,
  CARET,
  LPAREN,
  RPAREN,
  COMMA,
  EOF
}
