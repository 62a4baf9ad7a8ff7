package io.calcshell.core.expr;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits expression text into tokens.
 *
 * <p>Recognizes decimal literals without exponent ({@code 12}, {@code 3.5}, {@code .5}, {@code
 * 5.}), ASCII identifiers, the operators {@code + - * / ^} and the punctuation {@code ( ) ,}. The
 * returned list always ends with an {@link TokenType#EOF} token.
 */
public final class ExpressionLexer {

  private static final Logger LOG = LoggerFactory.getLogger(ExpressionLexer.class);

  private final String input;
  private int pos;

  private ExpressionLexer(String input) {
    this.input = input;
    this.pos = 0;
  }

  /**
   * Tokenizes an expression.
   *
   * @param input the expression text
   * @return immutable token list terminated by EOF
   * @throws LexException on an unrecognized character or a literal without digits
   */
  public static List<Token> tokenize(String input) {
    Objects.requireNonNull(input, "input");
    List<Token> tokens = new ExpressionLexer(input).readAll();
    LOG.debug("Tokenized {} chars into {} tokens", input.length(), tokens.size());
    return tokens;
  }

  private List<Token> readAll() {
    List<Token> tokens = new ArrayList<>();
    while (true) {
      skipWs();
      if (isAtEnd()) {
        break;
      }
      char c = peek();
      if (isDigit(c) || c == '.') {
        tokens.add(readNumber());
      } else if (isLetter(c)) {
        tokens.add(readIdentifier());
      } else {
        tokens.add(readSymbol(c));
      }
    }
    tokens.add(Token.eof(input.length()));
    return List.copyOf(tokens);
  }

  private Token readNumber() {
    int start = pos;
    int digits = skipDigits();
    if (!isAtEnd() && peek() == '.') {
      pos++;
      digits += skipDigits();
    }
    if (digits == 0) {
      throw new LexException(start, input.charAt(start), LexException.Reason.MALFORMED_NUMBER);
    }
    String text = input.substring(start, pos);
    return Token.number(text, Double.parseDouble(text), start);
  }

  private Token readIdentifier() {
    int start = pos;
    while (!isAtEnd() && isLetter(peek())) {
      pos++;
    }
    return Token.of(TokenType.IDENTIFIER, input.substring(start, pos), start);
  }

  private Token readSymbol(char c) {
    TokenType type =
        switch (c) {
          case '+' -> TokenType.PLUS;
          case '-' -> TokenType.MINUS;
          case '*' -> TokenType.STAR;
          case '/' -> TokenType.SLASH;
          case '^' -> TokenType.CARET;
          case '(' -> TokenType.LPAREN;
          case ')' -> TokenType.RPAREN;
          case ',' -> TokenType.COMMA;
          default -> throw new LexException(pos, c, LexException.Reason.UNEXPECTED_CHARACTER);
        };
    Token t = Token.of(type, String.valueOf(c), pos);
    pos++;
    return t;
  }

  private int skipDigits() {
    int start = pos;
    while (!isAtEnd() && isDigit(peek())) {
      pos++;
    }
    return pos - start;
  }

  private void skipWs() {
    while (!isAtEnd() && Character.isWhitespace(peek())) {
      pos++;
    }
  }

  private boolean isAtEnd() {
    return pos >= input.length();
  }

  private char peek() {
    return input.charAt(pos);
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private static boolean isLetter(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
  }
}
