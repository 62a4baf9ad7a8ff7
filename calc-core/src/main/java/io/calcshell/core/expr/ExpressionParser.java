package io.calcshell.core.expr;

import io.calcshell.core.expr.ValueExpr.ArithOp;
import io.calcshell.core.expr.ValueExpr.UnaryOp;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Precedence-climbing parser for arithmetic expressions.
 *
 * <p>Grammar, lowest to highest binding:
 *
 * <pre>
 * expr     := operand (binop operand)*     // climbing over + - (1), * / (2), ^ (4)
 * operand  := '-' powexpr | primary
 * powexpr  := operand ('^' powexpr)?
 * primary  := number
 *           | '(' expr ')'
 *           | constant
 *           | function '(' expr (',' expr)* ')'
 * </pre>
 *
 * <p>{@code + - * /} are left-associative and {@code ^} is right-associative. Unary minus sits
 * between {@code * /} and {@code ^}, so {@code -2^2} is {@code -(2^2)} while {@code -2*3} is
 * {@code (-2)*3}. Function arity is checked against {@link FunctionTable} while parsing.
 *
 * <p>Every construct that makes the parser recurse without consuming an operator of lower
 * precedence (parentheses, call arguments, unary minus and the right operand of {@code ^}) counts
 * as one nesting level. More than {@link #MAX_NESTING} levels fail with {@link
 * NestingTooDeepException}, which also bounds the depth of the tree handed to the evaluator.
 */
public final class ExpressionParser {

  private static final Logger LOG = LoggerFactory.getLogger(ExpressionParser.class);

  /** Maximum nesting depth accepted by {@link #parse(List)}. */
  public static final int MAX_NESTING = 500;

  private final List<Token> tokens;
  private int pos;
  private int depth;

  private ExpressionParser(List<Token> tokens) {
    this.tokens = tokens;
    this.pos = 0;
  }

  /**
   * Parses a token list produced by {@link ExpressionLexer#tokenize(String)}.
   *
   * @param tokens tokens terminated by {@link TokenType#EOF}
   * @return the expression tree
   * @throws ParseException if the tokens do not form exactly one expression
   */
  public static ValueExpr parse(List<Token> tokens) {
    Objects.requireNonNull(tokens, "tokens");
    if (tokens.isEmpty() || !tokens.get(tokens.size() - 1).is(TokenType.EOF)) {
      throw new IllegalArgumentException("Token list must end with EOF");
    }
    ExpressionParser parser = new ExpressionParser(tokens);
    ValueExpr expr = parser.parseExpression(0);
    Token trailing = parser.peek();
    if (!trailing.is(TokenType.EOF)) {
      throw new UnexpectedTokenException(trailing, "operator or end of input");
    }
    LOG.debug("Parsed expression: {}", expr);
    return expr;
  }

  private ValueExpr parseExpression(int minPrecedence) {
    ValueExpr left = parseOperand();
    while (true) {
      ArithOp op = ArithOp.fromToken(peek().type());
      if (op == null || op.precedence() < minPrecedence) {
        return left;
      }
      Token opToken = peek();
      advance();
      ValueExpr right;
      if (op.isRightAssociative()) {
        enter(opToken);
        right = parseExpression(op.precedence());
        leave();
      } else {
        right = parseExpression(op.precedence() + 1);
      }
      left = new BinaryExpr(left, op, right);
    }
  }

  private ValueExpr parseOperand() {
    Token t = peek();
    if (t.is(TokenType.MINUS)) {
      advance();
      enter(t);
      // the negated operand absorbs a following '^' chain but nothing looser
      ValueExpr operand = parseExpression(UnaryOp.PRECEDENCE + 1);
      leave();
      return new UnaryExpr(UnaryOp.NEGATE, operand);
    }
    return parsePrimary();
  }

  private ValueExpr parsePrimary() {
    Token t = peek();
    switch (t.type()) {
      case NUMBER:
        advance();
        return new NumberLiteral(t.value());
      case LPAREN:
        advance();
        enter(t);
        ValueExpr inner = parseExpression(0);
        expect(TokenType.RPAREN, "')'");
        leave();
        return inner;
      case IDENTIFIER:
        advance();
        return parseIdentifier(t);
      case EOF:
        throw new UnexpectedEndException(t.offset(), "number, identifier or '('");
      default:
        throw new UnexpectedTokenException(t, "number, identifier or '('");
    }
  }

  private ValueExpr parseIdentifier(Token name) {
    String ident = name.text();
    var fn = FunctionTable.lookup(ident);
    if (fn.isPresent()) {
      Token open = peek();
      if (!open.is(TokenType.LPAREN)) {
        if (open.is(TokenType.EOF)) {
          throw new UnexpectedEndException(open.offset(), "'(' after function '" + ident + "'");
        }
        throw new UnexpectedTokenException(open, "'(' after function '" + ident + "'");
      }
      advance();
      enter(open);
      List<ValueExpr> args = parseArguments();
      leave();
      FunctionTable.FunctionDef def = fn.get();
      if (!def.accepts(args.size())) {
        throw new ArityMismatchException(
            def.name(), def.minArity(), args.size(), def.isVariadic(), name.offset());
      }
      return new FunctionCall(def.name(), args);
    }
    if (Constants.isConstant(ident)) {
      return FunctionCall.constant(ident);
    }
    throw new UnknownIdentifierException(ident, name.offset());
  }

  // after '(' : ')' | expr (',' expr)* ')'
  private List<ValueExpr> parseArguments() {
    List<ValueExpr> args = new ArrayList<>();
    if (peek().is(TokenType.RPAREN)) {
      advance();
      return args;
    }
    while (true) {
      args.add(parseExpression(0));
      Token t = peek();
      if (t.is(TokenType.COMMA)) {
        advance();
        continue;
      }
      expect(TokenType.RPAREN, "',' or ')'");
      return args;
    }
  }

  private void enter(Token at) {
    if (++depth > MAX_NESTING) {
      throw new NestingTooDeepException(MAX_NESTING, at.offset());
    }
  }

  private void leave() {
    depth--;
  }

  private void expect(TokenType type, String expected) {
    Token t = peek();
    if (t.is(type)) {
      advance();
      return;
    }
    if (t.is(TokenType.EOF)) {
      throw new UnexpectedEndException(t.offset(), expected);
    }
    throw new UnexpectedTokenException(t, expected);
  }

  private Token peek() {
    return tokens.get(pos);
  }

  private void advance() {
    if (pos < tokens.size() - 1) {
      pos++;
    }
  }
}
