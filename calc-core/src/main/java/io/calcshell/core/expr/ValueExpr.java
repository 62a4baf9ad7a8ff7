package io.calcshell.core.expr;

/**
 * Value expression AST produced by {@link ExpressionParser} and consumed by {@link
 * ExpressionEvaluator}.
 *
 * <p>The node set is closed: literals, binary and unary arithmetic, and calls into the built-in
 * {@link FunctionTable}. Constants such as {@code pi} are represented as zero-argument calls and
 * resolved at evaluation time.
 *
 * <p>Example:
 *
 * <pre>
 * // sqrt(16) + 2 * 3
 * ValueExpr expr = new BinaryExpr(
 *     new FunctionCall("sqrt", List.of(new NumberLiteral(16))),
 *     ArithOp.ADD,
 *     new BinaryExpr(new NumberLiteral(2), ArithOp.MUL, new NumberLiteral(3)));
 * double result = ExpressionEvaluator.evaluate(expr);
 * </pre>
 *
 * <p>Nodes are immutable and each node owns its children, so a tree can be shared freely between
 * threads once built.
 */
public sealed interface ValueExpr permits NumberLiteral, BinaryExpr, UnaryExpr, FunctionCall {

  /** Binary arithmetic operators, with their binding strength and associativity. */
  enum ArithOp {
    ADD("+", 1, false),
    SUB("-", 1, false),
    MUL("*", 2, false),
    DIV("/", 2, false),
    POW("^", 4, true);

    private final String symbol;
    private final int precedence;
    private final boolean rightAssociative;

    ArithOp(String symbol, int precedence, boolean rightAssociative) {
      this.symbol = symbol;
      this.precedence = precedence;
      this.rightAssociative = rightAssociative;
    }

    public String symbol() {
      return symbol;
    }

    public int precedence() {
      return precedence;
    }

    public boolean isRightAssociative() {
      return rightAssociative;
    }

    /**
     * Maps an operator token to its binary operator.
     *
     * @param type the token type
     * @return the operator, or {@code null} if the token is not a binary operator
     */
    public static ArithOp fromToken(TokenType type) {
      return switch (type) {
        case PLUS -> ADD;
        case MINUS -> SUB;
        case STAR -> MUL;
        case SLASH -> DIV;
        case CARET -> POW;
        default -> null;
      };
    }
  }

  /** Unary operators. Only negation is supported. */
  enum UnaryOp {
    NEGATE("-");

    /** Binds tighter than {@code * /} and looser than {@code ^}. */
    public static final int PRECEDENCE = 3;

    private final String symbol;

    UnaryOp(String symbol) {
      this.symbol = symbol;
    }

    public String symbol() {
      return symbol;
    }
  }
}
