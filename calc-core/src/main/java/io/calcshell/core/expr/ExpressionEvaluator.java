package io.calcshell.core.expr;

import io.calcshell.core.expr.ValueExpr.ArithOp;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Evaluates an expression tree to a finite {@code double}.
 *
 * <p>Evaluation is post-order: operands and call arguments (left to right) are computed before the
 * node that combines them. The first failure aborts the whole evaluation. The tree is never
 * modified.
 *
 * <p>Recursion depth follows the parser's nesting limit. Left-associative chains, which the parser
 * builds in a loop and which can be as long as the input, are folded iteratively.
 */
public final class ExpressionEvaluator {

  private ExpressionEvaluator() {}

  /**
   * Evaluates an expression.
   *
   * @param expr the expression tree
   * @return the finite result
   * @throws EvalException on division by zero, an operation without a real result, or a
   *     non-finite intermediate value
   */
  public static double evaluate(ValueExpr expr) {
    Objects.requireNonNull(expr, "expr");
    if (expr instanceof NumberLiteral lit) {
      return finite(lit.value(), "literal " + lit);
    }
    if (expr instanceof UnaryExpr unary) {
      return -evaluate(unary.operand());
    }
    if (expr instanceof BinaryExpr binary) {
      return evaluateChain(binary);
    }
    if (expr instanceof FunctionCall call) {
      return finite(call(call), call.name());
    }
    throw new IllegalStateException("Unsupported expression node: " + expr.getClass().getName());
  }

  // walks down the left spine, then combines bottom-up so operands still run left to right
  private static double evaluateChain(BinaryExpr top) {
    Deque<BinaryExpr> spine = new ArrayDeque<>();
    ValueExpr node = top;
    while (node instanceof BinaryExpr b) {
      spine.push(b);
      node = b.left();
    }
    double acc = evaluate(node);
    while (!spine.isEmpty()) {
      BinaryExpr b = spine.pop();
      double r = evaluate(b.right());
      acc = finite(apply(b.op(), acc, r), b.op().symbol());
    }
    return acc;
  }

  private static double apply(ArithOp op, double l, double r) {
    return switch (op) {
      case ADD -> l + r;
      case SUB -> l - r;
      case MUL -> l * r;
      case DIV -> {
        if (r == 0) {
          throw new DivisionByZeroException();
        }
        yield l / r;
      }
      case POW -> FunctionTable.power(op.symbol(), l, r);
    };
  }

  private static double call(FunctionCall call) {
    List<ValueExpr> args = call.args();
    if (args.isEmpty() && Constants.isConstant(call.name())) {
      return Constants.valueOf(call.name());
    }
    FunctionTable.FunctionDef def =
        FunctionTable.lookup(call.name())
            .orElseThrow(
                () -> new IllegalStateException("Unknown function in tree: " + call.name()));
    if (!def.accepts(args.size())) {
      // trees built by hand can bypass the parser's check
      throw new IllegalStateException(
          "Function '" + def.name() + "' called with " + args.size() + " arguments");
    }
    double[] values = new double[args.size()];
    for (int i = 0; i < values.length; i++) {
      values[i] = evaluate(args.get(i));
    }
    return def.impl().apply(values);
  }

  private static double finite(double value, String operation) {
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      throw new NonFiniteResultException(operation);
    }
    return value;
  }
}
