package io.calcshell.core.expr;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/** Binary arithmetic expression combining two sub-expressions. */
public record BinaryExpr(ValueExpr left, ValueExpr.ArithOp op, ValueExpr right)
    implements ValueExpr {

  public BinaryExpr {
    Objects.requireNonNull(left, "left");
    Objects.requireNonNull(op, "op");
    Objects.requireNonNull(right, "right");
  }

  /**
   * Left operands are unrolled in a loop: a long left-associative chain such as {@code 1+1+...+1}
   * is as deep as it is long.
   */
  @Override
  public String toString() {
    Deque<BinaryExpr> spine = new ArrayDeque<>();
    ValueExpr leftmost = this;
    while (leftmost instanceof BinaryExpr b) {
      spine.push(b);
      leftmost = b.left();
    }
    StringBuilder sb = new StringBuilder("(".repeat(spine.size())).append(leftmost);
    while (!spine.isEmpty()) {
      BinaryExpr b = spine.pop();
      sb.append(' ').append(b.op().symbol()).append(' ').append(b.right()).append(')');
    }
    return sb.toString();
  }
}
