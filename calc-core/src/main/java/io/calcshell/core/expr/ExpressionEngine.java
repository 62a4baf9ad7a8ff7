package io.calcshell.core.expr;

import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single entry point for evaluating expression text.
 *
 * <p>Runs {@link ExpressionLexer}, {@link ExpressionParser} and {@link ExpressionEvaluator} in
 * order. Instances hold only the immutable length cap and can be shared between threads.
 *
 * <pre>
 * ExpressionEngine engine = new ExpressionEngine();
 * double v = engine.evaluate("sqrt(16) + sin(90) * 2");   // 6.0
 * </pre>
 */
public final class ExpressionEngine {

  private static final Logger LOG = LoggerFactory.getLogger(ExpressionEngine.class);

  /** Default input length cap. */
  public static final int DEFAULT_MAX_LENGTH = 10_000;

  private final int maxLength;

  public ExpressionEngine() {
    this(DEFAULT_MAX_LENGTH);
  }

  /**
   * @param maxLength maximum accepted input length; a negative value disables the check
   */
  public ExpressionEngine(int maxLength) {
    this.maxLength = maxLength;
  }

  public int maxLength() {
    return maxLength;
  }

  /**
   * Parses an expression without evaluating it.
   *
   * @param expression expression text
   * @return the expression tree
   * @throws LexException if the text cannot be tokenized
   * @throws ParseException if the tokens do not form a valid expression
   */
  public ValueExpr parse(String expression) {
    Objects.requireNonNull(expression, "expression");
    if (maxLength >= 0 && expression.length() > maxLength) {
      throw new ExpressionTooLongException(expression.length(), maxLength);
    }
    List<Token> tokens = ExpressionLexer.tokenize(expression);
    return ExpressionParser.parse(tokens);
  }

  /**
   * Evaluates an expression.
   *
   * @param expression expression text
   * @return the finite result
   * @throws ExpressionException describing the first lexing, parsing or evaluation failure
   */
  public double evaluate(String expression) {
    ValueExpr tree = parse(expression);
    double result = ExpressionEvaluator.evaluate(tree);
    LOG.debug("Evaluated '{}' = {}", expression, result);
    return result;
  }
}
