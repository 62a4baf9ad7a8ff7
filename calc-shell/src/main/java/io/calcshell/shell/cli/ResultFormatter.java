package io.calcshell.shell.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.calcshell.core.expr.ExpressionException;
import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Locale;

/** Renders evaluation results and failures as plain text or JSON. */
public final class ResultFormatter {

  public enum Format {
    TEXT,
    JSON
  }

  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final int DEFAULT_SIGNIFICANT_DIGITS = 10;

  private final Format format;
  private final Integer precision;

  /**
   * @param format output format
   * @param precision fixed decimal places, or {@code null} for automatic formatting
   */
  public ResultFormatter(Format format, Integer precision) {
    this.format = format == null ? Format.TEXT : format;
    this.precision = precision;
  }

  public Format format() {
    return format;
  }

  /**
   * Formats a number for display. With a precision the value is printed with exactly that many
   * decimals; otherwise integral values print without a fraction and others with up to 10
   * significant digits.
   */
  public String formatNumber(double value) {
    if (precision != null) {
      return String.format(Locale.ROOT, "%." + precision + "f", value);
    }
    if (value == Math.rint(value) && Math.abs(value) < 1e15) {
      return String.valueOf((long) value);
    }
    return significant(value, DEFAULT_SIGNIFICANT_DIGITS);
  }

  /** Rounds to {@code digits} significant digits and strips trailing zeros. */
  public static String significant(double value, int digits) {
    if (value == 0) {
      return "0";
    }
    BigDecimal bd = new BigDecimal(value).round(new MathContext(digits)).stripTrailingZeros();
    int magnitude = bd.precision() - bd.scale();
    return magnitude > -6 && magnitude <= 21 ? bd.toPlainString() : bd.toString();
  }

  /** Formats with thousands separators and two decimals, e.g. {@code 1,234.50}. */
  public static String money(double value) {
    return String.format(Locale.ROOT, "%,.2f", value);
  }

  public String success(String expression, double value) {
    if (format == Format.TEXT) {
      return formatNumber(value);
    }
    ObjectNode node = MAPPER.createObjectNode();
    node.put("expression", expression);
    node.put("result", value);
    node.put("display", formatNumber(value));
    return toJson(node);
  }

  /**
   * Formats a failure. Text output is a one-line diagnostic, followed by the expression and a
   * caret under the offending position when the error has one.
   */
  public String failure(String expression, ExpressionException e) {
    if (format == Format.TEXT) {
      StringBuilder sb = new StringBuilder("Error: ").append(e.getMessage());
      if (e.offset() >= 0 && expression != null && e.offset() <= expression.length()) {
        sb.append('\n').append("  ").append(expression);
        sb.append('\n').append("  ").append(" ".repeat(e.offset())).append('^');
      }
      return sb.toString();
    }
    ObjectNode node = MAPPER.createObjectNode();
    node.put("expression", expression);
    ObjectNode error = node.putObject("error");
    error.put("type", errorType(e));
    error.put("message", e.getMessage());
    if (e.offset() >= 0) {
      error.put("offset", e.offset());
    }
    return toJson(node);
  }

  /** Short error tag such as {@code DivisionByZero} or {@code ArityMismatch}. */
  static String errorType(ExpressionException e) {
    String name = e.getClass().getSimpleName();
    String suffix = "Exception";
    return name.endsWith(suffix) ? name.substring(0, name.length() - suffix.length()) : name;
  }

  private static String toJson(ObjectNode node) {
    try {
      return MAPPER.writeValueAsString(node);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to render JSON output", e);
    }
  }
}
