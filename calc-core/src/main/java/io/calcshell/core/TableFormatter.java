package io.calcshell.core;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Plain-text layout for calculator reports: column-aligned tables and titled key/value blocks.
 */
public final class TableFormatter {

  private static final int MAX_CELL_WIDTH = 40;
  private static final int RULE_WIDTH = 50;

  /**
   * Formats a list of rows as column-aligned output. Columns come from the first row's keys, in
   * insertion order.
   *
   * @param rows rows to print
   * @return formatted table ending with a newline
   */
  public static String formatTable(List<? extends Map<String, ?>> rows) {
    if (rows.isEmpty()) {
      return "(no results)\n";
    }
    List<String> columns = new ArrayList<>(rows.get(0).keySet());

    Map<String, Integer> widths = new LinkedHashMap<>();
    for (String col : columns) {
      widths.put(col, Math.min(col.length(), MAX_CELL_WIDTH));
    }
    for (Map<String, ?> row : rows) {
      for (String col : columns) {
        int w = formatValue(row.get(col)).length();
        widths.put(col, Math.min(Math.max(widths.get(col), w), MAX_CELL_WIDTH));
      }
    }

    StringBuilder sb = new StringBuilder();
    appendRow(sb, columns, widths, col -> col);
    for (Map<String, ?> row : rows) {
      appendRow(sb, columns, widths, col -> formatValue(row.get(col)));
    }
    return sb.toString();
  }

  /**
   * Starts a titled block of labelled values, with labels padded to a common width.
   *
   * <pre>
   * ==================================================
   * Loan repayment
   * ==================================================
   *   Principal:        100,000
   *   Monthly payment:  537
   * </pre>
   *
   * @param title heading line
   * @return a builder collecting the report lines
   */
  public static Report report(String title) {
    return new Report(title);
  }

  /** Builder for {@link #report(String)}. */
  public static final class Report {
    private final String title;
    private final List<String[]> lines = new ArrayList<>();

    private Report(String title) {
      this.title = title;
    }

    public Report field(String label, Object value) {
      lines.add(new String[] {label + ":", formatValue(value)});
      return this;
    }

    /** Adds a separator rule. */
    public Report rule() {
      lines.add(null);
      return this;
    }

    public String build() {
      int labelWidth = 0;
      for (String[] line : lines) {
        if (line != null) {
          labelWidth = Math.max(labelWidth, line[0].length());
        }
      }
      StringBuilder sb = new StringBuilder();
      String rule = "=".repeat(RULE_WIDTH);
      sb.append(rule).append('\n').append(title).append('\n').append(rule).append('\n');
      for (String[] line : lines) {
        if (line == null) {
          sb.append("-".repeat(RULE_WIDTH)).append('\n');
          continue;
        }
        sb.append("  ").append(padRight(line[0], labelWidth)).append("  ");
        sb.append(line[1]).append('\n');
      }
      return sb.toString();
    }

    @Override
    public String toString() {
      return build();
    }
  }

  private static void appendRow(
      StringBuilder sb,
      List<String> columns,
      Map<String, Integer> widths,
      Function<String, String> cell) {
    for (int i = 0; i < columns.size(); i++) {
      String col = columns.get(i);
      int w = widths.get(col);
      String text = truncate(cell.apply(col), w);
      // no trailing padding on the last column
      sb.append(i < columns.size() - 1 ? padRight(text, w) + "  " : text);
    }
    sb.append('\n');
  }

  private static String formatValue(Object value) {
    if (value == null) {
      return "";
    }
    if (value instanceof List<?> list) {
      StringBuilder sb = new StringBuilder("[");
      for (int i = 0; i < list.size(); i++) {
        if (i > 0) sb.append(", ");
        sb.append(formatValue(list.get(i)));
      }
      return sb.append(']').toString();
    }
    return value.toString();
  }

  private static String padRight(String str, int width) {
    if (str.length() >= width) {
      return str;
    }
    return str + " ".repeat(width - str.length());
  }

  private static String truncate(String str, int maxWidth) {
    if (str.length() <= maxWidth) {
      return str;
    }
    return str.substring(0, maxWidth - 3) + "...";
  }

  private TableFormatter() {}
}
