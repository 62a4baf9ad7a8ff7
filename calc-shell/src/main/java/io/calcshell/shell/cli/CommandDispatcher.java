package io.calcshell.shell.cli;

import io.calcshell.core.TableFormatter;
import io.calcshell.core.expr.Constants;
import io.calcshell.core.expr.ExpressionEngine;
import io.calcshell.core.expr.ExpressionException;
import io.calcshell.core.expr.FunctionTable;
import io.calcshell.core.expr.ValueExpr;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handles one REPL line: a built-in command ({@code history}, {@code parse}, {@code functions}) or
 * an expression to evaluate.
 */
public final class CommandDispatcher {

  private static final Logger LOG = LoggerFactory.getLogger(CommandDispatcher.class);

  /** Commands understood by {@link #dispatch(String)}; also offered by the completer. */
  public static final Set<String> COMMANDS = Set.of("history", "parse", "functions");

  static final int HISTORY_SHOWN = 10;

  public interface IO {
    void println(String s);

    void printf(String fmt, Object... args);

    void error(String s);
  }

  private final ExpressionEngine engine;
  private final ResultFormatter formatter;
  private final CalculationHistory history;
  private final IO io;

  public CommandDispatcher(
      ExpressionEngine engine, ResultFormatter formatter, CalculationHistory history, IO io) {
    this.engine = engine;
    this.formatter = formatter;
    this.history = history;
    this.io = io;
  }

  /**
   * Runs one line of input.
   *
   * @param line the trimmed input line
   * @return {@code true} if the line succeeded, {@code false} if it produced an error
   */
  public boolean dispatch(String line) {
    String[] parts = line.trim().split("\\s+", 2);
    if (parts[0].isEmpty()) return true;

    String cmd = parts[0].toLowerCase(Locale.ROOT);
    String rest = parts.length > 1 ? parts[1] : "";
    switch (cmd) {
      case "history":
        if (parts.length == 1) {
          printHistory();
          return true;
        }
        break;
      case "functions":
        if (parts.length == 1) {
          printFunctions();
          return true;
        }
        break;
      case "parse":
        return parse(rest);
      default:
        break;
    }
    return evaluate(line.trim());
  }

  private boolean evaluate(String expression) {
    try {
      double result = engine.evaluate(expression);
      history.add(expression, result);
      String out = formatter.success(expression, result);
      io.println(formatter.format() == ResultFormatter.Format.TEXT ? "= " + out : out);
      return true;
    } catch (ExpressionException e) {
      LOG.debug("Evaluation of '{}' failed: {}", expression, e.getMessage());
      io.error(formatter.failure(expression, e));
      return false;
    }
  }

  private boolean parse(String expression) {
    if (expression.isBlank()) {
      io.error("Usage: parse <expression>");
      return false;
    }
    try {
      ValueExpr tree = engine.parse(expression);
      io.println(tree.toString());
      return true;
    } catch (ExpressionException e) {
      io.error(formatter.failure(expression, e));
      return false;
    }
  }

  private void printHistory() {
    if (history.isEmpty()) {
      io.println("No calculations yet.");
      return;
    }
    int i = 1;
    for (CalculationHistory.Entry e : history.recent(HISTORY_SHOWN)) {
      io.printf("  %d. %s = %s%n", i++, e.expression(), formatter.formatNumber(e.result()));
    }
  }

  private void printFunctions() {
    List<Map<String, Object>> rows = new ArrayList<>();
    for (FunctionTable.FunctionDef def : FunctionTable.all().values()) {
      Map<String, Object> row = new LinkedHashMap<>();
      row.put("function", def.signature());
      row.put("description", def.description());
      rows.add(row);
    }
    io.println(TableFormatter.formatTable(rows).stripTrailing());
    io.println("Constants: " + String.join(", ", Constants.names().stream().sorted().toList()));
  }
}
