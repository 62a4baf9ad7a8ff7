package io.calcshell.shell.cli;

import static org.junit.jupiter.api.Assertions.*;

import io.calcshell.core.expr.ExpressionEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CommandDispatcherTest {

  static class BufferIO implements CommandDispatcher.IO {
    final StringBuilder out = new StringBuilder();
    final StringBuilder err = new StringBuilder();

    @Override
    public void println(String s) {
      out.append(s).append('\n');
    }

    @Override
    public void printf(String fmt, Object... args) {
      out.append(String.format(fmt, args));
    }

    @Override
    public void error(String s) {
      err.append(s).append('\n');
    }
  }

  private BufferIO io;
  private CalculationHistory history;
  private CommandDispatcher dispatcher;

  @BeforeEach
  void setUp() {
    io = new BufferIO();
    history = new CalculationHistory(100);
    dispatcher = newDispatcher(ResultFormatter.Format.TEXT);
  }

  private CommandDispatcher newDispatcher(ResultFormatter.Format format) {
    return new CommandDispatcher(
        new ExpressionEngine(), new ResultFormatter(format, null), history, io);
  }

  // ==================== Expressions ====================

  @Test
  void evaluatesExpression() {
    assertTrue(dispatcher.dispatch("2 + 3 * 4"));
    assertEquals("= 14\n", io.out.toString());
    assertEquals(1, history.size());
  }

  @Test
  void failureGoesToErrorAndIsNotRecorded() {
    assertFalse(dispatcher.dispatch("5/0"));
    assertTrue(io.err.toString().startsWith("Error: Division by zero"));
    assertEquals("", io.out.toString());
    assertTrue(history.isEmpty());
  }

  @Test
  void deeplyNestedLineDoesNotEndSession() {
    assertFalse(dispatcher.dispatch("(".repeat(2_000) + "1" + ")".repeat(2_000)));
    assertTrue(io.err.toString().startsWith("Error: Expression nested too deeply"));
    assertTrue(history.isEmpty());
    assertTrue(dispatcher.dispatch("1 + 1"));
    assertEquals("= 2\n", io.out.toString());
  }

  @Test
  void blankLineIsIgnored() {
    assertTrue(dispatcher.dispatch("   "));
    assertEquals("", io.out.toString());
    assertEquals("", io.err.toString());
  }

  @Test
  void jsonFormatPrintsRawDocument() {
    dispatcher = newDispatcher(ResultFormatter.Format.JSON);
    assertTrue(dispatcher.dispatch("1+1"));
    assertTrue(io.out.toString().startsWith("{"));
    assertTrue(io.out.toString().contains("\"display\":\"2\""));
  }

  // ==================== history ====================

  @Test
  void historyWhenEmpty() {
    assertTrue(dispatcher.dispatch("history"));
    assertEquals("No calculations yet.\n", io.out.toString());
  }

  @Test
  void historyListsSuccessfulEvaluations() {
    dispatcher.dispatch("2 + 3 * 4");
    dispatcher.dispatch("1/0");
    dispatcher.dispatch("sqrt(2)");
    io.out.setLength(0);

    assertTrue(dispatcher.dispatch("history"));
    String out = io.out.toString();
    assertTrue(out.contains("  1. 2 + 3 * 4 = 14"));
    assertTrue(out.contains("  2. sqrt(2) = 1.414213562"));
    assertFalse(out.contains("1/0"));
  }

  @Test
  void historyShowsLastTen() {
    for (int i = 1; i <= 12; i++) {
      dispatcher.dispatch(String.valueOf(i));
    }
    io.out.setLength(0);
    dispatcher.dispatch("history");
    String[] lines = io.out.toString().split("\\R");
    assertEquals(CommandDispatcher.HISTORY_SHOWN, lines.length);
    assertEquals("  1. 3 = 3", lines[0]);
    assertEquals("  10. 12 = 12", lines[9]);
  }

  @Test
  void historyWithArgumentIsEvaluated() {
    assertFalse(dispatcher.dispatch("history 5"));
    assertTrue(io.err.toString().contains("Unknown identifier 'history'"));
  }

  // ==================== parse ====================

  @Test
  void parsePrintsCanonicalForm() {
    assertTrue(dispatcher.dispatch("parse -2^2"));
    assertEquals("(-(2 ^ 2))\n", io.out.toString());
    assertTrue(history.isEmpty());
  }

  @Test
  void parseReportsErrors() {
    assertFalse(dispatcher.dispatch("parse (2+3"));
    assertTrue(io.err.toString().contains("Unexpected end of input"));
  }

  @Test
  void parseWithoutArgumentPrintsUsage() {
    assertFalse(dispatcher.dispatch("parse"));
    assertEquals("Usage: parse <expression>\n", io.err.toString());
  }

  // ==================== functions ====================

  @Test
  void functionsListsBuiltinsAndConstants() {
    assertTrue(dispatcher.dispatch("functions"));
    String out = io.out.toString();
    assertTrue(out.startsWith("function"));
    assertTrue(out.contains("sqrt(x)"));
    assertTrue(out.contains("min(a, b, ...)"));
    assertTrue(out.contains("Constants: e, pi"));
  }

  @Test
  void commandsAreCaseInsensitive() {
    assertTrue(dispatcher.dispatch("FUNCTIONS"));
    assertTrue(io.out.toString().contains("sqrt(x)"));
  }
}
