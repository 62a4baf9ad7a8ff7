package io.calcshell.shell;

import io.calcshell.core.expr.ExpressionEngine;
import io.calcshell.shell.cli.CalculationHistory;
import io.calcshell.shell.cli.CommandDispatcher;
import io.calcshell.shell.cli.ResultFormatter;
import io.calcshell.shell.cli.ShellCompleter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.history.DefaultHistory;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Interactive calculator loop backed by JLine. */
public final class Shell implements AutoCloseable {

  private static final Logger LOG = LoggerFactory.getLogger(Shell.class);
  private static final int HISTORY_CAPACITY = 100;

  private final Terminal terminal;
  private final LineReader lineReader;
  private final DefaultHistory history;
  private final CommandDispatcher dispatcher;
  private boolean running = true;

  public Shell(ShellSettings settings, ResultFormatter formatter) throws IOException {
    this.terminal = TerminalBuilder.builder().system(true).build();
    Path histPath = settings.historyFile();
    try {
      Files.createDirectories(histPath.getParent());
    } catch (IOException e) {
      LOG.warn(
          "Cannot create {}, history will not persist: {}", histPath.getParent(), e.getMessage());
    }
    this.history = new DefaultHistory();
    Map<String, Object> vars = new HashMap<>();
    vars.put(LineReader.HISTORY_FILE, histPath);
    this.lineReader =
        LineReaderBuilder.builder()
            .terminal(terminal)
            .variables(vars)
            .history(history)
            .completer(new ShellCompleter())
            .build();
    this.dispatcher =
        new CommandDispatcher(
            new ExpressionEngine(settings.maxLength()),
            formatter,
            new CalculationHistory(HISTORY_CAPACITY),
            new CommandDispatcher.IO() {
              @Override
              public void println(String s) {
                terminal.writer().println(s);
                terminal.flush();
              }

              @Override
              public void printf(String fmt, Object... args) {
                terminal.writer().printf(fmt, args);
                terminal.flush();
              }

              @Override
              public void error(String s) {
                terminal.writer().println(s);
                terminal.flush();
              }
            });
  }

  public void run(boolean quiet) {
    if (!quiet) {
      printBanner();
    }
    while (running) {
      try {
        String input = lineReader.readLine("calc> ");
        if (input == null || input.isBlank()) continue;
        input = input.trim();

        if (isExit(input)) {
          terminal.writer().println("Goodbye!");
          terminal.flush();
          running = false;
          continue;
        }
        if ("help".equalsIgnoreCase(input)) {
          printHelp();
          continue;
        }
        dispatcher.dispatch(input);
      } catch (UserInterruptException e) {
        terminal.writer().println("^C");
        terminal.flush();
      } catch (EndOfFileException e) {
        terminal.writer().println();
        terminal.writer().println("Goodbye!");
        terminal.flush();
        running = false;
      }
    }
  }

  static boolean isExit(String input) {
    return "exit".equalsIgnoreCase(input)
        || "quit".equalsIgnoreCase(input)
        || "q".equalsIgnoreCase(input);
  }

  private void printBanner() {
    terminal.writer().println("╔═══════════════════════════════════════╗");
    terminal.writer().println("║           Calculator Shell            ║");
    terminal.writer().println("╚═══════════════════════════════════════╝");
    terminal.writer().println("Type an expression, 'help' for commands, 'exit' to quit");
    terminal.writer().println();
    terminal.flush();
  }

  private void printHelp() {
    terminal.writer().println("Expressions:");
    terminal.writer().println("  Operators:  + - * / ^   (^ is right-associative, -2^2 = -4)");
    terminal.writer().println("  Functions:  sqrt sin cos tan log ln abs pow min max");
    terminal.writer().println("              (sin/cos/tan take degrees, log is base 10)");
    terminal.writer().println("  Constants:  pi e");
    terminal.writer().println();
    terminal.writer().println("Commands:");
    terminal.writer().println("  history                        Show the last 10 results");
    terminal.writer().println("  parse <expr>                   Show how an expression groups");
    terminal.writer().println("  functions                      List built-in functions");
    terminal.writer().println("  help                           Show this help");
    terminal.writer().println("  exit|quit|q                    Leave the shell");
    terminal.writer().println();
    terminal.writer().println("Examples:");
    terminal.writer().println("  2 + 3 * 4");
    terminal.writer().println("  sqrt(16) + sin(45) * 2");
    terminal.writer().println("  max(1, 2^10, 1000)");
    terminal.flush();
  }

  @Override
  public void close() throws Exception {
    try {
      history.save();
    } catch (IOException e) {
      LOG.warn("Failed to save history: {}", e.getMessage());
    }
    terminal.close();
  }
}
