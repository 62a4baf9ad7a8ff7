package io.calcshell.shell;

import io.calcshell.core.expr.ExpressionEngine;
import io.calcshell.core.expr.ExpressionException;
import io.calcshell.shell.cli.ResultFormatter;
import io.calcshell.shell.commands.CompoundCommand;
import io.calcshell.shell.commands.ConvertCommand;
import io.calcshell.shell.commands.GcdCommand;
import io.calcshell.shell.commands.LcmCommand;
import io.calcshell.shell.commands.LoanCommand;
import io.calcshell.shell.commands.StatsCommand;
import io.calcshell.shell.commands.TempCommand;
import java.util.List;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

@CommandLine.Command(
    name = "calc",
    description = "Command-line calculator with expression evaluation and conversion tools",
    version = "calc 0.1.0",
    mixinStandardHelpOptions = true,
    subcommands = {
      ConvertCommand.class,
      TempCommand.class,
      LoanCommand.class,
      CompoundCommand.class,
      StatsCommand.class,
      GcdCommand.class,
      LcmCommand.class
    },
    footer = {
      "",
      "Examples:",
      "  calc \"2 + 3 * 4\"",
      "  calc -i",
      "  calc convert 100 km mi length",
      "  calc temp 100 c f",
      "  calc loan 100000 0.05 30",
      "  calc stats 1 2 3 4 5"
    })
public final class Main implements Callable<Integer> {

  private static final Logger LOG = LoggerFactory.getLogger(Main.class);

  @CommandLine.Parameters(
      arity = "0..*",
      paramLabel = "EXPRESSION",
      description = "Expression to evaluate; words are joined with spaces")
  private List<String> expression;

  @CommandLine.Option(
      names = {"-i", "--interactive"},
      description = "Start the interactive shell")
  private boolean interactive;

  @CommandLine.Option(
      names = {"-q", "--quiet"},
      description = "Suppress banner (interactive mode)")
  private boolean quiet;

  @CommandLine.Option(
      names = {"--precision"},
      description = "Fixed number of decimal places in results")
  private Integer precision;

  @CommandLine.Option(
      names = {"--format"},
      description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})",
      defaultValue = "TEXT")
  private ResultFormatter.Format format;

  @CommandLine.Option(
      names = {"--max-length"},
      description = "Maximum expression length; negative disables the limit")
  private Integer maxLength;

  public static void main(String[] args) {
    int exitCode = newCommandLine().execute(args);
    System.exit(exitCode);
  }

  /** Command line configured so that negative numbers are read as values, not options. */
  public static CommandLine newCommandLine() {
    return new CommandLine(new Main())
        .setCaseInsensitiveEnumValuesAllowed(true)
        .setUnmatchedOptionsArePositionalParams(true);
  }

  @Override
  public Integer call() throws Exception {
    if (precision != null && precision < 0) {
      System.err.println("Error: precision must not be negative: " + precision);
      return 2;
    }
    ShellSettings settings =
        ShellSettings.fromSystemProperties().withMaxLength(maxLength).withPrecision(precision);
    ResultFormatter formatter = new ResultFormatter(format, settings.precision());

    if (interactive || expression == null || expression.isEmpty()) {
      try (Shell shell = new Shell(settings, formatter)) {
        shell.run(quiet);
      }
      return 0;
    }

    String text = String.join(" ", expression);
    ExpressionEngine engine = new ExpressionEngine(settings.maxLength());
    try {
      double result = engine.evaluate(text);
      System.out.println(formatter.success(text, result));
      return 0;
    } catch (ExpressionException e) {
      LOG.debug("Evaluation failed", e);
      System.err.println(formatter.failure(text, e));
      return 1;
    }
  }
}
