package io.calcshell.shell.commands;

import static io.calcshell.shell.cli.ResultFormatter.money;

import io.calcshell.core.TableFormatter;
import io.calcshell.core.finance.FinanceCalculator;
import java.util.Locale;
import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "compound",
    description = "Final balance and interest earned with compound interest",
    mixinStandardHelpOptions = true)
public final class CompoundCommand implements Callable<Integer> {

  @CommandLine.Parameters(index = "0", paramLabel = "PRINCIPAL")
  double principal;

  @CommandLine.Parameters(
      index = "1",
      paramLabel = "RATE",
      description = "Annual interest rate as a fraction, e.g. 0.05")
  double rate;

  @CommandLine.Parameters(index = "2", paramLabel = "YEARS")
  int years;

  @CommandLine.Option(
      names = {"--periods"},
      description = "Compounding periods per year (default: ${DEFAULT-VALUE})",
      defaultValue = "12")
  int periods;

  @Override
  public Integer call() {
    try {
      double result = FinanceCalculator.compoundInterest(principal, rate, years, periods);
      System.out.print(
          TableFormatter.report("Compound interest")
              .field("Principal", money(principal))
              .field("Annual rate", String.format(Locale.ROOT, "%.2f%%", rate * 100))
              .field("Term", years + " years")
              .field("Periods/year", periods)
              .rule()
              .field("Final amount", money(result))
              .field("Interest", money(result - principal))
              .build());
      return 0;
    } catch (IllegalArgumentException e) {
      System.err.println("Error: " + e.getMessage());
      return 1;
    }
  }
}
