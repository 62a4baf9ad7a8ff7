package io.calcshell.shell.commands;

import static io.calcshell.shell.cli.ResultFormatter.money;

import io.calcshell.core.TableFormatter;
import io.calcshell.core.finance.FinanceCalculator;
import java.util.Locale;
import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "loan",
    description = "Monthly payment, total repaid and interest of an amortized loan",
    mixinStandardHelpOptions = true)
public final class LoanCommand implements Callable<Integer> {

  @CommandLine.Parameters(index = "0", paramLabel = "PRINCIPAL")
  double principal;

  @CommandLine.Parameters(
      index = "1",
      paramLabel = "RATE",
      description = "Annual interest rate as a fraction, e.g. 0.05")
  double rate;

  @CommandLine.Parameters(index = "2", paramLabel = "YEARS")
  int years;

  @Override
  public Integer call() {
    try {
      double monthly = FinanceCalculator.loanPayment(principal, rate, years);
      double total = monthly * years * FinanceCalculator.MONTHLY;
      System.out.print(
          TableFormatter.report("Loan repayment")
              .field("Principal", money(principal))
              .field("Annual rate", String.format(Locale.ROOT, "%.2f%%", rate * 100))
              .field("Term", years + " years")
              .rule()
              .field("Monthly payment", money(monthly))
              .field("Total repaid", money(total))
              .field("Total interest", money(total - principal))
              .build());
      return 0;
    } catch (IllegalArgumentException e) {
      System.err.println("Error: " + e.getMessage());
      return 1;
    }
  }
}
