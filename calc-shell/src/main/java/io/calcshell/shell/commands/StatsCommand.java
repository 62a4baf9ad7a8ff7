package io.calcshell.shell.commands;

import io.calcshell.core.TableFormatter;
import io.calcshell.core.stats.Statistics;
import io.calcshell.shell.cli.ResultFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "stats",
    description = "Count, sum, mean, median, min, max and standard deviation of numbers",
    mixinStandardHelpOptions = true)
public final class StatsCommand implements Callable<Integer> {

  private static final int DIGITS = 4;

  @CommandLine.Parameters(arity = "0..*", paramLabel = "NUMBER")
  double[] numbers = new double[0];

  @Override
  public Integer call() {
    try {
      List<String> data = new ArrayList<>();
      for (double n : numbers) {
        data.add(ResultFormatter.significant(n, 10));
      }
      TableFormatter.Report report =
          TableFormatter.report("Statistics")
              .field("Data", data)
              .rule()
              .field("Count", numbers.length)
              .field("Sum", fmt(Statistics.sum(numbers)))
              .field("Mean", fmt(Statistics.mean(numbers)))
              .field("Median", fmt(Statistics.median(numbers)))
              .field("Min", fmt(Statistics.min(numbers)))
              .field("Max", fmt(Statistics.max(numbers)));
      if (numbers.length >= 2) {
        report.field("Std deviation", fmt(Statistics.stdDev(numbers)));
      }
      System.out.print(report.build());
      return 0;
    } catch (IllegalArgumentException e) {
      System.err.println("Error: " + e.getMessage());
      return 1;
    }
  }

  private static String fmt(double v) {
    return ResultFormatter.significant(v, DIGITS);
  }
}
