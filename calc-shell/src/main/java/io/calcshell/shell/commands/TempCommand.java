package io.calcshell.shell.commands;

import io.calcshell.core.convert.UnitConverter;
import io.calcshell.shell.cli.ResultFormatter;
import java.util.Locale;
import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "temp",
    description = "Convert a temperature between c (Celsius), f (Fahrenheit) and k (Kelvin)",
    mixinStandardHelpOptions = true)
public final class TempCommand implements Callable<Integer> {

  @CommandLine.Parameters(index = "0", paramLabel = "VALUE")
  double value;

  @CommandLine.Parameters(index = "1", paramLabel = "FROM")
  String from;

  @CommandLine.Parameters(index = "2", paramLabel = "TO")
  String to;

  @Override
  public Integer call() {
    try {
      double result = UnitConverter.convertTemperature(value, from, to);
      System.out.println(
          ResultFormatter.significant(value, 10)
              + UnitConverter.temperatureSymbol(from)
              + " = "
              + String.format(Locale.ROOT, "%.2f", result)
              + UnitConverter.temperatureSymbol(to));
      return 0;
    } catch (IllegalArgumentException e) {
      System.err.println("Error: " + e.getMessage());
      return 1;
    }
  }
}
