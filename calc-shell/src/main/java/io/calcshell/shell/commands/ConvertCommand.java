package io.calcshell.shell.commands;

import io.calcshell.core.convert.UnitCategory;
import io.calcshell.core.convert.UnitConverter;
import io.calcshell.shell.cli.ResultFormatter;
import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "convert",
    description = "Convert a value between units (length, weight, data, time, area)",
    mixinStandardHelpOptions = true)
public final class ConvertCommand implements Callable<Integer> {

  @CommandLine.Parameters(index = "0", paramLabel = "VALUE")
  double value;

  @CommandLine.Parameters(index = "1", paramLabel = "FROM")
  String from;

  @CommandLine.Parameters(index = "2", paramLabel = "TO")
  String to;

  @CommandLine.Parameters(
      index = "3",
      paramLabel = "TYPE",
      description = "Unit type: length, weight, data, time, area")
  String type;

  @Override
  public Integer call() {
    try {
      UnitCategory category = UnitCategory.fromName(type);
      double result = UnitConverter.convert(value, from, to, category);
      System.out.println(
          ResultFormatter.significant(value, 10)
              + " "
              + from
              + " = "
              + ResultFormatter.significant(result, 6)
              + " "
              + to);
      return 0;
    } catch (IllegalArgumentException e) {
      System.err.println("Error: " + e.getMessage());
      return 1;
    }
  }
}
