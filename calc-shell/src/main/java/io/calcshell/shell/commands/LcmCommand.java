package io.calcshell.shell.commands;

import io.calcshell.core.stats.Statistics;
import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "lcm",
    description = "Least common multiple of two integers",
    mixinStandardHelpOptions = true)
public final class LcmCommand implements Callable<Integer> {

  @CommandLine.Parameters(index = "0", paramLabel = "A")
  long a;

  @CommandLine.Parameters(index = "1", paramLabel = "B")
  long b;

  @Override
  public Integer call() {
    try {
      System.out.println("LCM(" + a + ", " + b + ") = " + Statistics.lcm(a, b));
      return 0;
    } catch (IllegalArgumentException e) {
      System.err.println("Error: " + e.getMessage());
      return 1;
    }
  }
}
