package io.calcshell.core.stats;

import java.util.Arrays;

/** Descriptive statistics over a literal list of numbers, plus integer GCD and LCM. */
public final class Statistics {

  private Statistics() {}

  public static double sum(double... values) {
    double s = 0;
    for (double v : values) {
      s += v;
    }
    return s;
  }

  /** @throws IllegalArgumentException if {@code values} is empty */
  public static double mean(double... values) {
    requireNonEmpty(values, "mean");
    return sum(values) / values.length;
  }

  /**
   * Middle value of the sorted input; the average of the two middle values for an even count.
   *
   * @throws IllegalArgumentException if {@code values} is empty
   */
  public static double median(double... values) {
    requireNonEmpty(values, "median");
    double[] sorted = values.clone();
    Arrays.sort(sorted);
    int mid = sorted.length / 2;
    if (sorted.length % 2 == 0) {
      return (sorted[mid - 1] + sorted[mid]) / 2;
    }
    return sorted[mid];
  }

  /**
   * Sample standard deviation (n - 1 denominator).
   *
   * @throws IllegalArgumentException if fewer than two values are given
   */
  public static double stdDev(double... values) {
    if (values.length < 2) {
      throw new IllegalArgumentException("Standard deviation needs at least 2 values");
    }
    double m = mean(values);
    double sq = 0;
    for (double v : values) {
      sq += (v - m) * (v - m);
    }
    return Math.sqrt(sq / (values.length - 1));
  }

  public static double min(double... values) {
    requireNonEmpty(values, "min");
    return Arrays.stream(values).min().getAsDouble();
  }

  public static double max(double... values) {
    requireNonEmpty(values, "max");
    return Arrays.stream(values).max().getAsDouble();
  }

  /**
   * Greatest common divisor; always non-negative, {@code gcd(0, 0) == 0}.
   *
   * @throws IllegalArgumentException if the divisor is 2^63, which only {@code Long.MIN_VALUE}
   *     with itself or zero produces
   */
  public static long gcd(long a, long b) {
    while (b != 0) {
      long t = a % b;
      a = b;
      b = t;
    }
    if (a == Long.MIN_VALUE) {
      throw new IllegalArgumentException("GCD does not fit in a 64-bit integer");
    }
    return Math.abs(a);
  }

  /**
   * Least common multiple; zero if either argument is zero.
   *
   * @throws IllegalArgumentException if the result does not fit in a {@code long}
   */
  public static long lcm(long a, long b) {
    if (a == 0 || b == 0) {
      return 0;
    }
    try {
      return Math.absExact(Math.multiplyExact(a / gcd(a, b), b));
    } catch (ArithmeticException e) {
      throw new IllegalArgumentException(
          "LCM of " + a + " and " + b + " does not fit in a 64-bit integer", e);
    }
  }

  private static void requireNonEmpty(double[] values, String what) {
    if (values == null || values.length == 0) {
      throw new IllegalArgumentException("Cannot compute " + what + " of an empty list");
    }
  }
}
