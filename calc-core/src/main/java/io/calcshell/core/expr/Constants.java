package io.calcshell.core.expr;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/** Named constants available in expressions. Lookup is case-insensitive. */
public final class Constants {

  private static final Map<String, Double> VALUES = Map.of("pi", Math.PI, "e", Math.E);

  private Constants() {}

  public static boolean isConstant(String name) {
    return VALUES.containsKey(name.toLowerCase(Locale.ROOT));
  }

  /**
   * Returns the value of a constant.
   *
   * @param name constant name, any case
   * @return the value
   * @throws IllegalArgumentException if the name is not a constant
   */
  public static double valueOf(String name) {
    Double v = VALUES.get(name.toLowerCase(Locale.ROOT));
    if (v == null) {
      throw new IllegalArgumentException("Unknown constant: " + name);
    }
    return v;
  }

  public static Set<String> names() {
    return VALUES.keySet();
  }
}
