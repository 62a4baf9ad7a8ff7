package io.calcshell.core.convert;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Linear unit families. Each unit is stored as its factor relative to the family's base unit
 * (metre, gram, byte, second, square metre).
 */
public enum UnitCategory {
  LENGTH(
      "m",
      units(
          "mm", 0.001, "cm", 0.01, "m", 1, "km", 1000, "in", 0.0254, "ft", 0.3048, "yd", 0.9144,
          "mi", 1609.344)),
  WEIGHT(
      "g",
      units("mg", 0.001, "g", 1, "kg", 1000, "ton", 1_000_000, "oz", 28.3495, "lb", 453.592)),
  DATA(
      "b",
      units(
          "b", 1, "kb", 1024, "mb", Math.pow(1024, 2), "gb", Math.pow(1024, 3), "tb",
          Math.pow(1024, 4))),
  TIME(
      "s",
      units(
          "ms", 0.001, "s", 1, "min", 60, "h", 3600, "day", 86400, "week", 604800, "year",
          31536000)),
  AREA(
      "m2",
      units(
          "mm2", 0.000001, "cm2", 0.0001, "m2", 1, "km2", 1_000_000, "pyeong", 3.305785, "acre",
          4046.86, "ha", 10000));

  private final String baseUnit;
  private final Map<String, Double> factors;

  UnitCategory(String baseUnit, Map<String, Double> factors) {
    this.baseUnit = baseUnit;
    this.factors = factors;
  }

  public String baseUnit() {
    return baseUnit;
  }

  /** Unit symbol to base-unit factor, in declaration order. */
  public Map<String, Double> factors() {
    return factors;
  }

  public boolean supports(String unit) {
    return factors.containsKey(unit.toLowerCase(Locale.ROOT));
  }

  /**
   * Resolves a category by name, ignoring case.
   *
   * @throws IllegalArgumentException if no category has this name
   */
  public static UnitCategory fromName(String name) {
    for (UnitCategory c : values()) {
      if (c.name().equalsIgnoreCase(name)) {
        return c;
      }
    }
    throw new IllegalArgumentException(
        "Unknown unit type: " + name + ". Supported: " + supportedNames());
  }

  public static String supportedNames() {
    StringBuilder sb = new StringBuilder();
    for (UnitCategory c : values()) {
      if (sb.length() > 0) sb.append(", ");
      sb.append(c.name().toLowerCase(Locale.ROOT));
    }
    return sb.toString();
  }

  private static Map<String, Double> units(Object... pairs) {
    Map<String, Double> m = new LinkedHashMap<>();
    for (int i = 0; i < pairs.length; i += 2) {
      m.put((String) pairs[i], ((Number) pairs[i + 1]).doubleValue());
    }
    return Collections.unmodifiableMap(m);
  }
}
