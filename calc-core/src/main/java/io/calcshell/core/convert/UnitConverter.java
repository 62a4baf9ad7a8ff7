package io.calcshell.core.convert;

import java.util.Locale;

/** Converts values between units of the same {@link UnitCategory}, and between temperatures. */
public final class UnitConverter {

  private UnitConverter() {}

  /**
   * Converts a value through the category's base unit.
   *
   * @param value the value in {@code from} units
   * @param from source unit, case-insensitive
   * @param to target unit, case-insensitive
   * @param category unit family both units belong to
   * @return the value in {@code to} units
   * @throws IllegalArgumentException if either unit is not part of the category
   */
  public static double convert(double value, String from, String to, UnitCategory category) {
    double fromFactor = factor(from, category);
    double toFactor = factor(to, category);
    return value * fromFactor / toFactor;
  }

  /**
   * Converts between Celsius ({@code c}), Fahrenheit ({@code f}) and Kelvin ({@code k}).
   *
   * @throws IllegalArgumentException for any other unit
   */
  public static double convertTemperature(double value, String from, String to) {
    double celsius =
        switch (normalizeTemp(from)) {
          case "c" -> value;
          case "f" -> (value - 32) * 5 / 9;
          default -> value - 273.15;
        };
    return switch (normalizeTemp(to)) {
      case "c" -> celsius;
      case "f" -> celsius * 9 / 5 + 32;
      default -> celsius + 273.15;
    };
  }

  /** Display symbol for a temperature unit, e.g. {@code °C}. */
  public static String temperatureSymbol(String unit) {
    return switch (normalizeTemp(unit)) {
      case "c" -> "°C";
      case "f" -> "°F";
      default -> "K";
    };
  }

  private static double factor(String unit, UnitCategory category) {
    Double f = category.factors().get(unit.toLowerCase(Locale.ROOT));
    if (f == null) {
      throw new IllegalArgumentException(
          "Unknown "
              + category.name().toLowerCase(Locale.ROOT)
              + " unit: "
              + unit
              + ". Supported: "
              + String.join(", ", category.factors().keySet()));
    }
    return f;
  }

  private static String normalizeTemp(String unit) {
    String u = unit.toLowerCase(Locale.ROOT);
    if (!u.equals("c") && !u.equals("f") && !u.equals("k")) {
      throw new IllegalArgumentException(
          "Unknown temperature unit: "
              + unit
              + ". Supported: c (Celsius), f (Fahrenheit), k (Kelvin)");
    }
    return u;
  }
}
