package io.calcshell.shell;

import io.calcshell.core.expr.ExpressionEngine;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Calculator settings resolved from JVM system properties. Command-line options override them.
 *
 * <ul>
 *   <li>{@code calc.maxLength}: input length cap (default 10000, negative disables)
 *   <li>{@code calc.precision}: fixed decimal places for results (default: automatic)
 *   <li>{@code calc.home}: directory for the REPL history (default {@code ~/.calc-shell})
 * </ul>
 */
public final class ShellSettings {

  private static final Logger LOG = LoggerFactory.getLogger(ShellSettings.class);

  public static final String MAX_LENGTH_PROPERTY = "calc.maxLength";
  public static final String PRECISION_PROPERTY = "calc.precision";
  public static final String HOME_PROPERTY = "calc.home";

  private final int maxLength;
  private final Integer precision;
  private final Path home;

  ShellSettings(int maxLength, Integer precision, Path home) {
    this.maxLength = maxLength;
    this.precision = precision;
    this.home = home;
  }

  public static ShellSettings fromSystemProperties() {
    return from(System.getProperties());
  }

  static ShellSettings from(Properties props) {
    int maxLength = parseInt(props, MAX_LENGTH_PROPERTY, ExpressionEngine.DEFAULT_MAX_LENGTH);
    Integer precision = null;
    if (props.getProperty(PRECISION_PROPERTY) != null) {
      int p = parseInt(props, PRECISION_PROPERTY, -1);
      precision = p >= 0 ? p : null;
    }
    String homeProp = props.getProperty(HOME_PROPERTY);
    Path home =
        homeProp != null && !homeProp.isBlank()
            ? Paths.get(homeProp)
            : Paths.get(props.getProperty("user.home", "."), ".calc-shell");
    return new ShellSettings(maxLength, precision, home);
  }

  private static int parseInt(Properties props, String key, int fallback) {
    String raw = props.getProperty(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException e) {
      LOG.warn("Ignoring non-numeric {}={}, using {}", key, raw, fallback);
      return fallback;
    }
  }

  public ShellSettings withMaxLength(Integer override) {
    return override == null ? this : new ShellSettings(override, precision, home);
  }

  public ShellSettings withPrecision(Integer override) {
    return override == null ? this : new ShellSettings(maxLength, override, home);
  }

  public int maxLength() {
    return maxLength;
  }

  /** Fixed decimal places, or {@code null} for automatic formatting. */
  public Integer precision() {
    return precision;
  }

  public Path home() {
    return home;
  }

  public Path historyFile() {
    return home.resolve("history");
  }
}
