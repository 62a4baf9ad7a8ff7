package io.calcshell.shell;

import static org.junit.jupiter.api.Assertions.*;

import io.calcshell.core.expr.ExpressionEngine;
import java.nio.file.Paths;
import java.util.Properties;
import org.junit.jupiter.api.Test;

class ShellSettingsTest {

  private static Properties props(String... kv) {
    Properties p = new Properties();
    p.setProperty("user.home", "/home/tester");
    for (int i = 0; i < kv.length; i += 2) {
      p.setProperty(kv[i], kv[i + 1]);
    }
    return p;
  }

  @Test
  void defaults() {
    ShellSettings settings = ShellSettings.from(props());
    assertEquals(ExpressionEngine.DEFAULT_MAX_LENGTH, settings.maxLength());
    assertNull(settings.precision());
    assertEquals(Paths.get("/home/tester", ".calc-shell"), settings.home());
    assertEquals(Paths.get("/home/tester", ".calc-shell", "history"), settings.historyFile());
  }

  @Test
  void readsProperties() {
    ShellSettings settings =
        ShellSettings.from(
            props(
                ShellSettings.MAX_LENGTH_PROPERTY, "50",
                ShellSettings.PRECISION_PROPERTY, "4",
                ShellSettings.HOME_PROPERTY, "/tmp/calc"));
    assertEquals(50, settings.maxLength());
    assertEquals(4, settings.precision());
    assertEquals(Paths.get("/tmp/calc", "history"), settings.historyFile());
  }

  @Test
  void invalidValuesFallBackToDefaults() {
    ShellSettings settings =
        ShellSettings.from(
            props(
                ShellSettings.MAX_LENGTH_PROPERTY, "lots",
                ShellSettings.PRECISION_PROPERTY, "-3"));
    assertEquals(ExpressionEngine.DEFAULT_MAX_LENGTH, settings.maxLength());
    assertNull(settings.precision());
  }

  @Test
  void overridesReplaceOnlyWhenPresent() {
    ShellSettings base = ShellSettings.from(props(ShellSettings.MAX_LENGTH_PROPERTY, "50"));
    assertSame(base, base.withMaxLength(null));
    assertSame(base, base.withPrecision(null));
    assertEquals(-1, base.withMaxLength(-1).maxLength());
    ShellSettings fixed = base.withPrecision(2);
    assertEquals(2, fixed.precision());
    assertEquals(50, fixed.maxLength());
  }
}
