package io.calcshell.core.convert;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class UnitConverterTest {

  private static final double EPS = 1e-9;

  // ==================== Linear units ====================

  @Test
  void convertsLength() {
    assertEquals(1000.0, UnitConverter.convert(1, "km", "m", UnitCategory.LENGTH), EPS);
    assertEquals(1.609344, UnitConverter.convert(1, "mi", "km", UnitCategory.LENGTH), EPS);
    assertEquals(12.0, UnitConverter.convert(1, "ft", "in", UnitCategory.LENGTH), EPS);
  }

  @Test
  void convertsWeightDataTimeAndArea() {
    assertEquals(2.0, UnitConverter.convert(2000, "g", "kg", UnitCategory.WEIGHT), EPS);
    assertEquals(1.0, UnitConverter.convert(1024, "kb", "mb", UnitCategory.DATA), EPS);
    assertEquals(120.0, UnitConverter.convert(2, "h", "min", UnitCategory.TIME), EPS);
    assertEquals(1.0, UnitConverter.convert(10000, "m2", "ha", UnitCategory.AREA), EPS);
  }

  @Test
  void unitNamesAreCaseInsensitive() {
    assertEquals(1000.0, UnitConverter.convert(1, "KM", "M", UnitCategory.LENGTH), EPS);
  }

  @Test
  void sameUnitIsIdentity() {
    assertEquals(42.0, UnitConverter.convert(42, "lb", "lb", UnitCategory.WEIGHT), EPS);
  }

  @Test
  void unknownUnitListsSupportedUnits() {
    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () -> UnitConverter.convert(1, "parsec", "m", UnitCategory.LENGTH));
    assertTrue(e.getMessage().contains("Unknown length unit: parsec"));
    assertTrue(e.getMessage().contains("mm, cm, m, km, in, ft, yd, mi"));
  }

  @Test
  void unitFromOtherCategoryIsRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () -> UnitConverter.convert(1, "kg", "m", UnitCategory.LENGTH));
  }

  // ==================== Categories ====================

  @Test
  void categoryFromName() {
    assertEquals(UnitCategory.LENGTH, UnitCategory.fromName("Length"));
    assertEquals("m2", UnitCategory.fromName("area").baseUnit());
    assertTrue(UnitCategory.DATA.supports("GB"));
    IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class, () -> UnitCategory.fromName("volume"));
    assertTrue(e.getMessage().contains("length, weight, data, time, area"));
  }

  // ==================== Temperature ====================

  @Test
  void convertsTemperature() {
    assertEquals(212.0, UnitConverter.convertTemperature(100, "c", "f"), EPS);
    assertEquals(0.0, UnitConverter.convertTemperature(32, "F", "C"), EPS);
    assertEquals(273.15, UnitConverter.convertTemperature(0, "c", "k"), EPS);
    assertEquals(373.15, UnitConverter.convertTemperature(212, "f", "k"), EPS);
    assertEquals(-40.0, UnitConverter.convertTemperature(-40, "c", "f"), EPS);
  }

  @Test
  void unknownTemperatureUnit() {
    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class, () -> UnitConverter.convertTemperature(1, "r", "c"));
    assertTrue(e.getMessage().contains("c (Celsius), f (Fahrenheit), k (Kelvin)"));
  }

  @Test
  void temperatureSymbols() {
    assertEquals("K", UnitConverter.temperatureSymbol("k"));
    assertTrue(UnitConverter.temperatureSymbol("C").endsWith("C"));
  }
}
