package io.calcshell.shell;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Tests for one-shot command-line mode: {@code calc <expression>} and the tool subcommands.
 */
class MainTest {

  private ByteArrayOutputStream outContent;
  private ByteArrayOutputStream errContent;
  private PrintStream originalOut;
  private PrintStream originalErr;

  @BeforeEach
  void setUp() {
    outContent = new ByteArrayOutputStream();
    errContent = new ByteArrayOutputStream();
    originalOut = System.out;
    originalErr = System.err;
    System.setOut(new PrintStream(outContent));
    System.setErr(new PrintStream(errContent));
  }

  @AfterEach
  void tearDown() {
    System.setOut(originalOut);
    System.setErr(originalErr);
  }

  private int execute(String... args) {
    return Main.newCommandLine().execute(args);
  }

  private String getOutput() {
    return outContent.toString().trim();
  }

  private String getError() {
    return errContent.toString();
  }

  // ==================== Expression Tests ====================

  @Test
  void evaluatesSingleArgument() {
    assertEquals(0, execute("2 + 3 * 4"));
    assertEquals("14", getOutput());
  }

  @Test
  void joinsSeparateWords() {
    assertEquals(0, execute("(2", "+", "3)", "*", "4"));
    assertEquals("20", getOutput());
  }

  @Test
  void leadingMinusIsNotAnOption() {
    assertEquals(0, execute("-2^2"));
    assertEquals("-4", getOutput());
  }

  @Test
  void leadingMinusBeforeConstant() {
    assertEquals(0, execute("-pi", "*", "0"));
    assertEquals("0", getOutput());
  }

  @Test
  void errorExitsWithOne() {
    assertEquals(1, execute("5/0"));
    assertEquals("", getOutput());
    assertTrue(getError().contains("Error: Division by zero"));
  }

  @Test
  void parseErrorShowsPosition() {
    assertEquals(1, execute("foo(1)"));
    assertTrue(getError().contains("Unknown identifier 'foo' at position 0"));
  }

  @Test
  void deeplyNestedExpressionFailsCleanly() {
    String deep = "(".repeat(3000) + "1" + ")".repeat(3000);
    assertEquals(1, execute(deep));
    assertEquals("", getOutput());
    assertTrue(getError().contains("Error: Expression nested too deeply"));
    assertFalse(getError().contains("StackOverflowError"));
  }

  @Test
  void precisionOption() {
    assertEquals(0, execute("--precision", "2", "1/3"));
    assertEquals("0.33", getOutput());
  }

  @Test
  void negativePrecisionIsRejected() {
    assertNotEquals(0, execute("--precision", "-1", "1/3"));
    assertTrue(getError().contains("precision"));
  }

  @Test
  void jsonFormat() throws Exception {
    assertEquals(0, execute("--format", "JSON", "sqrt(16)"));
    JsonNode node = new ObjectMapper().readTree(getOutput());
    assertEquals(4.0, node.get("result").asDouble());
    assertEquals("sqrt(16)", node.get("expression").asText());
  }

  @Test
  void maxLengthOption() {
    assertEquals(1, execute("--max-length", "3", "1+2+3"));
    assertTrue(getError().contains("Expression too long"));
  }

  @Test
  void helpOption() {
    assertEquals(0, execute("--help"));
    assertTrue(getOutput().contains("calc"));
    assertTrue(getOutput().contains("convert"));
  }

  // ==================== Subcommand Tests ====================

  @Test
  void convertCommand() {
    assertEquals(0, execute("convert", "1", "km", "m", "length"));
    assertEquals("1 km = 1000 m", getOutput());
  }

  @Test
  void convertRejectsUnknownType() {
    assertEquals(1, execute("convert", "1", "km", "m", "volume"));
    assertTrue(getError().contains("Error: Unknown unit type: volume"));
  }

  @Test
  void convertRejectsUnknownUnit() {
    assertEquals(1, execute("convert", "1", "km", "parsec", "length"));
    assertTrue(getError().contains("Supported: mm, cm, m, km"));
  }

  @Test
  void tempCommand() {
    assertEquals(0, execute("temp", "100", "c", "f"));
    assertTrue(getOutput().contains("212.00"));
  }

  @Test
  void loanCommand() {
    assertEquals(0, execute("loan", "100000", "0.05", "30"));
    String out = getOutput();
    assertTrue(out.contains("Monthly payment:"));
    assertTrue(out.contains("536.82"));
    assertTrue(out.contains("100,000.00"));
    assertTrue(out.contains("Total interest:"));
  }

  @Test
  void loanRejectsZeroYears() {
    assertEquals(1, execute("loan", "1000", "0.05", "0"));
    assertTrue(getError().startsWith("Error: years must be positive"));
  }

  @Test
  void compoundCommand() {
    assertEquals(0, execute("compound", "1000", "0.05", "10"));
    assertTrue(getOutput().contains("1,647.01"));
  }

  @Test
  void compoundWithPeriods() {
    assertEquals(0, execute("compound", "1000", "0.05", "10", "--periods", "1"));
    assertTrue(getOutput().contains("1,628.89"));
  }

  @Test
  void statsCommand() {
    assertEquals(0, execute("stats", "1", "2", "3", "4"));
    String out = getOutput();
    assertTrue(out.contains("Count:"));
    assertTrue(out.contains("2.5"));
    assertTrue(out.contains("1.291"));
  }

  @Test
  void statsSingleValueOmitsDeviation() {
    assertEquals(0, execute("stats", "5"));
    assertFalse(getOutput().contains("Std deviation"));
  }

  @Test
  void statsWithoutNumbersFails() {
    assertEquals(1, execute("stats"));
    assertTrue(getError().contains("empty list"));
  }

  @Test
  void gcdAndLcm() {
    assertEquals(0, execute("gcd", "12", "18"));
    assertEquals("GCD(12, 18) = 6", getOutput());
    outContent.reset();
    assertEquals(0, execute("lcm", "4", "6"));
    assertEquals("LCM(4, 6) = 12", getOutput());
  }

  @Test
  void lcmOverflowFails() {
    assertEquals(1, execute("lcm", "4000000000", "3000000001"));
    assertEquals("", getOutput());
    assertTrue(getError().startsWith("Error: LCM of 4000000000 and 3000000001"));
  }
}
