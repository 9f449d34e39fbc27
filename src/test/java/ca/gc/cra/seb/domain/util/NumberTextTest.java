package ca.gc.cra.seb.domain.util;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class NumberTextTest {

  @Test
  void integralDoublesHaveNoFraction() {
    assertEquals("42", NumberText.format(42.0));
    assertEquals("-3", NumberText.format(-3.0));
    assertEquals("0", NumberText.format(-0.0));
  }

  @Test
  void fractionsUseShortestDigits() {
    assertEquals("0.5", NumberText.format(0.5));
    assertEquals("0.1", NumberText.format(0.1));
    assertEquals("123456.789", NumberText.format(123456.789));
    assertEquals("0.000001", NumberText.format(0.000001));
  }

  @Test
  void largeIntegersDropDigitsBeyondShortestRoundTrip() {
    assertEquals("282879384806159000", NumberText.format(2.82879384806159E17));
    assertEquals("-282879384806159000", NumberText.format(-2.82879384806159E17));
    assertEquals("0.002", NumberText.format(0.002));
    assertEquals("5e-324", NumberText.format(Double.MIN_VALUE));
    assertEquals("1.7976931348623157e+308", NumberText.format(Double.MAX_VALUE));
  }

  @Test
  void extremeMagnitudesSwitchToExponentForm() {
    assertEquals("1e-7", NumberText.format(1e-7));
    assertEquals("1.5e-7", NumberText.format(1.5e-7));
    assertEquals("100000000000000000000", NumberText.format(1e20));
    assertEquals("1e+21", NumberText.format(1e21));
  }

  @Test
  void nonFiniteValuesUseEcmaScriptNames() {
    assertEquals("NaN", NumberText.format(Double.NaN));
    assertEquals("Infinity", NumberText.format(Double.POSITIVE_INFINITY));
    assertEquals("-Infinity", NumberText.format(Double.NEGATIVE_INFINITY));
  }
}
