package ca.gc.cra.seb.domain.util;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * <strong>What:</strong> Renders doubles the way ECMAScript {@code Number.prototype.toString} does.
 * <p><strong>Why:</strong> Config Keys computed here must match keys computed by existing JavaScript tooling
 * byte for byte, so {@code 1.0} renders as {@code 1} and {@code 1e21} as {@code 1e+21}.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @implNote Digits are the shortest decimal that parses back to the same double, found by rounding the exact binary
 * value half-even at increasing precision. {@link Double#toString(double)} is not used because it can emit extra
 * digits before JDK 19.
 * @since 0.1.0
 */
public final class NumberText {
  private static final int MAX_PLAIN_EXPONENT = 21;
  private static final int MIN_PLAIN_EXPONENT = -6;
  private static final int MAX_SIGNIFICANT_DIGITS = 17;

  private NumberText() {}

  /**
   * Formats a double using ECMAScript rules.
   *
   * @param value number to format
   * @return textual form, e.g. {@code 0.5}, {@code 42}, {@code 1e-7}, {@code NaN}, {@code -Infinity}
   */
  public static String format(double value) {
    if (Double.isNaN(value)) {
      return "NaN";
    }
    if (Double.isInfinite(value)) {
      return value > 0 ? "Infinity" : "-Infinity";
    }
    if (value == 0.0d) {
      return "0";
    }
    BigDecimal decimal = shortestDecimal(Math.abs(value));
    String digits = decimal.unscaledValue().toString();
    int k = digits.length();
    int n = k - decimal.scale();

    StringBuilder out = new StringBuilder(k + 8);
    if (value < 0) {
      out.append('-');
    }
    if (k <= n && n <= MAX_PLAIN_EXPONENT) {
      out.append(digits);
      out.append("0".repeat(n - k));
    } else if (0 < n && n <= MAX_PLAIN_EXPONENT) {
      out.append(digits, 0, n).append('.').append(digits, n, k);
    } else if (MIN_PLAIN_EXPONENT < n && n <= 0) {
      out.append("0.").append("0".repeat(-n)).append(digits);
    } else {
      int exponent = n - 1;
      out.append(digits.charAt(0));
      if (k > 1) {
        out.append('.').append(digits, 1, k);
      }
      out.append('e').append(exponent >= 0 ? '+' : '-').append(Math.abs(exponent));
    }
    return out.toString();
  }

  static BigDecimal shortestDecimal(double magnitude) {
    BigDecimal exact = new BigDecimal(magnitude);
    for (int precision = 1; precision < MAX_SIGNIFICANT_DIGITS; precision++) {
      BigDecimal candidate = exact.round(new MathContext(precision, RoundingMode.HALF_EVEN));
      if (Double.parseDouble(candidate.toString()) == magnitude) {
        return candidate.stripTrailingZeros();
      }
    }
    return exact.round(new MathContext(MAX_SIGNIFICANT_DIGITS, RoundingMode.HALF_EVEN)).stripTrailingZeros();
  }
}
