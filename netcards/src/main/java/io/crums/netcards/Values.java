/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.netcards;


import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Locale;

/**
 * Entry value normalization and number formatting. Entry values are either
 * strings or numbers; numbers are normalized to {@code Long} (integral) or
 * {@code Double} (everything else).
 */
public class Values {

  /**
   * Sentinel for statistics that are undefined on the given graph.
   */
  public final static String NOT_APPLICABLE = "n/a";

  // only a namespace
  private Values() {  }


  /**
   * Returns the normalized form of the given entry value.
   *
   * @param value a {@code String} or {@code Number}
   * @throws IllegalArgumentException if {@code value} is null or some other type
   */
  public static Object normalize(Object value) throws IllegalArgumentException {
    if (value instanceof String)
      return value;
    if (value instanceof Long)
      return value;
    if (value instanceof Integer || value instanceof Short || value instanceof Byte)
      return ((Number) value).longValue();
    if (value instanceof Double)
      return value;
    if (value instanceof Float f)
      return f.doubleValue();
    if (value instanceof Number n)
      return n.doubleValue();
    if (value == null)
      throw new IllegalArgumentException("null value");
    throw new IllegalArgumentException(
        "unsupported value type " + value.getClass().getName() + ": " + value);
  }


  public static boolean isFloating(Object value) {
    return value instanceof Double || value instanceof Float;
  }


  /**
   * Returns the value as text. Floating point values are formatted in the
   * {@code %g} style with the given number of significant digits; everything
   * else uses {@code toString()}.
   */
  public static String toText(Object value, int significantDigits) {
    if (isFloating(value))
      return formatG(((Number) value).doubleValue(), significantDigits);
    return String.valueOf(value);
  }


  /**
   * Returns the value as text, floating point values with a fixed number of
   * decimal places.
   */
  public static String toFixedText(Object value, int decimals) {
    if (isFloating(value)) {
      double d = ((Number) value).doubleValue();
      if (!Double.isFinite(d))
        return formatG(d, 1);
      return new BigDecimal(d).setScale(decimals, RoundingMode.HALF_EVEN).toPlainString();
    }
    return String.valueOf(value);
  }


  /**
   * Formats the given number as a percentage with the given number of
   * decimal places. E.g. {@code percent(0.75, 2)} returns "75.00%".
   */
  public static String percent(double ratio, int decimals) {
    return new BigDecimal(ratio).multiply(BigDecimal.valueOf(100))
        .setScale(decimals, RoundingMode.HALF_EVEN).toPlainString() + "%";
  }


  /**
   * Rounds the given value to the given number of significant digits.
   */
  public static double roundSignificant(double value, int significantDigits) {
    if (!Double.isFinite(value) || value == 0)
      return value;
    return new BigDecimal(value)
        .round(new MathContext(significantDigits, RoundingMode.HALF_EVEN))
        .doubleValue();
  }


  /**
   * Formats the given value in the general ({@code %g}) style: the number is
   * rounded to {@code precision} significant digits, written in positional
   * notation if its decimal exponent is in the range [-4, precision), in
   * scientific notation otherwise, and trailing zeros are removed.
   *
   * <pre>
   *  formatG(0.5, 3)        = "0.5"
   *  formatG(1.4, 6)        = "1.4"
   *  formatG(33.3333, 3)    = "33.3"
   *  formatG(1234567.0, 6)  = "1.23457e+06"
   *  formatG(0.00001234, 3) = "1.23e-05"
   * </pre>
   *
   * @param precision &ge; 1 (zero is treated as 1)
   */
  public static String formatG(double value, int precision) {
    if (Double.isNaN(value))
      return "nan";
    if (Double.isInfinite(value))
      return value > 0 ? "inf" : "-inf";
    if (precision < 0)
      throw new IllegalArgumentException("precision: " + precision);
    if (precision == 0)
      precision = 1;
    if (value == 0)
      return "0";

    var rounded = new BigDecimal(value).round(new MathContext(precision, RoundingMode.HALF_EVEN));
    int exp = rounded.precision() - rounded.scale() - 1;

    if (exp >= -4 && exp < precision) {
      var fixed = rounded.setScale(Math.max(precision - 1 - exp, 0), RoundingMode.HALF_EVEN);
      return stripZeros(fixed.toPlainString());
    }

    var mantissa = stripZeros(rounded.movePointLeft(exp).toPlainString());
    return String.format(Locale.ROOT, "%se%s%02d", mantissa, exp < 0 ? "-" : "+", Math.abs(exp));
  }


  private static String stripZeros(String decimal) {
    if (decimal.indexOf('.') == -1)
      return decimal;
    int end = decimal.length();
    while (decimal.charAt(end - 1) == '0')
      --end;
    if (decimal.charAt(end - 1) == '.')
      --end;
    return decimal.substring(0, end);
  }

}
