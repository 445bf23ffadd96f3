package com.geniebridge.relay.render;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Set;

/**
 * Formats one result cell by its column type tag. Shared by every renderer so plain and block
 * output never disagree on numbers.
 */
public final class CellFormatter {

  public static final String NULL_TEXT = "NULL";

  private static final Set<String> DECIMAL_TYPES = Set.of("DECIMAL", "DOUBLE", "FLOAT");
  private static final Set<String> INTEGER_TYPES = Set.of("INT", "BIGINT", "LONG");

  private CellFormatter() {}

  /**
   * {@code null} renders as {@code NULL}; decimal types as {@code 1,234,567.50}, rounded
   * half-even; integer types as {@code 1,234,567}; anything else, including unparseable numbers
   * and fractional values in integer columns, as its string form.
   */
  public static String format(Object value, String typeName) {
    if (value == null) {
      return NULL_TEXT;
    }
    String type = typeName == null ? "" : typeName.trim().toUpperCase(Locale.ROOT);
    if (DECIMAL_TYPES.contains(type)) {
      BigDecimal number = toDecimal(value);
      return number == null
          ? plain(value)
          : String.format(Locale.ROOT, "%,.2f", number.setScale(2, RoundingMode.HALF_EVEN));
    }
    if (INTEGER_TYPES.contains(type)) {
      BigInteger number = toInteger(value);
      return number == null ? plain(value) : String.format(Locale.ROOT, "%,d", number);
    }
    return plain(value);
  }

  private static BigDecimal toDecimal(Object value) {
    if (value instanceof BigDecimal decimal) {
      return decimal;
    }
    String text = value.toString().trim();
    if (text.isEmpty()) {
      return null;
    }
    try {
      return new BigDecimal(text);
    } catch (NumberFormatException e) {
      return null;
    }
  }

  /** {@code null} when the value is not a whole number; fractions are never dropped. */
  private static BigInteger toInteger(Object value) {
    if (value instanceof BigInteger integer) {
      return integer;
    }
    BigDecimal number = toDecimal(value);
    if (number == null) {
      return null;
    }
    try {
      return number.toBigIntegerExact();
    } catch (ArithmeticException e) {
      return null;
    }
  }

  private static String plain(Object value) {
    if (value instanceof BigDecimal decimal) {
      return decimal.toPlainString();
    }
    return String.valueOf(value);
  }
}
