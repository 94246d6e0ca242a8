package com.cario.valuation.app.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/** Rounding for reported amounts and percentages. */
public final class Money {

  private Money() {}

  /** Half-up to two decimals. */
  public static double round2(double value) {
    return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
  }

  public static Double round2(Double value) {
    return value == null ? null : round2(value.doubleValue());
  }

  /** Fraction to percent, two decimals: {@code 0.355 -> 35.5}. */
  public static double percent(double fraction) {
    return round2(fraction * 100);
  }
}
