package io.b2mash.commerce.pricing;

import java.math.BigDecimal;
import java.math.RoundingMode;

/** Monetary rounding shared by pricing, checkout and provider adapters. */
public final class Money {

  public static final int SCALE = 2;

  private Money() {}

  public static BigDecimal round(BigDecimal amount) {
    return amount.setScale(SCALE, RoundingMode.HALF_UP);
  }

  public static BigDecimal zero() {
    return BigDecimal.ZERO.setScale(SCALE);
  }
}
