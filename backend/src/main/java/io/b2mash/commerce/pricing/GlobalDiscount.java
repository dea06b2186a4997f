package io.b2mash.commerce.pricing;

import io.b2mash.commerce.catalog.DiscountType;
import java.math.BigDecimal;

/** Store-wide discount. When it applies, line-level discounts are ignored for the whole cart. */
public record GlobalDiscount(
    boolean active, DiscountType type, BigDecimal value, BigDecimal minOrderTotal, String label) {

  public static GlobalDiscount none() {
    return new GlobalDiscount(false, DiscountType.NONE, BigDecimal.ZERO, BigDecimal.ZERO, null);
  }

  public boolean appliesTo(BigDecimal baseSubtotal) {
    if (!active || type == null || type == DiscountType.NONE || baseSubtotal.signum() <= 0) {
      return false;
    }
    return minOrderTotal == null || baseSubtotal.compareTo(minOrderTotal) >= 0;
  }

  public DiscountRule rule() {
    return new DiscountRule(type, value);
  }
}
