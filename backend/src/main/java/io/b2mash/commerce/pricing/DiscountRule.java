package io.b2mash.commerce.pricing;

import io.b2mash.commerce.catalog.DiscountType;
import java.math.BigDecimal;

/**
 * A discount of a given type and value. Percentages are capped at 100 and flat amounts at the
 * amount being discounted, so a discounted amount is never negative.
 */
public record DiscountRule(DiscountType type, BigDecimal value) {

  private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

  public DiscountRule {
    type = type == null ? DiscountType.NONE : type;
    value = value == null || value.signum() < 0 ? BigDecimal.ZERO : value;
  }

  /** The amount taken off {@code amount}, rounded to 2 decimals. */
  public BigDecimal discountOn(BigDecimal amount) {
    return switch (type) {
      case NONE -> Money.zero();
      case PERCENTAGE -> {
        var percent = value.min(HUNDRED);
        yield Money.round(amount.multiply(percent).divide(HUNDRED));
      }
      case FLAT -> Money.round(value.min(amount));
    };
  }

  /** {@code amount} after the discount, never below zero. */
  public BigDecimal applyTo(BigDecimal amount) {
    var discounted = Money.round(amount.subtract(discountOn(amount)));
    return discounted.signum() < 0 ? Money.zero() : discounted;
  }
}
