package io.b2mash.commerce.pricing;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.UUID;

public record PricedLine(
    UUID productId,
    String name,
    int quantity,
    BigDecimal baseUnitPrice,
    BigDecimal baseTotal,
    BigDecimal discountAmount,
    BigDecimal lineTotal,
    boolean preOrder,
    Integer weightGrams) {

  /** Effective unit price after discounts, used for order item snapshots. */
  public BigDecimal unitPrice() {
    return lineTotal.divide(BigDecimal.valueOf(quantity), Money.SCALE, RoundingMode.HALF_UP);
  }
}
