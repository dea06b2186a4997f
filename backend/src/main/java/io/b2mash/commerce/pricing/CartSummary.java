package io.b2mash.commerce.pricing;

import java.math.BigDecimal;
import java.util.List;

public record CartSummary(
    List<PricedLine> lines,
    BigDecimal baseSubtotal,
    BigDecimal discountTotal,
    BigDecimal total,
    boolean globalDiscountApplied,
    String discountLabel) {

  public CartSummary {
    lines = List.copyOf(lines);
  }

  public boolean preOrder() {
    return lines.stream().anyMatch(PricedLine::preOrder);
  }
}
