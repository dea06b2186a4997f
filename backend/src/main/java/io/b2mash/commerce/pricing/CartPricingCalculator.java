package io.b2mash.commerce.pricing;

import io.b2mash.commerce.catalog.StoreItem;
import io.b2mash.commerce.exception.CartValidationException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Turns cart lines into a priced summary. Pure: no repository access, the current instant is
 * passed in.
 *
 * <p>A global discount, when it applies to the base subtotal, replaces every line discount. Its
 * amount is spread over the lines in proportion to their base totals, so line discounts always add
 * up to the global discount.
 */
@Component
public class CartPricingCalculator {

  private static final BigDecimal CENT = new BigDecimal("0.01");

  public CartSummary summarize(
      List<PricingLine> lines, GlobalDiscount globalDiscount, Instant now) {
    validate(lines);

    var items = lines.stream().map(PricingLine::item).toList();
    var baseTotals = new ArrayList<BigDecimal>(lines.size());
    var baseSubtotal = Money.zero();
    for (var line : lines) {
      var baseTotal =
          Money.round(line.item().getPrice().multiply(BigDecimal.valueOf(line.quantity())));
      baseTotals.add(baseTotal);
      baseSubtotal = baseSubtotal.add(baseTotal);
    }

    var discount = globalDiscount == null ? GlobalDiscount.none() : globalDiscount;
    List<BigDecimal> lineDiscounts =
        discount.appliesTo(baseSubtotal)
            ? distribute(discount.rule().discountOn(baseSubtotal), baseTotals, baseSubtotal)
            : lineDiscounts(lines, baseTotals, now);

    var priced = new ArrayList<PricedLine>(lines.size());
    var total = Money.zero();
    for (int i = 0; i < lines.size(); i++) {
      var line = lines.get(i);
      StoreItem item = items.get(i);
      var lineTotal = Money.round(baseTotals.get(i).subtract(lineDiscounts.get(i)));
      total = total.add(lineTotal);
      priced.add(
          new PricedLine(
              item.getId(),
              item.getName(),
              line.quantity(),
              Money.round(item.getPrice()),
              baseTotals.get(i),
              lineDiscounts.get(i),
              lineTotal,
              item.isPreOrderEnabled(),
              item.getWeightGrams()));
    }

    boolean globalApplied = discount.appliesTo(baseSubtotal);
    return new CartSummary(
        priced,
        baseSubtotal,
        Money.round(baseSubtotal.subtract(total)),
        total,
        globalApplied,
        globalApplied ? discount.label() : null);
  }

  private void validate(List<PricingLine> lines) {
    var reasons = new ArrayList<String>();
    for (var line : lines) {
      var item = line.item();
      if (item == null) {
        reasons.add("Product " + line.productId() + " is no longer available");
      } else if (!item.isPublished()) {
        reasons.add(item.getName() + " is not available for purchase");
      } else if (!item.isPreOrderEnabled() && item.getStock() < line.quantity()) {
        reasons.add(
            item.getName()
                + " has only "
                + Math.max(item.getStock(), 0)
                + " left in stock, "
                + line.quantity()
                + " requested");
      }
    }
    if (lines.size() > 1) {
      lines.stream()
          .map(PricingLine::item)
          .filter(item -> item != null && item.isPreOrderEnabled())
          .forEach(
              item ->
                  reasons.add("Pre-order item " + item.getName() + " must be checked out alone"));
    }
    if (!reasons.isEmpty()) {
      throw new CartValidationException(reasons);
    }
  }

  private List<BigDecimal> lineDiscounts(
      List<PricingLine> lines, List<BigDecimal> baseTotals, Instant now) {
    var discounts = new ArrayList<BigDecimal>(lines.size());
    for (int i = 0; i < lines.size(); i++) {
      var item = lines.get(i).item();
      if (!lineDiscountActive(item, now)) {
        discounts.add(Money.zero());
        continue;
      }
      var unitPrice =
          new DiscountRule(item.getDiscountType(), item.getDiscountValue())
              .applyTo(item.getPrice());
      var lineTotal = Money.round(unitPrice.multiply(BigDecimal.valueOf(lines.get(i).quantity())));
      discounts.add(Money.round(baseTotals.get(i).subtract(lineTotal)));
    }
    return discounts;
  }

  static boolean lineDiscountActive(StoreItem item, Instant now) {
    if (!item.isDiscountActive() || item.getDiscountValue() == null) {
      return false;
    }
    if (item.getDiscountStart() != null && now.isBefore(item.getDiscountStart())) {
      return false;
    }
    return item.getDiscountEnd() == null || !now.isAfter(item.getDiscountEnd());
  }

  /**
   * Rounds each proportional share down, then hands the leftover cents to the largest lines that
   * can still take them. A share never exceeds its line's base total and never goes negative.
   */
  static List<BigDecimal> distribute(
      BigDecimal discountTotal, List<BigDecimal> baseTotals, BigDecimal baseSubtotal) {
    var shares = new ArrayList<BigDecimal>(baseTotals.size());
    var allocated = Money.zero();
    for (var baseTotal : baseTotals) {
      var share =
          baseSubtotal.signum() == 0
              ? Money.zero()
              : discountTotal
                  .multiply(baseTotal)
                  .divide(baseSubtotal, Money.SCALE, RoundingMode.DOWN);
      shares.add(share);
      allocated = allocated.add(share);
    }

    var byLargest = new ArrayList<Integer>(baseTotals.size());
    for (int i = 0; i < baseTotals.size(); i++) {
      byLargest.add(i);
    }
    byLargest.sort(Comparator.comparing(baseTotals::get, Comparator.reverseOrder()));

    var remaining = discountTotal.subtract(allocated);
    boolean progressed = true;
    while (remaining.signum() > 0 && progressed) {
      progressed = false;
      for (int i : byLargest) {
        if (remaining.signum() <= 0) {
          break;
        }
        var widened = shares.get(i).add(CENT);
        if (widened.compareTo(baseTotals.get(i)) <= 0) {
          shares.set(i, widened);
          remaining = remaining.subtract(CENT);
          progressed = true;
        }
      }
    }
    return shares;
  }
}
