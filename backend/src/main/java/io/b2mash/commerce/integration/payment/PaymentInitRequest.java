package io.b2mash.commerce.integration.payment;

import io.b2mash.commerce.payment.PaymentType;
import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Everything an adapter needs to open a checkout session. {@code orderId} is set for store
 * checkouts, {@code subscriptionId} (a correlation id generated before the processor assigns its
 * own) for subscriptions. {@code intervalDays} is the plan duration for recurring payments.
 */
public record PaymentInitRequest(
    UUID paymentId,
    PaymentType type,
    UUID userId,
    String customerEmail,
    UUID orderId,
    String subscriptionId,
    BigDecimal amount,
    String currency,
    String description,
    List<LineItem> lineItems,
    BigDecimal shippingCost,
    Integer intervalDays) {

  public PaymentInitRequest {
    lineItems = lineItems == null ? List.of() : List.copyOf(lineItems);
  }

  /** A priced line. {@code lineTotal} already includes quantity and discounts. */
  public record LineItem(String name, int quantity, BigDecimal lineTotal) {}

  public CorrelationMetadata correlation() {
    return new CorrelationMetadata(paymentId, orderId, subscriptionId, type.wireValue(), userId);
  }

  public String referenceId() {
    return orderId != null ? orderId.toString() : subscriptionId;
  }
}
