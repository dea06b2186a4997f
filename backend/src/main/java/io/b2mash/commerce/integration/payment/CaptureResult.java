package io.b2mash.commerce.integration.payment;

import io.b2mash.commerce.payment.PaymentStatus;
import java.math.BigDecimal;

/**
 * A payment's state as read back from the processor. {@code providerSubscriptionId} is set for
 * recurring checkouts once the processor has created the subscription.
 */
public record CaptureResult(
    PaymentStatus status,
    String transactionId,
    BigDecimal capturedAmount,
    String providerSubscriptionId) {

  public CaptureResult(PaymentStatus status, String transactionId, BigDecimal capturedAmount) {
    this(status, transactionId, capturedAmount, null);
  }

  public static CaptureResult pending() {
    return new CaptureResult(PaymentStatus.PENDING, null, null);
  }
}
