package io.b2mash.commerce.subscription;

import io.b2mash.commerce.payment.PaymentStatus;
import java.time.Instant;
import java.util.UUID;

public record SubscriptionView(
    String id,
    UUID planId,
    String planName,
    PaymentStatus status,
    Instant startDate,
    Instant endDate,
    int billingCycle,
    boolean autoRenew,
    UUID paymentId) {

  public static SubscriptionView from(Subscription subscription, String planName) {
    return new SubscriptionView(
        subscription.getId(),
        subscription.getPlanId(),
        planName,
        subscription.getStatus(),
        subscription.getStartDate(),
        subscription.getEndDate(),
        subscription.getBillingCycle(),
        subscription.isAutoRenew(),
        subscription.getPaymentId());
  }
}
