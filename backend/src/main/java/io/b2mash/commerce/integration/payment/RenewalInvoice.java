package io.b2mash.commerce.integration.payment;

import java.math.BigDecimal;
import java.time.Instant;

/** Details of a recurring invoice event, used to append the next subscription billing cycle. */
public record RenewalInvoice(
    String invoiceId,
    String providerSubscriptionId,
    String billingReason,
    Instant periodStart,
    Instant periodEnd,
    BigDecimal amountPaid,
    String currency) {

  /** Invoices raised for a new cycle, as opposed to the first invoice of a new subscription. */
  public boolean isCycleRenewal() {
    return "subscription_cycle".equals(billingReason);
  }
}
