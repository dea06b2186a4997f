package io.b2mash.commerce.reconciliation;

import io.b2mash.commerce.event.OrderPaymentConfirmedEvent;
import io.b2mash.commerce.event.PaymentStatusChangedEvent;

/**
 * Outbound port for side effects of a payment transition. Called inside the reconciliation
 * transaction; implementations must not deliver anything before that transaction commits.
 */
public interface PaymentNotifier {

  void paymentStatusChanged(PaymentStatusChangedEvent event);

  void orderPaymentConfirmed(OrderPaymentConfirmedEvent event);
}
