package io.b2mash.commerce.notification;

import io.b2mash.commerce.event.PaymentStatusChangedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

@Component
public class PaymentEmailListener {

  private static final Logger log = LoggerFactory.getLogger(PaymentEmailListener.class);

  private final PaymentEmailService paymentEmailService;

  public PaymentEmailListener(PaymentEmailService paymentEmailService) {
    this.paymentEmailService = paymentEmailService;
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onPaymentStatusChanged(PaymentStatusChangedEvent event) {
    if (!event.status().notifiesCustomer()) {
      return;
    }
    try {
      paymentEmailService.emailOnPaymentStatus(event);
    } catch (Exception e) {
      log.error("Failed to send payment status email for payment={}", event.entityId(), e);
    }
  }
}
