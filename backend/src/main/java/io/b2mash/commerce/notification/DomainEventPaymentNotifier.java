package io.b2mash.commerce.notification;

import io.b2mash.commerce.event.OrderPaymentConfirmedEvent;
import io.b2mash.commerce.event.PaymentStatusChangedEvent;
import io.b2mash.commerce.reconciliation.PaymentNotifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/** Publishes payment side effects as domain events; listeners run after commit. */
@Component
public class DomainEventPaymentNotifier implements PaymentNotifier {

  private final ApplicationEventPublisher eventPublisher;

  public DomainEventPaymentNotifier(ApplicationEventPublisher eventPublisher) {
    this.eventPublisher = eventPublisher;
  }

  @Override
  public void paymentStatusChanged(PaymentStatusChangedEvent event) {
    eventPublisher.publishEvent(event);
  }

  @Override
  public void orderPaymentConfirmed(OrderPaymentConfirmedEvent event) {
    eventPublisher.publishEvent(event);
  }
}
