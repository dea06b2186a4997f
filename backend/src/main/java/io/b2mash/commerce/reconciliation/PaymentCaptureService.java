package io.b2mash.commerce.reconciliation;

import io.b2mash.commerce.exception.ResourceNotFoundException;
import io.b2mash.commerce.integration.payment.PaymentGatewayRegistry;
import io.b2mash.commerce.order.Order;
import io.b2mash.commerce.order.OrderRepository;
import io.b2mash.commerce.payment.Payment;
import io.b2mash.commerce.payment.PaymentRepository;
import io.b2mash.commerce.payment.PaymentStatus;
import io.b2mash.commerce.subscription.Subscription;
import io.b2mash.commerce.subscription.SubscriptionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Handles the customer's return from a hosted checkout. Capturing is safe to repeat: a payment that
 * already settled (for example through its webhook) is reported without calling the processor.
 */
@Service
public class PaymentCaptureService {

  private static final Logger log = LoggerFactory.getLogger(PaymentCaptureService.class);

  private final PaymentRepository paymentRepository;
  private final OrderRepository orderRepository;
  private final SubscriptionRepository subscriptionRepository;
  private final PaymentGatewayRegistry gatewayRegistry;
  private final PaymentReconciliationService reconciliationService;

  public PaymentCaptureService(
      PaymentRepository paymentRepository,
      OrderRepository orderRepository,
      SubscriptionRepository subscriptionRepository,
      PaymentGatewayRegistry gatewayRegistry,
      PaymentReconciliationService reconciliationService) {
    this.paymentRepository = paymentRepository;
    this.orderRepository = orderRepository;
    this.subscriptionRepository = subscriptionRepository;
    this.gatewayRegistry = gatewayRegistry;
    this.reconciliationService = reconciliationService;
  }

  public CaptureOutcome capture(String providerRef) {
    var payment = findByProviderRef(providerRef);
    var status = payment.getStatus();
    if (status == PaymentStatus.PENDING) {
      var result = gatewayRegistry.resolve(payment.getProvider()).capturePayment(providerRef);
      if (result.status() != PaymentStatus.PENDING) {
        var trigger = TransitionTrigger.capture(result);
        status =
            reconciliationService
                .applyTransition(payment.getId(), result.status(), trigger)
                .status();
      } else {
        log.info("Payment {} still pending after capture attempt", payment.getId());
      }
    }
    return new CaptureOutcome(
        payment.getId(),
        status,
        orderRepository.findByPaymentId(payment.getId()).map(Order::getId).stream().toList(),
        subscriptionRepository.findByPaymentId(payment.getId()).stream()
            .map(Subscription::getId)
            .toList());
  }

  /**
   * Handles the customer abandoning the hosted checkout. The processor has the final say: a
   * checkout it already settled is applied as reported, and the payment is only cancelled locally
   * once the processor has closed the session.
   */
  public ReconciliationOutcome cancel(String providerRef) {
    var payment = findByProviderRef(providerRef);
    if (payment.getStatus() != PaymentStatus.PENDING) {
      return ReconciliationOutcome.unchanged(
          payment.getId(), payment.getStatus(), "Payment already " + payment.getStatus());
    }
    var gateway = gatewayRegistry.resolve(payment.getProvider());
    var result = gateway.verifyPaymentStatus(providerRef);
    if (result.status() != PaymentStatus.PENDING) {
      return reconciliationService.applyTransition(
          payment.getId(), result.status(), TransitionTrigger.fallback(result));
    }
    if (!gateway.cancelSession(providerRef)) {
      log.warn(
          "Checkout {} is still open at the processor, payment {} left pending",
          providerRef,
          payment.getId());
      return ReconciliationOutcome.unchanged(
          payment.getId(), PaymentStatus.PENDING, "Checkout still open at processor");
    }
    return reconciliationService.applyTransition(
        payment.getId(), PaymentStatus.CANCELLED, TransitionTrigger.redirectCancel());
  }

  private Payment findByProviderRef(String providerRef) {
    return paymentRepository
        .findByProviderRef(providerRef)
        .orElseThrow(() -> new ResourceNotFoundException("Payment", providerRef));
  }
}
