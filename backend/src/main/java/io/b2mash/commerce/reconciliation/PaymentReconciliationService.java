package io.b2mash.commerce.reconciliation;

import io.b2mash.commerce.cart.CartItemRepository;
import io.b2mash.commerce.catalog.StoreItemRepository;
import io.b2mash.commerce.event.OrderPaymentConfirmedEvent;
import io.b2mash.commerce.event.PaymentStatusChangedEvent;
import io.b2mash.commerce.exception.InsufficientStockException;
import io.b2mash.commerce.exception.ResourceNotFoundException;
import io.b2mash.commerce.integration.payment.RenewalInvoice;
import io.b2mash.commerce.integration.payment.WebhookResult;
import io.b2mash.commerce.order.Order;
import io.b2mash.commerce.order.OrderItem;
import io.b2mash.commerce.order.OrderItemRepository;
import io.b2mash.commerce.order.OrderRepository;
import io.b2mash.commerce.order.OrderStatus;
import io.b2mash.commerce.order.PreOrderStatus;
import io.b2mash.commerce.payment.Payment;
import io.b2mash.commerce.payment.PaymentMetadata;
import io.b2mash.commerce.payment.PaymentRepository;
import io.b2mash.commerce.payment.PaymentStatus;
import io.b2mash.commerce.payment.ProviderBookkeeping;
import io.b2mash.commerce.subscription.Subscription;
import io.b2mash.commerce.subscription.SubscriptionRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Applies processor-reported payment outcomes to local state. Every entry point (webhook, capture
 * on return, fallback verification, checkout cancellation) funnels into {@link #applyTransition},
 * which locks the payment row so concurrent deliveries of the same outcome serialize and only the
 * first one records side effects.
 */
@Service
public class PaymentReconciliationService {

  private static final Logger log = LoggerFactory.getLogger(PaymentReconciliationService.class);

  private final PaymentRepository paymentRepository;
  private final OrderRepository orderRepository;
  private final OrderItemRepository orderItemRepository;
  private final StoreItemRepository storeItemRepository;
  private final CartItemRepository cartItemRepository;
  private final SubscriptionRepository subscriptionRepository;
  private final PaymentNotifier notifier;
  private final Clock clock;

  public PaymentReconciliationService(
      PaymentRepository paymentRepository,
      OrderRepository orderRepository,
      OrderItemRepository orderItemRepository,
      StoreItemRepository storeItemRepository,
      CartItemRepository cartItemRepository,
      SubscriptionRepository subscriptionRepository,
      PaymentNotifier notifier,
      Clock clock) {
    this.paymentRepository = paymentRepository;
    this.orderRepository = orderRepository;
    this.orderItemRepository = orderItemRepository;
    this.storeItemRepository = storeItemRepository;
    this.cartItemRepository = cartItemRepository;
    this.subscriptionRepository = subscriptionRepository;
    this.notifier = notifier;
    this.clock = clock;
  }

  /** Reconciles one verified, parsed webhook. */
  @Transactional
  public ReconciliationOutcome reconcile(WebhookResult event) {
    if (event.unhandledEvent()) {
      log.debug("No payment mapping for webhook event {}", event.eventType());
      return ReconciliationOutcome.ignored("Unhandled event " + event.eventType());
    }
    if (event.renewal() != null && event.renewal().isCycleRenewal()) {
      return recordRenewal(event);
    }

    var paymentId = resolvePaymentId(event);
    if (paymentId.isEmpty()) {
      log.warn(
          "No local payment for webhook event {} (ref={}, correlation={})",
          event.eventType(),
          event.providerRef(),
          event.correlation());
      return ReconciliationOutcome.notFound("No payment matches event " + event.eventType());
    }
    return applyTransition(paymentId.get(), event.status(), TransitionTrigger.webhook(event));
  }

  /**
   * Moves a payment to {@code target} under a row lock. A transition to the current status, or one
   * the state machine forbids, is reported as unchanged and writes nothing.
   *
   * @throws ResourceNotFoundException if the payment does not exist
   * @throws InsufficientStockException if a paid store order can no longer be fulfilled; the whole
   *     transition rolls back
   */
  @Transactional
  public ReconciliationOutcome applyTransition(
      UUID paymentId, PaymentStatus target, TransitionTrigger trigger) {
    var payment =
        paymentRepository
            .findByIdForUpdate(paymentId)
            .orElseThrow(() -> new ResourceNotFoundException("Payment", paymentId));
    var previous = payment.getStatus();

    if (previous == target) {
      log.debug("Payment {} already {}, {} ignored", paymentId, target, trigger.source());
      return ReconciliationOutcome.unchanged(paymentId, previous, "Already " + target);
    }
    if (!previous.canTransitionTo(target)) {
      log.info(
          "Ignoring {} -> {} for payment {} from {} ({})",
          previous,
          target,
          paymentId,
          trigger.source(),
          trigger.eventType());
      return ReconciliationOutcome.unchanged(
          paymentId, previous, "Transition " + previous + " -> " + target + " not allowed");
    }

    if (target == PaymentStatus.PAID) {
      payment.recordCapturedAmount(trigger.capturedAmount());
    }
    payment.transitionTo(target, trigger.bookkeeping(clock.instant()));

    switch (payment.getType()) {
      case STORE_CHECKOUT -> applyToOrder(payment, target);
      case SUBSCRIPTION -> applyToSubscriptions(payment, target, trigger);
    }
    paymentRepository.save(payment);

    log.info(
        "Payment {} moved {} -> {} via {} ({})",
        paymentId,
        previous,
        target,
        trigger.source(),
        trigger.eventType());
    notifyStatusChange(payment, previous, trigger.describe());
    return ReconciliationOutcome.applied(paymentId, target, previous + " -> " + target);
  }

  Optional<UUID> resolvePaymentId(WebhookResult event) {
    var correlation = event.correlation();
    if (correlation.paymentId() != null && paymentRepository.existsById(correlation.paymentId())) {
      return Optional.of(correlation.paymentId());
    }
    if (correlation.orderId() != null) {
      var viaOrder = orderRepository.findById(correlation.orderId()).map(Order::getPaymentId);
      if (viaOrder.isPresent()) {
        return viaOrder;
      }
    }
    if (correlation.subscriptionId() != null) {
      var viaSubscription =
          subscriptionRepository
              .findById(correlation.subscriptionId())
              .map(Subscription::getPaymentId);
      if (viaSubscription.isPresent()) {
        return viaSubscription;
      }
    }
    if (event.providerRef() != null) {
      return paymentRepository.findByProviderRef(event.providerRef()).map(Payment::getId);
    }
    return Optional.empty();
  }

  private void applyToOrder(Payment payment, PaymentStatus target) {
    var order = orderRepository.findByPaymentId(payment.getId()).orElse(null);
    if (order == null) {
      log.warn("Store payment {} has no order", payment.getId());
      return;
    }
    switch (target) {
      case PAID -> confirmOrder(order);
      case FAILED, CANCELLED -> {
        var note = "Payment " + target.name().toLowerCase();
        if (order.getStatus() == OrderStatus.PROCESSING) {
          order.changeStatus(OrderStatus.PENDING, note);
        } else {
          order.addHistoryNote(note);
        }
      }
      case REFUNDED -> order.addHistoryNote("Payment refunded");
      case PENDING -> {}
    }
    orderRepository.save(order);
  }

  private void confirmOrder(Order order) {
    var items = orderItemRepository.findByOrderId(order.getId());
    for (var item : items) {
      if (item.isStockDeferred()) {
        continue;
      }
      int updated = storeItemRepository.decrementStock(item.getProductId(), item.getQuantity());
      if (updated == 0) {
        log.error(
            "Stock exhausted for product {} while confirming order {}",
            item.getProductId(),
            order.getId());
        throw new InsufficientStockException(item.getProductId(), item.getQuantity());
      }
    }

    List<UUID> productIds = items.stream().map(OrderItem::getProductId).distinct().toList();
    if (!productIds.isEmpty()) {
      int removed = cartItemRepository.deleteByUserIdAndProductIds(order.getUserId(), productIds);
      log.debug("Removed {} cart items for user {}", removed, order.getUserId());
    }

    if (order.isPreOrder()) {
      order.changePreOrderStatus(PreOrderStatus.CONFIRMED, "Payment received");
    } else if (order.getStatus() == OrderStatus.PENDING) {
      order.changeStatus(OrderStatus.PROCESSING, "Payment received");
    } else {
      order.addHistoryNote("Payment received");
    }
    notifier.orderPaymentConfirmed(
        OrderPaymentConfirmedEvent.of(order.getId(), order.getUserId(), order.getPaymentId()));
  }

  private void applyToSubscriptions(
      Payment payment, PaymentStatus target, TransitionTrigger trigger) {
    var subscriptions = subscriptionRepository.findByPaymentId(payment.getId());
    if (subscriptions.isEmpty()) {
      log.warn("Subscription payment {} has no subscription rows", payment.getId());
    }
    for (var subscription : subscriptions) {
      subscription.changeStatus(target);
      if (target == PaymentStatus.PAID) {
        subscription.linkProviderSubscription(trigger.providerSubscriptionId());
      }
    }
    subscriptionRepository.saveAll(subscriptions);
  }

  private ReconciliationOutcome recordRenewal(WebhookResult event) {
    var renewal = event.renewal();
    if (event.status() != PaymentStatus.PAID) {
      log.warn(
          "Renewal invoice {} for subscription {} reported {}, no cycle recorded",
          renewal.invoiceId(),
          renewal.providerSubscriptionId(),
          event.eventType());
      return ReconciliationOutcome.ignored("Renewal not paid: " + renewal.invoiceId());
    }
    if (renewal.invoiceId() == null || renewal.providerSubscriptionId() == null) {
      log.warn("Renewal event {} is missing invoice or subscription id", event.eventType());
      return ReconciliationOutcome.ignored("Incomplete renewal event");
    }

    var existing = subscriptionRepository.findById(renewal.invoiceId());
    if (existing.isPresent()) {
      log.debug("Renewal invoice {} already recorded", renewal.invoiceId());
      return ReconciliationOutcome.unchanged(
          existing.get().getPaymentId(), existing.get().getStatus(), "Renewal already recorded");
    }

    var previous =
        subscriptionRepository
            .findFirstByProviderSubscriptionIdOrderByBillingCycleDesc(
                renewal.providerSubscriptionId())
            .orElse(null);
    if (previous == null) {
      log.warn(
          "Renewal invoice {} references unknown subscription {}",
          renewal.invoiceId(),
          renewal.providerSubscriptionId());
      return ReconciliationOutcome.notFound(
          "No subscription " + renewal.providerSubscriptionId());
    }
    var previousPayment =
        paymentRepository
            .findById(previous.getPaymentId())
            .orElseThrow(() -> new ResourceNotFoundException("Payment", previous.getPaymentId()));

    var now = clock.instant();
    var periodStart = renewal.periodStart() != null ? renewal.periodStart() : previous.getEndDate();
    var periodEnd =
        renewal.periodEnd() != null
            ? renewal.periodEnd()
            : periodStart.plus(Duration.between(previous.getStartDate(), previous.getEndDate()));
    var bookkeeping =
        new ProviderBookkeeping(event.eventType(), now, event.transactionId(), null);

    var payment =
        new Payment(
            UUID.randomUUID(),
            previous.getUserId(),
            previousPayment.getCustomerEmail(),
            previousPayment.getProvider(),
            renewal.invoiceId(),
            renewalAmount(renewal, previousPayment),
            renewal.currency() != null ? renewal.currency() : previousPayment.getCurrency(),
            false,
            new PaymentMetadata.Subscription(planName(previousPayment), bookkeeping));
    payment.transitionTo(PaymentStatus.PAID, bookkeeping);
    paymentRepository.save(payment);

    var next =
        Subscription.renewalOf(
            previous, renewal.invoiceId(), payment.getId(), periodStart, periodEnd);
    next.changeStatus(PaymentStatus.PAID);
    subscriptionRepository.save(next);

    log.info(
        "Recorded billing cycle {} for subscription {} (invoice {})",
        next.getBillingCycle(),
        renewal.providerSubscriptionId(),
        renewal.invoiceId());
    notifyStatusChange(payment, PaymentStatus.PENDING, "Subscription renewed");
    return ReconciliationOutcome.applied(
        payment.getId(), PaymentStatus.PAID, "Billing cycle " + next.getBillingCycle());
  }

  private static BigDecimal renewalAmount(RenewalInvoice renewal, Payment previousPayment) {
    if (renewal.amountPaid() != null && renewal.amountPaid().signum() > 0) {
      return renewal.amountPaid();
    }
    return previousPayment.getAmount();
  }

  private static String planName(Payment payment) {
    return payment.getMetadata() instanceof PaymentMetadata.Subscription subscription
        ? subscription.planName()
        : null;
  }

  private void notifyStatusChange(Payment payment, PaymentStatus previous, String reason) {
    if (!payment.getStatus().notifiesCustomer()) {
      return;
    }
    notifier.paymentStatusChanged(
        PaymentStatusChangedEvent.of(
            payment.getId(),
            payment.getUserId(),
            payment.getCustomerEmail(),
            payment.getType(),
            previous,
            payment.getStatus(),
            payment.getAmount(),
            payment.getCurrency(),
            reason));
  }
}
