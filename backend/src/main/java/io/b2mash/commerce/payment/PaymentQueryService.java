package io.b2mash.commerce.payment;

import io.b2mash.commerce.exception.ResourceNotFoundException;
import io.b2mash.commerce.order.OrderItemRepository;
import io.b2mash.commerce.order.OrderRepository;
import io.b2mash.commerce.payment.PaymentDetails.OrderView;
import io.b2mash.commerce.security.AuthenticatedUser;
import io.b2mash.commerce.subscription.SubscriptionQueryService;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class PaymentQueryService {

  private final PaymentRepository paymentRepository;
  private final OrderRepository orderRepository;
  private final OrderItemRepository orderItemRepository;
  private final SubscriptionQueryService subscriptionQueryService;

  public PaymentQueryService(
      PaymentRepository paymentRepository,
      OrderRepository orderRepository,
      OrderItemRepository orderItemRepository,
      SubscriptionQueryService subscriptionQueryService) {
    this.paymentRepository = paymentRepository;
    this.orderRepository = orderRepository;
    this.orderItemRepository = orderItemRepository;
    this.subscriptionQueryService = subscriptionQueryService;
  }

  /**
   * Loads a payment with its orders and subscription cycles. Customers only see their own
   * payments; anyone else's is reported as not found.
   */
  @Transactional(readOnly = true)
  public PaymentDetails getPaymentDetails(UUID paymentId, AuthenticatedUser caller) {
    var payment =
        paymentRepository
            .findById(paymentId)
            .filter(p -> caller.admin() || p.getUserId().equals(caller.userId()))
            .orElseThrow(() -> new ResourceNotFoundException("Payment", paymentId));

    var orders =
        orderRepository.findByPaymentId(paymentId).stream()
            .map(order -> OrderView.from(order, orderItemRepository.findByOrderId(order.getId())))
            .toList();
    return PaymentDetails.from(payment, orders, subscriptionQueryService.forPayment(paymentId));
  }

  /** Ownership check for operations that act on a payment on the caller's behalf. */
  @Transactional(readOnly = true)
  public void requireAccess(UUID paymentId, AuthenticatedUser caller) {
    paymentRepository
        .findById(paymentId)
        .filter(p -> caller.admin() || p.getUserId().equals(caller.userId()))
        .orElseThrow(() -> new ResourceNotFoundException("Payment", paymentId));
  }
}
