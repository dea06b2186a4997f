package io.b2mash.commerce.payment;

import io.b2mash.commerce.integration.payment.ProviderKind;
import io.b2mash.commerce.order.Order;
import io.b2mash.commerce.order.OrderItem;
import io.b2mash.commerce.order.OrderStatus;
import io.b2mash.commerce.order.OrderStatusChange;
import io.b2mash.commerce.order.PreOrderStatus;
import io.b2mash.commerce.subscription.SubscriptionView;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/** A payment together with the orders and subscription cycles it pays for. */
public record PaymentDetails(
    UUID id,
    ProviderKind provider,
    String providerRef,
    PaymentStatus status,
    String type,
    BigDecimal amount,
    BigDecimal capturedAmount,
    String currency,
    boolean preOrderPayment,
    Map<String, Object> metadata,
    Instant createdAt,
    Instant updatedAt,
    List<OrderView> orders,
    List<SubscriptionView> subscriptions) {

  public static PaymentDetails from(
      Payment payment, List<OrderView> orders, List<SubscriptionView> subscriptions) {
    return new PaymentDetails(
        payment.getId(),
        payment.getProvider(),
        payment.getProviderRef(),
        payment.getStatus(),
        payment.getType().wireValue(),
        payment.getAmount(),
        payment.getCapturedAmount(),
        payment.getCurrency(),
        payment.isPreOrderPayment(),
        payment.getMetadata().toMap(),
        payment.getCreatedAt(),
        payment.getUpdatedAt(),
        orders,
        subscriptions);
  }

  public record OrderView(
      UUID id,
      OrderStatus status,
      boolean preOrder,
      PreOrderStatus preOrderStatus,
      BigDecimal totalAmount,
      BigDecimal shippingCost,
      String shippingService,
      List<OrderItemView> items,
      List<StatusChangeView> history) {

    public static OrderView from(Order order, List<OrderItem> items) {
      return new OrderView(
          order.getId(),
          order.getStatus(),
          order.isPreOrder(),
          order.getPreOrderStatus(),
          order.getTotalAmount(),
          order.getShippingCost(),
          order.getShippingServiceKey(),
          items.stream().map(OrderItemView::from).toList(),
          order.getStatusHistory().stream().map(StatusChangeView::from).toList());
    }
  }

  public record OrderItemView(UUID productId, String name, int quantity, BigDecimal price) {

    static OrderItemView from(OrderItem item) {
      return new OrderItemView(
          item.getProductId(), item.getProductName(), item.getQuantity(), item.getPrice());
    }
  }

  public record StatusChangeView(OrderStatus status, String note, Instant changedAt) {

    static StatusChangeView from(OrderStatusChange change) {
      return new StatusChangeView(change.getStatus(), change.getNote(), change.getChangedAt());
    }
  }
}
