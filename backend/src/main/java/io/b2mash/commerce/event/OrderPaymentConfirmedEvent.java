package io.b2mash.commerce.event;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/** Emitted once when a store order's payment settles. Consumed by fulfilment. */
public record OrderPaymentConfirmedEvent(
    String eventType,
    String entityType,
    UUID entityId,
    Instant occurredAt,
    Map<String, Object> details,
    UUID userId,
    UUID paymentId)
    implements DomainEvent {

  public static final String EVENT_TYPE = "order.paymentConfirmed";

  public static OrderPaymentConfirmedEvent of(UUID orderId, UUID userId, UUID paymentId) {
    return new OrderPaymentConfirmedEvent(
        EVENT_TYPE,
        "order",
        orderId,
        Instant.now(),
        Map.of("paymentId", paymentId.toString()),
        userId,
        paymentId);
  }

  public UUID orderId() {
    return entityId;
  }
}
