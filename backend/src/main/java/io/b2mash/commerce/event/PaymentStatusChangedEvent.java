package io.b2mash.commerce.event;

import io.b2mash.commerce.payment.PaymentStatus;
import io.b2mash.commerce.payment.PaymentType;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public record PaymentStatusChangedEvent(
    String eventType,
    String entityType,
    UUID entityId,
    Instant occurredAt,
    Map<String, Object> details,
    UUID userId,
    String customerEmail,
    PaymentType paymentType,
    PaymentStatus previousStatus,
    PaymentStatus status,
    BigDecimal amount,
    String currency,
    String reason)
    implements DomainEvent {

  public static final String EVENT_TYPE = "payment.statusChanged";

  public static PaymentStatusChangedEvent of(
      UUID paymentId,
      UUID userId,
      String customerEmail,
      PaymentType paymentType,
      PaymentStatus previousStatus,
      PaymentStatus status,
      BigDecimal amount,
      String currency,
      String reason) {
    return new PaymentStatusChangedEvent(
        EVENT_TYPE,
        "payment",
        paymentId,
        Instant.now(),
        Map.of("from", previousStatus.name(), "to", status.name()),
        userId,
        customerEmail,
        paymentType,
        previousStatus,
        status,
        amount,
        currency,
        reason);
  }
}
