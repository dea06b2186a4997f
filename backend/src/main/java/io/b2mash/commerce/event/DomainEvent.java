package io.b2mash.commerce.event;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Base interface for domain events published via Spring ApplicationEventPublisher. All
 * implementations must be records with primitive/UUID fields only, never JPA entities, so events
 * remain valid after the publishing transaction commits and the persistence context closes.
 */
public sealed interface DomainEvent permits PaymentStatusChangedEvent, OrderPaymentConfirmedEvent {

  String eventType();

  String entityType();

  UUID entityId();

  Instant occurredAt();

  Map<String, Object> details();
}
