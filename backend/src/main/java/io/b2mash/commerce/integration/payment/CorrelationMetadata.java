package io.b2mash.commerce.integration.payment;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Internal identifiers embedded in processor metadata at checkout and echoed back on webhooks.
 * Any field may be null; unparseable ids are dropped rather than failing the webhook.
 */
public record CorrelationMetadata(
    UUID paymentId, UUID orderId, String subscriptionId, String type, UUID userId) {

  private static final Logger log = LoggerFactory.getLogger(CorrelationMetadata.class);

  public static CorrelationMetadata empty() {
    return new CorrelationMetadata(null, null, null, null, null);
  }

  public static CorrelationMetadata fromMap(Map<String, String> metadata) {
    if (metadata == null || metadata.isEmpty()) {
      return empty();
    }
    return new CorrelationMetadata(
        uuid(metadata.get("paymentId")),
        uuid(metadata.get("orderId")),
        blankToNull(metadata.get("subscriptionId")),
        blankToNull(metadata.get("type")),
        uuid(metadata.get("userId")));
  }

  public Map<String, String> toMap() {
    var map = new LinkedHashMap<String, String>();
    if (paymentId != null) {
      map.put("paymentId", paymentId.toString());
    }
    if (orderId != null) {
      map.put("orderId", orderId.toString());
    }
    if (subscriptionId != null) {
      map.put("subscriptionId", subscriptionId);
    }
    if (type != null) {
      map.put("type", type);
    }
    if (userId != null) {
      map.put("userId", userId.toString());
    }
    return map;
  }

  public boolean isEmpty() {
    return paymentId == null && orderId == null && subscriptionId == null;
  }

  static UUID uuid(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      return UUID.fromString(value.trim());
    } catch (IllegalArgumentException e) {
      log.warn("Ignoring malformed id in payment metadata: {}", value);
      return null;
    }
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value;
  }
}
