package io.b2mash.commerce.payment;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed payment metadata, persisted as a JSON object tagged by {@code type}. Reading a stored
 * object with an unknown or missing tag fails with {@link IllegalArgumentException}.
 */
public sealed interface PaymentMetadata
    permits PaymentMetadata.StoreCheckout, PaymentMetadata.Subscription {

  String TYPE = "type";

  PaymentType type();

  ProviderBookkeeping bookkeeping();

  PaymentMetadata withBookkeeping(ProviderBookkeeping bookkeeping);

  record StoreCheckout(ProviderBookkeeping bookkeeping) implements PaymentMetadata {

    public StoreCheckout {
      bookkeeping = bookkeeping == null ? ProviderBookkeeping.empty() : bookkeeping;
    }

    @Override
    public PaymentType type() {
      return PaymentType.STORE_CHECKOUT;
    }

    @Override
    public PaymentMetadata withBookkeeping(ProviderBookkeeping bookkeeping) {
      return new StoreCheckout(bookkeeping);
    }
  }

  record Subscription(String planName, ProviderBookkeeping bookkeeping)
      implements PaymentMetadata {

    public Subscription {
      bookkeeping = bookkeeping == null ? ProviderBookkeeping.empty() : bookkeeping;
    }

    @Override
    public PaymentType type() {
      return PaymentType.SUBSCRIPTION;
    }

    @Override
    public PaymentMetadata withBookkeeping(ProviderBookkeeping bookkeeping) {
      return new Subscription(planName, bookkeeping);
    }
  }

  default Map<String, Object> toMap() {
    var map = new LinkedHashMap<String, Object>();
    map.put(TYPE, type().wireValue());
    if (this instanceof Subscription subscription && subscription.planName() != null) {
      map.put("planName", subscription.planName());
    }
    var bookkeeping = bookkeeping();
    putIfPresent(map, "lastEventType", bookkeeping.lastEventType());
    putIfPresent(
        map,
        "lastEventAt",
        bookkeeping.lastEventAt() != null ? bookkeeping.lastEventAt().toString() : null);
    putIfPresent(map, "transactionId", bookkeeping.transactionId());
    putIfPresent(map, "receiptUrl", bookkeeping.receiptUrl());
    return map;
  }

  static PaymentMetadata fromMap(Map<String, Object> map) {
    if (map == null || map.get(TYPE) == null) {
      throw new IllegalArgumentException("Payment metadata has no type tag");
    }
    var lastEventAt = string(map, "lastEventAt");
    var bookkeeping =
        new ProviderBookkeeping(
            string(map, "lastEventType"),
            lastEventAt != null ? Instant.parse(lastEventAt) : null,
            string(map, "transactionId"),
            string(map, "receiptUrl"));
    return switch (PaymentType.fromWireValue(String.valueOf(map.get(TYPE)))) {
      case STORE_CHECKOUT -> new StoreCheckout(bookkeeping);
      case SUBSCRIPTION -> new Subscription(string(map, "planName"), bookkeeping);
    };
  }

  private static String string(Map<String, Object> map, String key) {
    var value = map.get(key);
    return value != null ? String.valueOf(value) : null;
  }

  private static void putIfPresent(Map<String, Object> map, String key, Object value) {
    if (value != null) {
      map.put(key, value);
    }
  }
}
