package io.b2mash.commerce.payment;

import java.time.Instant;

/** Processor-side facts recorded against a payment that cannot be derived from joins. */
public record ProviderBookkeeping(
    String lastEventType, Instant lastEventAt, String transactionId, String receiptUrl) {

  public static ProviderBookkeeping empty() {
    return new ProviderBookkeeping(null, null, null, null);
  }

  /** Overlays the non-null fields of {@code update} onto this record. */
  public ProviderBookkeeping merge(ProviderBookkeeping update) {
    return new ProviderBookkeeping(
        update.lastEventType != null ? update.lastEventType : lastEventType,
        update.lastEventAt != null ? update.lastEventAt : lastEventAt,
        update.transactionId != null ? update.transactionId : transactionId,
        update.receiptUrl != null ? update.receiptUrl : receiptUrl);
  }
}
