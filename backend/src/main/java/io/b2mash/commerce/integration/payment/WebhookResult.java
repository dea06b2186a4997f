package io.b2mash.commerce.integration.payment;

import io.b2mash.commerce.payment.PaymentStatus;

/**
 * A parsed processor webhook in canonical form.
 *
 * <p>{@code unhandledEvent} marks event types the adapter does not map; their status is PENDING
 * and they never move a payment. {@code correlationDeferred} asks ingestion to fetch correlation
 * metadata with {@link PaymentGateway#fetchCorrelationMetadata(String)} before reconciling.
 */
public record WebhookResult(
    String eventType,
    String providerRef,
    PaymentStatus status,
    CorrelationMetadata correlation,
    String transactionId,
    String providerSubscriptionId,
    RenewalInvoice renewal,
    boolean unhandledEvent,
    boolean correlationDeferred) {

  public WebhookResult {
    correlation = correlation == null ? CorrelationMetadata.empty() : correlation;
  }

  public static WebhookResult unhandled(String eventType) {
    return new WebhookResult(
        eventType, null, PaymentStatus.PENDING, null, null, null, null, true, false);
  }

  public static WebhookResult of(
      String eventType,
      String providerRef,
      PaymentStatus status,
      CorrelationMetadata correlation,
      String transactionId) {
    return new WebhookResult(
        eventType, providerRef, status, correlation, transactionId, null, null, false, false);
  }

  public WebhookResult withCorrelation(CorrelationMetadata fetched) {
    return new WebhookResult(
        eventType,
        providerRef,
        status,
        fetched,
        transactionId,
        providerSubscriptionId,
        renewal,
        unhandledEvent,
        false);
  }
}
