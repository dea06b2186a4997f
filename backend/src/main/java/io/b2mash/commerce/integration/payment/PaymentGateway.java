package io.b2mash.commerce.integration.payment;

import java.util.Map;
import java.util.Optional;

/**
 * Port for an online payment processor. Implementations translate the processor's own session,
 * capture and webhook vocabulary into {@link io.b2mash.commerce.payment.PaymentStatus} and carry
 * the internal payment id through processor-side metadata so webhooks can be correlated back.
 */
public interface PaymentGateway {

  ProviderKind kind();

  /**
   * Opens a hosted checkout session. Throws {@link
   * io.b2mash.commerce.exception.PaymentProviderException} when the processor cannot be reached
   * or rejects the request.
   */
  PaymentSession initializePayment(PaymentInitRequest request);

  /**
   * Settles or confirms the payment behind {@code providerRef}. Calling it again for an already
   * settled session returns the same terminal status.
   */
  CaptureResult capturePayment(String providerRef);

  /**
   * Checks the webhook signature against the untouched request body. Returns {@code false} when
   * the webhook secret is not configured, a signature header is missing or the body is absent.
   */
  boolean verifyWebhook(Map<String, String> headers, String rawBody);

  /** Parses a verified webhook body. Unknown event types come back as unhandled PENDING results. */
  WebhookResult parseWebhook(String rawBody);

  /** {@code false} for event families that never affect payment state (customers, products). */
  boolean isPaymentRelevant(String eventType);

  /** Reads the current status from the processor. Fallback for missed webhooks. */
  CaptureResult verifyPaymentStatus(String providerRef);

  /**
   * Looks up correlation metadata for events that do not carry it themselves. Only called when
   * {@link WebhookResult#correlationDeferred()} is set.
   */
  default Optional<CorrelationMetadata> fetchCorrelationMetadata(String providerRef) {
    return Optional.empty();
  }

  /**
   * Closes a checkout session so it can no longer be paid. Returns {@code true} only when the
   * processor guarantees that; {@code false} when the session may still complete.
   */
  default boolean cancelSession(String providerRef) {
    return false;
  }
}
