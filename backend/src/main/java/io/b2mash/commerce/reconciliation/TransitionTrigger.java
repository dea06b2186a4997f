package io.b2mash.commerce.reconciliation;

import io.b2mash.commerce.integration.payment.CaptureResult;
import io.b2mash.commerce.integration.payment.WebhookResult;
import io.b2mash.commerce.payment.ProviderBookkeeping;
import java.math.BigDecimal;
import java.time.Instant;

/** Why and from where a transition was requested, plus the processor facts that came with it. */
public record TransitionTrigger(
    TriggerSource source,
    String eventType,
    String transactionId,
    BigDecimal capturedAmount,
    String providerSubscriptionId) {

  public static TransitionTrigger webhook(WebhookResult event) {
    return new TransitionTrigger(
        TriggerSource.WEBHOOK,
        event.eventType(),
        event.transactionId(),
        null,
        event.providerSubscriptionId());
  }

  public static TransitionTrigger capture(CaptureResult result) {
    return new TransitionTrigger(
        TriggerSource.CAPTURE,
        "capture",
        result.transactionId(),
        result.capturedAmount(),
        result.providerSubscriptionId());
  }

  public static TransitionTrigger fallback(CaptureResult result) {
    return new TransitionTrigger(
        TriggerSource.FALLBACK,
        "status_check",
        result.transactionId(),
        result.capturedAmount(),
        result.providerSubscriptionId());
  }

  public static TransitionTrigger redirectCancel() {
    return new TransitionTrigger(TriggerSource.REDIRECT, "checkout_cancelled", null, null, null);
  }

  public ProviderBookkeeping bookkeeping(Instant at) {
    return new ProviderBookkeeping(eventType, at, transactionId, null);
  }

  /** Human-readable reason used in notifications. */
  public String describe() {
    return switch (source) {
      case WEBHOOK -> "Payment processor reported " + eventType;
      case CAPTURE -> "Payment confirmed on return from checkout";
      case FALLBACK -> "Payment status confirmed with the processor";
      case REDIRECT -> "Checkout was cancelled";
    };
  }
}
