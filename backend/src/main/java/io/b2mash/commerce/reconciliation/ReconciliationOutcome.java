package io.b2mash.commerce.reconciliation;

import io.b2mash.commerce.payment.PaymentStatus;
import java.util.UUID;

/**
 * Result of feeding one event into reconciliation.
 *
 * <ul>
 *   <li>{@code APPLIED} the payment moved and side effects were recorded
 *   <li>{@code UNCHANGED} duplicate or disallowed transition, nothing written
 *   <li>{@code IGNORED} the event does not concern payment state
 *   <li>{@code NOT_FOUND} no local payment matches the event
 * </ul>
 */
public record ReconciliationOutcome(
    Result result, UUID paymentId, PaymentStatus status, String detail) {

  public enum Result {
    APPLIED,
    UNCHANGED,
    IGNORED,
    NOT_FOUND
  }

  public static ReconciliationOutcome applied(UUID paymentId, PaymentStatus status, String detail) {
    return new ReconciliationOutcome(Result.APPLIED, paymentId, status, detail);
  }

  public static ReconciliationOutcome unchanged(
      UUID paymentId, PaymentStatus status, String detail) {
    return new ReconciliationOutcome(Result.UNCHANGED, paymentId, status, detail);
  }

  public static ReconciliationOutcome ignored(String detail) {
    return new ReconciliationOutcome(Result.IGNORED, null, null, detail);
  }

  public static ReconciliationOutcome notFound(String detail) {
    return new ReconciliationOutcome(Result.NOT_FOUND, null, null, detail);
  }

  public boolean applied() {
    return result == Result.APPLIED;
  }
}
