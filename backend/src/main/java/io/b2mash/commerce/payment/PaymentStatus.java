package io.b2mash.commerce.payment;

/**
 * Canonical payment status shared by every processor adapter and the local ledger. Allowed moves:
 * PENDING to PAID, FAILED or CANCELLED, and PAID to REFUNDED. Everything else is a no-op.
 */
public enum PaymentStatus {
  PENDING,
  PAID,
  FAILED,
  CANCELLED,
  REFUNDED;

  public boolean canTransitionTo(PaymentStatus target) {
    return switch (this) {
      case PENDING -> target == PAID || target == FAILED || target == CANCELLED;
      case PAID -> target == REFUNDED;
      case FAILED, CANCELLED, REFUNDED -> false;
    };
  }

  /** Statuses the customer is emailed about. */
  public boolean notifiesCustomer() {
    return this != PENDING;
  }
}
