package io.b2mash.commerce.subscription;

import io.b2mash.commerce.payment.PaymentStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * One billing cycle of a user's subscription. Rows are append-only per cycle: a renewal inserts a
 * new row with the next {@code billingCycle} instead of extending the previous one.
 *
 * <p>The id is the processor reference of the payment that opened the cycle (checkout session for
 * cycle 1, renewal invoice afterwards).
 */
@Entity
@Table(name = "subscriptions")
public class Subscription {

  @Id
  @Column(name = "id", nullable = false, updatable = false, length = 255)
  private String id;

  @Column(name = "user_id", nullable = false)
  private UUID userId;

  @Column(name = "plan_id", nullable = false)
  private UUID planId;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private PaymentStatus status;

  @Column(name = "start_date", nullable = false)
  private Instant startDate;

  @Column(name = "end_date", nullable = false)
  private Instant endDate;

  @Column(name = "auto_renew", nullable = false)
  private boolean autoRenew;

  @Column(name = "billing_cycle", nullable = false)
  private int billingCycle;

  @Column(name = "provider_subscription_id", length = 255)
  private String providerSubscriptionId;

  @Column(name = "invoice_id", length = 255)
  private String invoiceId;

  @Column(name = "payment_id", nullable = false)
  private UUID paymentId;

  @Version
  @Column(name = "version")
  private Long version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Subscription() {}

  public Subscription(
      String id,
      UUID userId,
      UUID planId,
      UUID paymentId,
      Instant startDate,
      Instant endDate,
      int billingCycle) {
    this.id = Objects.requireNonNull(id, "id must not be null");
    this.userId = Objects.requireNonNull(userId, "userId must not be null");
    this.planId = Objects.requireNonNull(planId, "planId must not be null");
    this.paymentId = Objects.requireNonNull(paymentId, "paymentId must not be null");
    this.startDate = Objects.requireNonNull(startDate, "startDate must not be null");
    this.endDate = Objects.requireNonNull(endDate, "endDate must not be null");
    this.billingCycle = billingCycle;
    this.status = PaymentStatus.PENDING;
    this.autoRenew = true;
  }

  /** Creates the row for the next billing cycle after {@code previous}. */
  public static Subscription renewalOf(
      Subscription previous,
      String invoiceId,
      UUID paymentId,
      Instant periodStart,
      Instant periodEnd) {
    var renewal =
        new Subscription(
            invoiceId,
            previous.userId,
            previous.planId,
            paymentId,
            periodStart,
            periodEnd,
            previous.billingCycle + 1);
    renewal.invoiceId = invoiceId;
    renewal.providerSubscriptionId = previous.providerSubscriptionId;
    renewal.autoRenew = previous.autoRenew;
    return renewal;
  }

  @PrePersist
  void onCreate() {
    this.createdAt = Instant.now();
    this.updatedAt = this.createdAt;
  }

  @PreUpdate
  void onUpdate() {
    this.updatedAt = Instant.now();
  }

  public void changeStatus(PaymentStatus newStatus) {
    this.status = Objects.requireNonNull(newStatus, "newStatus must not be null");
  }

  public void linkProviderSubscription(String providerSubscriptionId) {
    if (providerSubscriptionId != null && !providerSubscriptionId.isBlank()) {
      this.providerSubscriptionId = providerSubscriptionId;
    }
  }

  public boolean isActiveAt(Instant instant) {
    return status == PaymentStatus.PAID
        && !instant.isBefore(startDate)
        && !instant.isAfter(endDate);
  }

  public String getId() {
    return id;
  }

  public UUID getUserId() {
    return userId;
  }

  public UUID getPlanId() {
    return planId;
  }

  public PaymentStatus getStatus() {
    return status;
  }

  public Instant getStartDate() {
    return startDate;
  }

  public Instant getEndDate() {
    return endDate;
  }

  public boolean isAutoRenew() {
    return autoRenew;
  }

  public int getBillingCycle() {
    return billingCycle;
  }

  public String getProviderSubscriptionId() {
    return providerSubscriptionId;
  }

  public String getInvoiceId() {
    return invoiceId;
  }

  public UUID getPaymentId() {
    return paymentId;
  }

  public Long getVersion() {
    return version;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
