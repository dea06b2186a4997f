package io.b2mash.commerce.payment;

import io.b2mash.commerce.exception.InvalidStateException;
import io.b2mash.commerce.integration.payment.ProviderKind;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * A payment attempt at one processor. The id is assigned by checkout before the processor session
 * is opened so it can travel in the processor's metadata.
 */
@Entity
@Table(name = "payments")
public class Payment {

  @Id
  @Column(name = "id", nullable = false, updatable = false)
  private UUID id;

  @Column(name = "user_id", nullable = false)
  private UUID userId;

  @Column(name = "customer_email", length = 320)
  private String customerEmail;

  @Enumerated(EnumType.STRING)
  @Column(name = "provider", nullable = false, length = 20)
  private ProviderKind provider;

  @Column(name = "provider_ref", nullable = false, unique = true, length = 255)
  private String providerRef;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private PaymentStatus status;

  @Column(name = "amount", nullable = false, precision = 14, scale = 2)
  private BigDecimal amount;

  @Column(name = "authorized_amount", precision = 14, scale = 2)
  private BigDecimal authorizedAmount;

  @Column(name = "captured_amount", precision = 14, scale = 2)
  private BigDecimal capturedAmount;

  @Column(name = "currency", nullable = false, length = 3)
  private String currency;

  @Column(name = "pre_order_payment", nullable = false)
  private boolean preOrderPayment;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "metadata", columnDefinition = "jsonb", nullable = false)
  private Map<String, Object> metadata = new HashMap<>();

  @Version
  @Column(name = "version")
  private Long version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Payment() {}

  public Payment(
      UUID id,
      UUID userId,
      String customerEmail,
      ProviderKind provider,
      String providerRef,
      BigDecimal amount,
      String currency,
      boolean preOrderPayment,
      PaymentMetadata metadata) {
    this.id = Objects.requireNonNull(id, "id must not be null");
    this.userId = Objects.requireNonNull(userId, "userId must not be null");
    this.customerEmail = customerEmail;
    this.provider = Objects.requireNonNull(provider, "provider must not be null");
    this.providerRef = Objects.requireNonNull(providerRef, "providerRef must not be null");
    this.amount = Objects.requireNonNull(amount, "amount must not be null");
    this.authorizedAmount = amount;
    this.currency = Objects.requireNonNull(currency, "currency must not be null");
    this.preOrderPayment = preOrderPayment;
    this.metadata = Objects.requireNonNull(metadata, "metadata must not be null").toMap();
    this.status = PaymentStatus.PENDING;
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

  /**
   * Moves the payment to {@code target}. Callers check {@link PaymentStatus#canTransitionTo}
   * first; an illegal move here is a programming error.
   */
  public void transitionTo(PaymentStatus target, ProviderBookkeeping bookkeeping) {
    if (!status.canTransitionTo(target)) {
      throw new InvalidStateException(
          "Invalid payment transition",
          "Cannot move payment " + id + " from " + status + " to " + target);
    }
    this.status = target;
    if (target == PaymentStatus.PAID && capturedAmount == null) {
      this.capturedAmount = amount;
    }
    recordBookkeeping(bookkeeping);
  }

  public void recordCapturedAmount(BigDecimal capturedAmount) {
    if (capturedAmount != null) {
      this.capturedAmount = capturedAmount;
    }
  }

  public void recordBookkeeping(ProviderBookkeeping update) {
    if (update == null) {
      return;
    }
    var current = getMetadata();
    this.metadata = current.withBookkeeping(current.bookkeeping().merge(update)).toMap();
  }

  public PaymentMetadata getMetadata() {
    return PaymentMetadata.fromMap(metadata);
  }

  public PaymentType getType() {
    return getMetadata().type();
  }

  public UUID getId() {
    return id;
  }

  public UUID getUserId() {
    return userId;
  }

  public String getCustomerEmail() {
    return customerEmail;
  }

  public ProviderKind getProvider() {
    return provider;
  }

  public String getProviderRef() {
    return providerRef;
  }

  public PaymentStatus getStatus() {
    return status;
  }

  public BigDecimal getAmount() {
    return amount;
  }

  public BigDecimal getAuthorizedAmount() {
    return authorizedAmount;
  }

  public BigDecimal getCapturedAmount() {
    return capturedAmount;
  }

  public String getCurrency() {
    return currency;
  }

  public boolean isPreOrderPayment() {
    return preOrderPayment;
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
