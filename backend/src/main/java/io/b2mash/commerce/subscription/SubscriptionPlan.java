package io.b2mash.commerce.subscription;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

@Entity
@Table(name = "subscription_plans")
public class SubscriptionPlan {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "name", nullable = false, length = 120)
  private String name;

  @Column(name = "description", columnDefinition = "TEXT")
  private String description;

  @Column(name = "price", nullable = false, precision = 14, scale = 2)
  private BigDecimal price;

  @Column(name = "currency", nullable = false, length = 3)
  private String currency;

  @Column(name = "duration_days", nullable = false)
  private int durationDays;

  @Column(name = "active", nullable = false)
  private boolean active;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected SubscriptionPlan() {}

  public SubscriptionPlan(String name, BigDecimal price, String currency, int durationDays) {
    this.name = Objects.requireNonNull(name, "name must not be null");
    this.price = Objects.requireNonNull(price, "price must not be null");
    this.currency = Objects.requireNonNull(currency, "currency must not be null");
    if (durationDays < 1) {
      throw new IllegalArgumentException("durationDays must be positive");
    }
    this.durationDays = durationDays;
    this.active = true;
  }

  @PrePersist
  void onCreate() {
    this.createdAt = Instant.now();
  }

  public void deactivate() {
    this.active = false;
  }

  public void setDescription(String description) {
    this.description = description;
  }

  public UUID getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public String getDescription() {
    return description;
  }

  public BigDecimal getPrice() {
    return price;
  }

  public String getCurrency() {
    return currency;
  }

  public int getDurationDays() {
    return durationDays;
  }

  public boolean isActive() {
    return active;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
