package io.b2mash.commerce.catalog;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Sellable product as seen by checkout and reconciliation. Catalog content (descriptions, media)
 * is owned elsewhere; this view carries price, stock, publication and line discount only.
 */
@Entity
@Table(name = "store_items")
public class StoreItem {

  @Id
  @Column(name = "id", nullable = false, updatable = false)
  private UUID id;

  @Column(name = "name", nullable = false, length = 255)
  private String name;

  @Column(name = "price", nullable = false, precision = 14, scale = 2)
  private BigDecimal price;

  @Column(name = "stock", nullable = false)
  private int stock;

  @Column(name = "published", nullable = false)
  private boolean published;

  @Column(name = "pre_order_enabled", nullable = false)
  private boolean preOrderEnabled;

  @Enumerated(EnumType.STRING)
  @Column(name = "discount_type", nullable = false, length = 20)
  private DiscountType discountType = DiscountType.NONE;

  @Column(name = "discount_value", precision = 14, scale = 2)
  private BigDecimal discountValue;

  @Column(name = "discount_active", nullable = false)
  private boolean discountActive;

  @Column(name = "discount_start")
  private Instant discountStart;

  @Column(name = "discount_end")
  private Instant discountEnd;

  @Column(name = "weight_grams")
  private Integer weightGrams;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected StoreItem() {}

  public StoreItem(UUID id, String name, BigDecimal price, int stock) {
    this.id = Objects.requireNonNull(id, "id must not be null");
    this.name = Objects.requireNonNull(name, "name must not be null");
    this.price = Objects.requireNonNull(price, "price must not be null");
    this.stock = stock;
    this.published = true;
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

  public void applyLineDiscount(
      DiscountType type, BigDecimal value, Instant startsAt, Instant endsAt) {
    this.discountType = Objects.requireNonNull(type, "type must not be null");
    this.discountValue = value;
    this.discountActive = type != DiscountType.NONE;
    this.discountStart = startsAt;
    this.discountEnd = endsAt;
  }

  public void setPublished(boolean published) {
    this.published = published;
  }

  public void setPreOrderEnabled(boolean preOrderEnabled) {
    this.preOrderEnabled = preOrderEnabled;
  }

  public void setWeightGrams(Integer weightGrams) {
    this.weightGrams = weightGrams;
  }

  public UUID getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public BigDecimal getPrice() {
    return price;
  }

  public int getStock() {
    return stock;
  }

  public boolean isPublished() {
    return published;
  }

  public boolean isPreOrderEnabled() {
    return preOrderEnabled;
  }

  public DiscountType getDiscountType() {
    return discountType;
  }

  public BigDecimal getDiscountValue() {
    return discountValue;
  }

  public boolean isDiscountActive() {
    return discountActive;
  }

  public Instant getDiscountStart() {
    return discountStart;
  }

  public Instant getDiscountEnd() {
    return discountEnd;
  }

  public Integer getWeightGrams() {
    return weightGrams;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
