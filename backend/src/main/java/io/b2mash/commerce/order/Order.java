package io.b2mash.commerce.order;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * A store order, created together with its payment at checkout. Entity name differs from the class
 * name because ORDER is a reserved word in JPQL.
 */
@Entity(name = "StoreOrder")
@Table(name = "orders")
public class Order {

  @Id
  @Column(name = "id", nullable = false, updatable = false)
  private UUID id;

  @Column(name = "user_id", nullable = false)
  private UUID userId;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private OrderStatus status;

  @Column(name = "payment_id", nullable = false, unique = true)
  private UUID paymentId;

  @Column(name = "total_amount", nullable = false, precision = 14, scale = 2)
  private BigDecimal totalAmount;

  @Column(name = "shipping_cost", nullable = false, precision = 14, scale = 2)
  private BigDecimal shippingCost;

  @Column(name = "shipping_service", length = 50)
  private String shippingServiceKey;

  @Column(name = "is_pre_order", nullable = false)
  private boolean preOrder;

  @Enumerated(EnumType.STRING)
  @Column(name = "pre_order_status", length = 20)
  private PreOrderStatus preOrderStatus;

  @Column(name = "delivery_address_id")
  private UUID deliveryAddressId;

  @ElementCollection(fetch = FetchType.EAGER)
  @CollectionTable(name = "order_status_history", joinColumns = @JoinColumn(name = "order_id"))
  @OrderColumn(name = "entry_index")
  private List<OrderStatusChange> statusHistory = new ArrayList<>();

  @Version
  @Column(name = "version")
  private Long version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Order() {}

  public Order(
      UUID id,
      UUID userId,
      UUID paymentId,
      BigDecimal totalAmount,
      BigDecimal shippingCost,
      String shippingServiceKey,
      boolean preOrder,
      UUID deliveryAddressId) {
    this.id = Objects.requireNonNull(id, "id must not be null");
    this.userId = Objects.requireNonNull(userId, "userId must not be null");
    this.paymentId = Objects.requireNonNull(paymentId, "paymentId must not be null");
    this.totalAmount = Objects.requireNonNull(totalAmount, "totalAmount must not be null");
    this.shippingCost = Objects.requireNonNull(shippingCost, "shippingCost must not be null");
    this.shippingServiceKey = shippingServiceKey;
    this.preOrder = preOrder;
    this.preOrderStatus = preOrder ? PreOrderStatus.PLACED : null;
    this.deliveryAddressId = deliveryAddressId;
    this.status = OrderStatus.PENDING;
    this.statusHistory.add(
        new OrderStatusChange(OrderStatus.PENDING, "Order placed", Instant.now()));
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

  public void changeStatus(OrderStatus newStatus, String note) {
    this.status = Objects.requireNonNull(newStatus, "newStatus must not be null");
    statusHistory.add(new OrderStatusChange(newStatus, note, Instant.now()));
  }

  /** Records a note against the current status without changing it. */
  public void addHistoryNote(String note) {
    statusHistory.add(new OrderStatusChange(status, note, Instant.now()));
  }

  public void changePreOrderStatus(PreOrderStatus newStatus, String note) {
    if (!preOrder) {
      throw new IllegalStateException("Order " + id + " is not a pre-order");
    }
    this.preOrderStatus = newStatus;
    addHistoryNote(note);
  }

  public UUID getId() {
    return id;
  }

  public UUID getUserId() {
    return userId;
  }

  public OrderStatus getStatus() {
    return status;
  }

  public UUID getPaymentId() {
    return paymentId;
  }

  public BigDecimal getTotalAmount() {
    return totalAmount;
  }

  public BigDecimal getShippingCost() {
    return shippingCost;
  }

  public String getShippingServiceKey() {
    return shippingServiceKey;
  }

  public boolean isPreOrder() {
    return preOrder;
  }

  public PreOrderStatus getPreOrderStatus() {
    return preOrderStatus;
  }

  public UUID getDeliveryAddressId() {
    return deliveryAddressId;
  }

  public List<OrderStatusChange> getStatusHistory() {
    return Collections.unmodifiableList(statusHistory);
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
