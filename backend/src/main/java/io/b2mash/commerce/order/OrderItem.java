package io.b2mash.commerce.order;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.util.Objects;
import java.util.UUID;

/** Snapshot of a cart line at checkout. {@code price} is the effective unit price paid. */
@Entity
@Table(name = "order_items")
public class OrderItem {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "order_id", nullable = false)
  private UUID orderId;

  @Column(name = "product_id", nullable = false)
  private UUID productId;

  @Column(name = "product_name", nullable = false, length = 255)
  private String productName;

  @Column(name = "quantity", nullable = false)
  private int quantity;

  @Column(name = "price", nullable = false, precision = 14, scale = 2)
  private BigDecimal price;

  /** Pre-order line: stock is taken when the product is released, not when payment settles. */
  @Column(name = "stock_deferred", nullable = false)
  private boolean stockDeferred;

  protected OrderItem() {}

  public OrderItem(
      UUID orderId,
      UUID productId,
      String productName,
      int quantity,
      BigDecimal price,
      boolean stockDeferred) {
    this.orderId = Objects.requireNonNull(orderId, "orderId must not be null");
    this.productId = Objects.requireNonNull(productId, "productId must not be null");
    this.productName = Objects.requireNonNull(productName, "productName must not be null");
    this.quantity = quantity;
    this.price = Objects.requireNonNull(price, "price must not be null");
    this.stockDeferred = stockDeferred;
  }

  public UUID getId() {
    return id;
  }

  public UUID getOrderId() {
    return orderId;
  }

  public UUID getProductId() {
    return productId;
  }

  public String getProductName() {
    return productName;
  }

  public int getQuantity() {
    return quantity;
  }

  public BigDecimal getPrice() {
    return price;
  }

  public boolean isStockDeferred() {
    return stockDeferred;
  }
}
