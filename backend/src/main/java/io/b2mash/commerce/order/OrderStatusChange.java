package io.b2mash.commerce.order;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import java.time.Instant;

/** One entry of an order's append-only status history. */
@Embeddable
public class OrderStatusChange {

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private OrderStatus status;

  @Column(name = "note", length = 500)
  private String note;

  @Column(name = "changed_at", nullable = false)
  private Instant changedAt;

  protected OrderStatusChange() {}

  OrderStatusChange(OrderStatus status, String note, Instant changedAt) {
    this.status = status;
    this.note = note;
    this.changedAt = changedAt;
  }

  public OrderStatus getStatus() {
    return status;
  }

  public String getNote() {
    return note;
  }

  public Instant getChangedAt() {
    return changedAt;
  }
}
