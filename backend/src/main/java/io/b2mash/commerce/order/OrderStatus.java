package io.b2mash.commerce.order;

public enum OrderStatus {
  PENDING,
  PROCESSING,
  DISPATCHED,
  IN_TRANSIT,
  DELIVERED,
  UNDELIVERED
}
