package io.b2mash.commerce.order;

public enum PreOrderStatus {
  PLACED,
  CONFIRMED,
  FULFILLED,
  CANCELLED
}
