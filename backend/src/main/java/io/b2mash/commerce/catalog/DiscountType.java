package io.b2mash.commerce.catalog;

public enum DiscountType {
  NONE,
  PERCENTAGE,
  FLAT
}
