package io.b2mash.commerce.payment;

import java.util.Arrays;

/** What a payment pays for. The wire value is the {@code type} tag of the stored metadata. */
public enum PaymentType {
  STORE_CHECKOUT("store_checkout"),
  SUBSCRIPTION("subscription");

  private final String wireValue;

  PaymentType(String wireValue) {
    this.wireValue = wireValue;
  }

  public String wireValue() {
    return wireValue;
  }

  public static PaymentType fromWireValue(String value) {
    return Arrays.stream(values())
        .filter(type -> type.wireValue.equals(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown payment type: " + value));
  }
}
