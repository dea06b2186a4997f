package io.b2mash.commerce.checkout;

import java.util.UUID;

/**
 * Where and how a store order ships. Either {@code addressId} names a saved address of the buyer,
 * or {@code address} carries a new one that is saved with the order.
 */
public record DeliveryDetails(UUID addressId, NewAddress address, String shippingService) {

  public record NewAddress(
      String fullName,
      String line1,
      String line2,
      String city,
      String postcode,
      String country,
      String phone) {}
}
