package io.b2mash.commerce.checkout;

import io.b2mash.commerce.security.AuthenticatedUser;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/payment/checkout")
public class CheckoutController {

  private final CheckoutService checkoutService;

  public CheckoutController(CheckoutService checkoutService) {
    this.checkoutService = checkoutService;
  }

  /**
   * Checks out the caller's cart with the active processor.
   *
   * @return 201 Created with the approval URL the shopper is redirected to
   */
  @PostMapping("/cart")
  @PreAuthorize("hasAnyRole('USER', 'ADMIN')")
  public ResponseEntity<CartCheckoutResult> checkoutCart(
      JwtAuthenticationToken authentication, @Valid @RequestBody CartCheckoutRequest request) {
    var result =
        checkoutService.checkoutCart(AuthenticatedUser.from(authentication), request.toDetails());
    return ResponseEntity.created(URI.create("/payment/status/" + result.paymentId()))
        .body(result);
  }

  @PostMapping("/subscription")
  @PreAuthorize("hasAnyRole('USER', 'ADMIN')")
  public ResponseEntity<SubscriptionCheckoutResult> checkoutSubscription(
      JwtAuthenticationToken authentication,
      @Valid @RequestBody SubscriptionCheckoutRequest request) {
    var result =
        checkoutService.checkoutSubscription(
            AuthenticatedUser.from(authentication), request.planId());
    return ResponseEntity.created(URI.create("/payment/status/" + result.paymentId()))
        .body(result);
  }

  public record CartCheckoutRequest(
      UUID deliveryAddressId,
      @Valid AddressRequest address,
      @Size(max = 50, message = "shippingService must be at most 50 characters")
          String shippingService) {

    DeliveryDetails toDetails() {
      return new DeliveryDetails(
          deliveryAddressId, address == null ? null : address.toNewAddress(), shippingService);
    }
  }

  public record AddressRequest(
      @NotBlank(message = "fullName is required") String fullName,
      @NotBlank(message = "line1 is required") String line1,
      String line2,
      @NotBlank(message = "city is required") String city,
      @NotBlank(message = "postcode is required") String postcode,
      @NotBlank(message = "country is required")
          @Size(min = 2, max = 2, message = "country must be an ISO 3166 alpha-2 code")
          String country,
      String phone) {

    DeliveryDetails.NewAddress toNewAddress() {
      return new DeliveryDetails.NewAddress(
          fullName, line1, line2, city, postcode, country, phone);
    }
  }

  public record SubscriptionCheckoutRequest(
      @NotNull(message = "planId is required") UUID planId) {}
}
