package io.b2mash.commerce.subscription;

import io.b2mash.commerce.security.AuthenticatedUser;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/payment/subscriptions")
public class SubscriptionController {

  private final SubscriptionQueryService subscriptionQueryService;

  public SubscriptionController(SubscriptionQueryService subscriptionQueryService) {
    this.subscriptionQueryService = subscriptionQueryService;
  }

  @GetMapping("/me")
  @PreAuthorize("hasAnyRole('USER', 'ADMIN')")
  public ResponseEntity<SubscriptionQueryService.SubscriptionStatus> currentSubscription(
      JwtAuthenticationToken authentication) {
    var user = AuthenticatedUser.from(authentication);
    return ResponseEntity.ok(subscriptionQueryService.currentStatus(user.userId()));
  }

  @GetMapping("/me/history")
  @PreAuthorize("hasAnyRole('USER', 'ADMIN')")
  public ResponseEntity<List<SubscriptionView>> subscriptionHistory(
      JwtAuthenticationToken authentication) {
    var user = AuthenticatedUser.from(authentication);
    return ResponseEntity.ok(subscriptionQueryService.history(user.userId()));
  }
}
