package io.b2mash.commerce.payment;

import io.b2mash.commerce.reconciliation.CaptureOutcome;
import io.b2mash.commerce.reconciliation.FallbackVerificationService;
import io.b2mash.commerce.reconciliation.PaymentCaptureService;
import io.b2mash.commerce.reconciliation.ReconciliationOutcome;
import io.b2mash.commerce.security.AuthenticatedUser;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/payment")
public class PaymentController {

  private final PaymentQueryService paymentQueryService;
  private final FallbackVerificationService fallbackVerificationService;
  private final PaymentCaptureService captureService;

  public PaymentController(
      PaymentQueryService paymentQueryService,
      FallbackVerificationService fallbackVerificationService,
      PaymentCaptureService captureService) {
    this.paymentQueryService = paymentQueryService;
    this.fallbackVerificationService = fallbackVerificationService;
    this.captureService = captureService;
  }

  /**
   * Confirms a payment after the shopper approved it at the processor. Public: the token is the
   * processor reference the shopper was sent back with.
   */
  @PostMapping("/capture")
  public ResponseEntity<CaptureOutcome> capture(@Valid @RequestBody CaptureRequest request) {
    return ResponseEntity.ok(captureService.capture(request.token()));
  }

  @GetMapping("/status/{paymentId}")
  @PreAuthorize("hasAnyRole('USER', 'ADMIN')")
  public ResponseEntity<PaymentDetails> getPayment(
      @PathVariable UUID paymentId, JwtAuthenticationToken authentication) {
    return ResponseEntity.ok(
        paymentQueryService.getPaymentDetails(
            paymentId, AuthenticatedUser.from(authentication)));
  }

  /** Pulls the payment's state from its processor when the webhook is late or lost. */
  @PostMapping("/status/{paymentId}/verify")
  @PreAuthorize("hasAnyRole('USER', 'ADMIN')")
  public ResponseEntity<ReconciliationOutcome> verifyPayment(
      @PathVariable UUID paymentId, JwtAuthenticationToken authentication) {
    paymentQueryService.requireAccess(paymentId, AuthenticatedUser.from(authentication));
    return ResponseEntity.ok(fallbackVerificationService.verifyPaymentStatus(paymentId));
  }

  public record CaptureRequest(@NotBlank(message = "token is required") String token) {}
}
