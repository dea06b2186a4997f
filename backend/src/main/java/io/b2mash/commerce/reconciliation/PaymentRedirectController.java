package io.b2mash.commerce.reconciliation;

import io.b2mash.commerce.config.PaymentProperties;
import java.net.URI;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponseException;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Landing endpoints for shoppers returning from a hosted checkout. Both always answer with a
 * redirect to the storefront; failures are reported in the query string.
 */
@RestController
@RequestMapping("/payment/redirect")
public class PaymentRedirectController {

  private static final Logger log = LoggerFactory.getLogger(PaymentRedirectController.class);

  private final PaymentCaptureService captureService;
  private final PaymentProperties properties;

  public PaymentRedirectController(
      PaymentCaptureService captureService, PaymentProperties properties) {
    this.captureService = captureService;
    this.properties = properties;
  }

  /** Stripe returns {@code session_id}, PayPal returns {@code token}. */
  @GetMapping("/success")
  public ResponseEntity<Void> success(
      @RequestParam(name = "session_id", required = false) String sessionId,
      @RequestParam(name = "token", required = false) String token) {
    var providerRef = sessionId != null ? sessionId : token;
    if (providerRef == null || providerRef.isBlank()) {
      return redirect(frontend("/payment/failure").queryParam("reason", "missing_reference"));
    }
    try {
      var outcome = captureService.capture(providerRef);
      return redirect(
          frontend("/payment/success")
              .queryParam("paymentId", outcome.paymentId())
              .queryParam("status", outcome.status()));
    } catch (ErrorResponseException e) {
      log.warn("Capture on return failed for {}: {}", providerRef, e.getBody().getDetail());
      return redirect(
          frontend("/payment/failure").queryParam("reason", e.getBody().getTitle()));
    }
  }

  /** PayPal passes the order token back on cancel; the processor confirms the cancellation. */
  @GetMapping("/cancel")
  public ResponseEntity<Void> cancel(@RequestParam(name = "token", required = false) String token) {
    var target = frontend("/payment/cancel");
    if (token != null && !token.isBlank()) {
      try {
        var outcome = captureService.cancel(token);
        target.queryParam("paymentId", outcome.paymentId()).queryParam("status", outcome.status());
      } catch (ErrorResponseException e) {
        log.warn("Could not cancel payment for token {}: {}", token, e.getBody().getDetail());
      }
    }
    return redirect(target);
  }

  private UriComponentsBuilder frontend(String path) {
    return UriComponentsBuilder.fromUriString(properties.frontendUrl()).path(path);
  }

  private static ResponseEntity<Void> redirect(UriComponentsBuilder target) {
    URI location = target.encode().build().toUri();
    return ResponseEntity.status(HttpStatus.FOUND).location(location).build();
  }
}
