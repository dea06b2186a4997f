package io.b2mash.commerce.reconciliation;

import io.b2mash.commerce.payment.PaymentStatus;
import java.util.Map;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Public webhook endpoints. Events that match no local payment are still acknowledged with 200 so
 * the processor stops retrying; only signature failures are rejected.
 */
@RestController
@RequestMapping("/payment/webhook")
public class PaymentWebhookController {

  private final PaymentWebhookService webhookService;

  public PaymentWebhookController(PaymentWebhookService webhookService) {
    this.webhookService = webhookService;
  }

  @PostMapping
  public ResponseEntity<WebhookResponse> handleActiveProviderWebhook(
      @RequestBody String payload, @RequestHeader Map<String, String> headers) {
    return ResponseEntity.ok(WebhookResponse.from(webhookService.ingest(null, headers, payload)));
  }

  @PostMapping("/{provider}")
  public ResponseEntity<WebhookResponse> handleWebhook(
      @PathVariable String provider,
      @RequestBody String payload,
      @RequestHeader Map<String, String> headers) {
    return ResponseEntity.ok(
        WebhookResponse.from(webhookService.ingest(provider, headers, payload)));
  }

  public record WebhookResponse(
      boolean received, String outcome, UUID paymentId, PaymentStatus status) {

    static WebhookResponse from(ReconciliationOutcome outcome) {
      return new WebhookResponse(
          true, outcome.result().name(), outcome.paymentId(), outcome.status());
    }
  }
}
