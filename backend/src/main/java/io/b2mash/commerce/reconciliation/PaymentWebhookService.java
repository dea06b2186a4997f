package io.b2mash.commerce.reconciliation;

import io.b2mash.commerce.exception.WebhookVerificationException;
import io.b2mash.commerce.integration.payment.PaymentGateway;
import io.b2mash.commerce.integration.payment.PaymentGatewayRegistry;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Verifies, parses and reconciles processor webhooks. Calls back to the processor (correlation
 * lookups) happen before the reconciliation transaction opens.
 */
@Service
public class PaymentWebhookService {

  private static final Logger log = LoggerFactory.getLogger(PaymentWebhookService.class);

  private final PaymentGatewayRegistry gatewayRegistry;
  private final PaymentReconciliationService reconciliationService;

  public PaymentWebhookService(
      PaymentGatewayRegistry gatewayRegistry,
      PaymentReconciliationService reconciliationService) {
    this.gatewayRegistry = gatewayRegistry;
    this.reconciliationService = reconciliationService;
  }

  /**
   * Ingests a webhook for the named provider, or the active provider when {@code providerSlug} is
   * null.
   *
   * @throws WebhookVerificationException if the signature does not verify
   */
  public ReconciliationOutcome ingest(
      String providerSlug, Map<String, String> headers, String rawBody) {
    var gateway =
        providerSlug == null
            ? gatewayRegistry.active()
            : gatewayRegistry.resolveBySlug(providerSlug);
    return ingest(gateway, headers, rawBody);
  }

  private ReconciliationOutcome ingest(
      PaymentGateway gateway, Map<String, String> headers, String rawBody) {
    var provider = gateway.kind().slug();
    if (!gateway.verifyWebhook(headers, rawBody)) {
      log.warn("Rejected {} webhook: signature verification failed", provider);
      throw new WebhookVerificationException(provider);
    }

    var event = gateway.parseWebhook(rawBody);
    if (!gateway.isPaymentRelevant(event.eventType())) {
      log.debug("Ignoring {} webhook {}: not payment related", provider, event.eventType());
      return ReconciliationOutcome.ignored("Event " + event.eventType() + " not payment related");
    }

    if (event.correlationDeferred() && event.providerRef() != null) {
      var fetched = gateway.fetchCorrelationMetadata(event.providerRef());
      if (fetched.isPresent()) {
        event = event.withCorrelation(fetched.get());
      }
    }

    var outcome = reconciliationService.reconcile(event);
    log.info(
        "Processed {} webhook {}: {} (payment={})",
        provider,
        event.eventType(),
        outcome.result(),
        outcome.paymentId());
    return outcome;
  }
}
