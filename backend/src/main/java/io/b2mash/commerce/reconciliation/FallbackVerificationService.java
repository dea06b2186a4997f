package io.b2mash.commerce.reconciliation;

import io.b2mash.commerce.exception.ResourceNotFoundException;
import io.b2mash.commerce.integration.payment.PaymentGatewayRegistry;
import io.b2mash.commerce.payment.PaymentRepository;
import io.b2mash.commerce.payment.PaymentStatus;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Asks the processor directly for the state of a payment whose webhook never arrived. */
@Service
public class FallbackVerificationService {

  private static final Logger log = LoggerFactory.getLogger(FallbackVerificationService.class);

  private final PaymentRepository paymentRepository;
  private final PaymentGatewayRegistry gatewayRegistry;
  private final PaymentReconciliationService reconciliationService;

  public FallbackVerificationService(
      PaymentRepository paymentRepository,
      PaymentGatewayRegistry gatewayRegistry,
      PaymentReconciliationService reconciliationService) {
    this.paymentRepository = paymentRepository;
    this.gatewayRegistry = gatewayRegistry;
    this.reconciliationService = reconciliationService;
  }

  /**
   * Re-checks a pending payment with its processor and applies any terminal status through the
   * normal reconciliation path. Settled payments are returned as they are.
   */
  public ReconciliationOutcome verifyPaymentStatus(UUID paymentId) {
    var payment =
        paymentRepository
            .findById(paymentId)
            .orElseThrow(() -> new ResourceNotFoundException("Payment", paymentId));
    if (payment.getStatus() != PaymentStatus.PENDING) {
      return ReconciliationOutcome.unchanged(paymentId, payment.getStatus(), "Already settled");
    }

    var gateway = gatewayRegistry.resolve(payment.getProvider());
    var result = gateway.verifyPaymentStatus(payment.getProviderRef());
    log.info(
        "Processor reports {} for pending payment {} ({})",
        result.status(),
        paymentId,
        payment.getProvider());
    if (result.status() == PaymentStatus.PENDING) {
      return ReconciliationOutcome.unchanged(paymentId, PaymentStatus.PENDING, "Still pending");
    }
    return reconciliationService.applyTransition(
        paymentId, result.status(), TransitionTrigger.fallback(result));
  }
}
