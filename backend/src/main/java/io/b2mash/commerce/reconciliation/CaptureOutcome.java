package io.b2mash.commerce.reconciliation;

import io.b2mash.commerce.payment.PaymentStatus;
import java.util.List;
import java.util.UUID;

/** State of a payment after the customer returned from the processor. */
public record CaptureOutcome(
    UUID paymentId, PaymentStatus status, List<UUID> orderIds, List<String> subscriptionIds) {}
