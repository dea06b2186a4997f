package io.b2mash.commerce.checkout;

import java.math.BigDecimal;
import java.util.UUID;

public record SubscriptionCheckoutResult(
    UUID paymentId,
    String subscriptionId,
    String providerRef,
    String approvalUrl,
    String planName,
    BigDecimal amount,
    String currency) {}
