package io.b2mash.commerce.checkout;

import java.math.BigDecimal;
import java.util.UUID;

public record CartCheckoutResult(
    UUID paymentId,
    UUID orderId,
    String providerRef,
    String approvalUrl,
    BigDecimal subtotal,
    BigDecimal discountTotal,
    BigDecimal shippingCost,
    BigDecimal total,
    String currency,
    boolean preOrder) {}
