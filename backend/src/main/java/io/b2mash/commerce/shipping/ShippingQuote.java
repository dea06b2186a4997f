package io.b2mash.commerce.shipping;

import java.math.BigDecimal;

public record ShippingQuote(
    String serviceKey, String label, int totalWeightGrams, BigDecimal cost) {}
