package io.b2mash.commerce.integration.payment;

/** A processor checkout session: its reference and the URL the shopper is sent to. */
public record PaymentSession(String providerRef, String approvalUrl) {}
