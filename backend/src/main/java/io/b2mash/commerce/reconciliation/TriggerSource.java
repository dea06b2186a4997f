package io.b2mash.commerce.reconciliation;

/** Entry point that asked for a payment transition. */
public enum TriggerSource {
  WEBHOOK,
  CAPTURE,
  FALLBACK,
  REDIRECT
}
