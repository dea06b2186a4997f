package io.b2mash.commerce.integration.payment;

import java.util.Map;

/** Servlet containers may hand headers over in any case. */
final class WebhookHeaders {

  private WebhookHeaders() {}

  static String get(Map<String, String> headers, String name) {
    if (headers == null) {
      return null;
    }
    return headers.entrySet().stream()
        .filter(e -> e.getKey().equalsIgnoreCase(name))
        .map(Map.Entry::getValue)
        .filter(value -> value != null && !value.isBlank())
        .findFirst()
        .orElse(null);
  }
}
