package io.b2mash.commerce.integration.payment;

import java.util.Arrays;
import java.util.Optional;

/** Payment processors this service can talk to. The slug appears in webhook URLs and config. */
public enum ProviderKind {
  STRIPE("stripe"),
  PAYPAL("paypal");

  private final String slug;

  ProviderKind(String slug) {
    this.slug = slug;
  }

  public String slug() {
    return slug;
  }

  public static Optional<ProviderKind> fromSlug(String slug) {
    return Arrays.stream(values()).filter(kind -> kind.slug.equalsIgnoreCase(slug)).findFirst();
  }
}
