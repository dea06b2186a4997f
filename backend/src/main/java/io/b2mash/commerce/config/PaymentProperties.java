package io.b2mash.commerce.config;

import io.b2mash.commerce.integration.payment.ProviderKind;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Payment processor settings. {@code serverUrl} is this service's public base URL (used for
 * processor return URLs); {@code frontendUrl} is where redirect endpoints send the shopper.
 */
@ConfigurationProperties("commerce.payment")
public record PaymentProperties(
    ProviderKind activeProvider,
    String serverUrl,
    String frontendUrl,
    String currency,
    Timeouts timeouts,
    Stripe stripe,
    PayPal paypal) {

  public record Timeouts(Duration connect, Duration read) {}

  public record Stripe(String apiKey, String webhookSecret) {}

  public record PayPal(
      String clientId, String clientSecret, String mode, String webhookId, String brandName) {

    public boolean live() {
      return "live".equalsIgnoreCase(mode);
    }
  }
}
