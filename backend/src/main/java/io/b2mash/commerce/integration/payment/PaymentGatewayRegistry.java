package io.b2mash.commerce.integration.payment;

import io.b2mash.commerce.config.PaymentProperties;
import io.b2mash.commerce.exception.ResourceNotFoundException;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Resolves {@link PaymentGateway} beans by {@link ProviderKind}. */
@Component
public class PaymentGatewayRegistry {

  private static final Logger log = LoggerFactory.getLogger(PaymentGatewayRegistry.class);

  private final Map<ProviderKind, PaymentGateway> gateways = new EnumMap<>(ProviderKind.class);
  private final PaymentProperties properties;

  public PaymentGatewayRegistry(List<PaymentGateway> gateways, PaymentProperties properties) {
    this.properties = properties;
    for (var gateway : gateways) {
      var previous = this.gateways.put(gateway.kind(), gateway);
      if (previous != null) {
        throw new IllegalStateException(
            "Duplicate payment gateway for "
                + gateway.kind()
                + ": "
                + previous.getClass().getName()
                + " and "
                + gateway.getClass().getName());
      }
    }
    log.info(
        "Registered payment gateways {}, active provider {}",
        this.gateways.keySet(),
        properties.activeProvider());
  }

  /** The processor new checkouts are opened with. */
  public PaymentGateway active() {
    return resolve(properties.activeProvider());
  }

  public PaymentGateway resolve(ProviderKind kind) {
    var gateway = gateways.get(kind);
    if (gateway == null) {
      throw new IllegalStateException("No payment gateway registered for " + kind);
    }
    return gateway;
  }

  public PaymentGateway resolveBySlug(String slug) {
    return ProviderKind.fromSlug(slug)
        .map(this::resolve)
        .orElseThrow(
            () ->
                ResourceNotFoundException.withDetail(
                    "Unknown payment provider", "No payment provider named '" + slug + "'"));
  }
}
