package io.b2mash.commerce.shipping;

import io.b2mash.commerce.exception.InvalidStateException;
import java.math.RoundingMode;
import java.util.Comparator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Quotes a shipping cost for a parcel from the configured weight bands. */
@Service
public class ShippingService {

  private static final Logger log = LoggerFactory.getLogger(ShippingService.class);

  private final ShippingProperties properties;

  public ShippingService(ShippingProperties properties) {
    this.properties = properties;
  }

  public ShippingQuote quote(int totalWeightGrams, String requestedService) {
    var serviceKey =
        (requestedService == null || requestedService.isBlank())
            ? properties.defaultService()
            : requestedService;
    var rate = properties.services() == null ? null : properties.services().get(serviceKey);
    if (rate == null) {
      throw new InvalidStateException(
          "Unknown shipping service", "Shipping service '" + serviceKey + "' is not available");
    }

    var band =
        rate.bands().stream()
            .sorted(Comparator.comparingInt(ShippingProperties.WeightBand::maxWeightGrams))
            .filter(b -> totalWeightGrams <= b.maxWeightGrams())
            .findFirst()
            .orElseThrow(
                () ->
                    new InvalidStateException(
                        "Parcel too heavy",
                        "A parcel of "
                            + totalWeightGrams
                            + "g exceeds the limit of shipping service "
                            + serviceKey));

    log.debug(
        "Shipping quote for {}g via {}: {}", totalWeightGrams, serviceKey, band.price());
    return new ShippingQuote(
        serviceKey, rate.label(), totalWeightGrams, band.price().setScale(2, RoundingMode.HALF_UP));
  }

  /** Weight used for products without a recorded weight. */
  public int defaultItemWeightGrams() {
    return properties.defaultItemWeightGrams();
  }
}
