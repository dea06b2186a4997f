package io.b2mash.commerce.shipping;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Weight-banded shipping rates per carrier service. Bands are matched in ascending {@code
 * maxWeightGrams} order; the first band that fits the parcel wins.
 */
@ConfigurationProperties("commerce.shipping")
public record ShippingProperties(
    String defaultService, int defaultItemWeightGrams, Map<String, ServiceRate> services) {

  public record ServiceRate(String label, List<WeightBand> bands) {}

  public record WeightBand(int maxWeightGrams, BigDecimal price) {}
}
