package io.b2mash.commerce.shipping;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.commerce.exception.InvalidStateException;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ShippingServiceTest {

  private final ShippingService service =
      new ShippingService(
          new ShippingProperties(
              "second-class",
              400,
              Map.of(
                  "second-class",
                  new ShippingProperties.ServiceRate(
                      "2nd Class",
                      List.of(
                          new ShippingProperties.WeightBand(10000, new BigDecimal("5.99")),
                          new ShippingProperties.WeightBand(2000, new BigDecimal("3.5")))),
                  "special",
                  new ShippingProperties.ServiceRate(
                      "Special Delivery",
                      List.of(new ShippingProperties.WeightBand(2000, new BigDecimal("8.50")))))));

  @Test
  void picksSmallestBandThatFitsDefaultService() {
    var quote = service.quote(1500, null);

    assertThat(quote.serviceKey()).isEqualTo("second-class");
    assertThat(quote.label()).isEqualTo("2nd Class");
    assertThat(quote.cost()).isEqualByComparingTo("3.50");
    assertThat(quote.cost().scale()).isEqualTo(2);
  }

  @Test
  void heavierParcelMovesToNextBand() {
    assertThat(service.quote(2001, "second-class").cost()).isEqualByComparingTo("5.99");
  }

  @Test
  void unknownServiceIsRejected() {
    assertThatThrownBy(() -> service.quote(100, "carrier-pigeon"))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void parcelOverTheHeaviestBandIsRejected() {
    assertThatThrownBy(() -> service.quote(2500, "special"))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void exposesDefaultItemWeight() {
    assertThat(service.defaultItemWeightGrams()).isEqualTo(400);
  }
}
