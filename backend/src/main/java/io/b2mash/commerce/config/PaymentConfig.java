package io.b2mash.commerce.config;

import io.b2mash.commerce.shipping.ShippingProperties;
import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties({PaymentProperties.class, ShippingProperties.class})
public class PaymentConfig {

  @Bean
  RestClient payPalRestClient(RestClient.Builder builder, PaymentProperties properties) {
    var requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.timeouts().connect());
    requestFactory.setReadTimeout(properties.timeouts().read());
    return builder.requestFactory(requestFactory).build();
  }

  @Bean
  Clock clock() {
    return Clock.systemUTC();
  }
}
