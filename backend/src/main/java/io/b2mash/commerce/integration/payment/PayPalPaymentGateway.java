package io.b2mash.commerce.integration.payment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.b2mash.commerce.config.PaymentProperties;
import io.b2mash.commerce.exception.PaymentProviderException;
import io.b2mash.commerce.payment.PaymentStatus;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * PayPal Orders v2 adapter over the REST API. The shopper approves the order on PayPal and is sent
 * back to the capture redirect; webhooks are verified by PayPal's verify-webhook-signature
 * endpoint. The internal payment id travels as the purchase unit's {@code custom_id}.
 */
@Component
public class PayPalPaymentGateway implements PaymentGateway {

  private static final Logger log = LoggerFactory.getLogger(PayPalPaymentGateway.class);

  private static final String SANDBOX_URL = "https://api-m.sandbox.paypal.com";
  private static final String LIVE_URL = "https://api-m.paypal.com";

  private static final List<String> IRRELEVANT_PREFIXES =
      List.of("CUSTOMER.", "IDENTITY.", "MERCHANT.", "VAULT.", "CATALOG.");

  private static final List<String> SIGNATURE_HEADERS =
      List.of(
          "PAYPAL-AUTH-ALGO",
          "PAYPAL-CERT-URL",
          "PAYPAL-TRANSMISSION-ID",
          "PAYPAL-TRANSMISSION-SIG",
          "PAYPAL-TRANSMISSION-TIME");

  private static final String TOKEN_KEY = "access-token";

  private final PaymentProperties properties;
  private final RestClient restClient;
  private final ObjectMapper objectMapper;
  private final Cache<String, String> accessTokens =
      Caffeine.newBuilder().expireAfterWrite(Duration.ofMinutes(30)).maximumSize(1).build();

  public PayPalPaymentGateway(
      PaymentProperties properties,
      @Qualifier("payPalRestClient") RestClient restClient,
      ObjectMapper objectMapper) {
    this.properties = properties;
    this.restClient = restClient;
    this.objectMapper = objectMapper;
  }

  @Override
  public ProviderKind kind() {
    return ProviderKind.PAYPAL;
  }

  @Override
  public PaymentSession initializePayment(PaymentInitRequest request) {
    var purchaseUnit = new LinkedHashMap<String, Object>();
    purchaseUnit.put("reference_id", request.referenceId());
    purchaseUnit.put("custom_id", request.paymentId().toString());
    if (request.description() != null) {
      purchaseUnit.put("description", truncate(request.description(), 127));
    }
    purchaseUnit.put(
        "amount",
        Map.of(
            "currency_code", request.currency().toUpperCase(),
            "value", formatAmount(request.amount())));

    var experience = new LinkedHashMap<String, Object>();
    if (properties.paypal().brandName() != null) {
      experience.put("brand_name", properties.paypal().brandName());
    }
    experience.put("user_action", "PAY_NOW");
    experience.put("shipping_preference", "NO_SHIPPING");
    experience.put("return_url", properties.serverUrl() + "/payment/redirect/success");
    experience.put("cancel_url", properties.serverUrl() + "/payment/redirect/cancel");

    var body =
        Map.of(
            "intent", "CAPTURE",
            "purchase_units", List.of(purchaseUnit),
            "payment_source", Map.of("paypal", Map.of("experience_context", experience)));

    try {
      var response =
          restClient
              .post()
              .uri(baseUrl() + "/v2/checkout/orders")
              .headers(
                  h -> {
                    h.setBearerAuth(accessToken());
                    h.set("PayPal-Request-Id", request.paymentId().toString());
                  })
              .contentType(MediaType.APPLICATION_JSON)
              .body(body)
              .retrieve()
              .body(JsonNode.class);
      var orderId = response.path("id").asText(null);
      var approvalUrl = link(response, "payer-action", "approve");
      if (orderId == null || approvalUrl == null) {
        throw new PaymentProviderException(
            kind().slug(), "PayPal order response has no id or approval link", true);
      }
      log.info("Created PayPal order {} for payment {}", orderId, request.paymentId());
      return new PaymentSession(orderId, approvalUrl);
    } catch (RestClientException e) {
      throw new PaymentProviderException(
          kind().slug(), "PayPal order creation failed: " + e.getMessage(), true, e);
    }
  }

  @Override
  public CaptureResult capturePayment(String providerRef) {
    try {
      var response =
          restClient
              .post()
              .uri(baseUrl() + "/v2/checkout/orders/{id}/capture", providerRef)
              .headers(
                  h -> {
                    h.setBearerAuth(accessToken());
                    h.set("PayPal-Request-Id", "capture-" + providerRef);
                  })
              .contentType(MediaType.APPLICATION_JSON)
              .body("{}")
              .retrieve()
              .body(JsonNode.class);
      return toCaptureResult(response);
    } catch (HttpClientErrorException e) {
      if (e.getStatusCode().value() == 422
          && e.getResponseBodyAsString().contains("ORDER_ALREADY_CAPTURED")) {
        log.info("PayPal order {} already captured, reading its status", providerRef);
        return verifyPaymentStatus(providerRef);
      }
      throw new PaymentProviderException(
          kind().slug(), "PayPal capture rejected for order " + providerRef, false, e);
    } catch (RestClientException e) {
      throw new PaymentProviderException(
          kind().slug(), "PayPal capture failed for order " + providerRef, true, e);
    }
  }

  @Override
  public CaptureResult verifyPaymentStatus(String providerRef) {
    try {
      var response =
          restClient
              .get()
              .uri(baseUrl() + "/v2/checkout/orders/{id}", providerRef)
              .headers(h -> h.setBearerAuth(accessToken()))
              .retrieve()
              .body(JsonNode.class);
      return toCaptureResult(response);
    } catch (RestClientException e) {
      throw new PaymentProviderException(
          kind().slug(), "PayPal order lookup failed for " + providerRef, true, e);
    }
  }

  /** An approved PayPal order only moves funds when this service captures it. */
  @Override
  public boolean cancelSession(String providerRef) {
    return true;
  }

  @Override
  public boolean verifyWebhook(Map<String, String> headers, String rawBody) {
    if (rawBody == null || rawBody.isBlank()) {
      log.warn("PayPal webhook has no raw body, rejecting");
      return false;
    }
    var webhookId = properties.paypal().webhookId();
    if (webhookId == null || webhookId.isBlank()) {
      log.warn("PayPal webhook id is not configured, rejecting webhook");
      return false;
    }
    var values = new LinkedHashMap<String, String>();
    for (var header : SIGNATURE_HEADERS) {
      var value = WebhookHeaders.get(headers, header);
      if (value == null) {
        log.warn("PayPal webhook missing {} header", header);
        return false;
      }
      values.put(header, value);
    }

    try {
      var request =
          objectMapper
              .createObjectNode()
              .put("auth_algo", values.get("PAYPAL-AUTH-ALGO"))
              .put("cert_url", values.get("PAYPAL-CERT-URL"))
              .put("transmission_id", values.get("PAYPAL-TRANSMISSION-ID"))
              .put("transmission_sig", values.get("PAYPAL-TRANSMISSION-SIG"))
              .put("transmission_time", values.get("PAYPAL-TRANSMISSION-TIME"))
              .put("webhook_id", webhookId);
      var json = objectMapper.writeValueAsString(request);
      // The event goes back exactly as received; re-serialising it breaks the signature.
      var body = json.substring(0, json.length() - 1) + ",\"webhook_event\":" + rawBody + "}";

      var response =
          restClient
              .post()
              .uri(baseUrl() + "/v1/notifications/verify-webhook-signature")
              .headers(h -> h.setBearerAuth(accessToken()))
              .contentType(MediaType.APPLICATION_JSON)
              .body(body)
              .retrieve()
              .body(JsonNode.class);
      var status = response.path("verification_status").asText("");
      if (!"SUCCESS".equals(status)) {
        log.warn("PayPal webhook signature verification returned {}", status);
        return false;
      }
      return true;
    } catch (JsonProcessingException | RestClientException | PaymentProviderException e) {
      log.warn("PayPal webhook verification could not be completed: {}", e.getMessage());
      return false;
    }
  }

  @Override
  public WebhookResult parseWebhook(String rawBody) {
    JsonNode root;
    try {
      root = objectMapper.readTree(rawBody);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Malformed PayPal webhook payload", e);
    }
    var eventType = root.path("event_type").asText("");
    var resource = root.path("resource");
    var status = eventStatus(eventType);
    if (status == null) {
      log.debug("PayPal webhook: unhandled event type '{}'", eventType);
      return WebhookResult.unhandled(eventType);
    }

    boolean captureEvent = eventType.startsWith("PAYMENT.CAPTURE.");
    var orderId =
        captureEvent
            ? textOrNull(resource.path("supplementary_data").path("related_ids").path("order_id"))
            : textOrNull(resource.path("id"));
    var customId =
        resource.hasNonNull("custom_id")
            ? resource.path("custom_id").asText()
            : textOrNull(resource.path("purchase_units").path(0).path("custom_id"));
    var correlation =
        new CorrelationMetadata(CorrelationMetadata.uuid(customId), null, null, null, null);
    var transactionId = captureEvent ? textOrNull(resource.path("id")) : null;
    return WebhookResult.of(eventType, orderId, status, correlation, transactionId);
  }

  @Override
  public boolean isPaymentRelevant(String eventType) {
    if (eventType == null) {
      return false;
    }
    return IRRELEVANT_PREFIXES.stream().noneMatch(eventType::startsWith);
  }

  static PaymentStatus eventStatus(String eventType) {
    return switch (eventType) {
      case "PAYMENT.CAPTURE.COMPLETED", "CHECKOUT.ORDER.COMPLETED" -> PaymentStatus.PAID;
      case "PAYMENT.CAPTURE.DENIED", "PAYMENT.CAPTURE.DECLINED", "CHECKOUT.ORDER.VOIDED" ->
          PaymentStatus.FAILED;
      case "PAYMENT.CAPTURE.REFUNDED" -> PaymentStatus.REFUNDED;
      case "CHECKOUT.ORDER.CANCELLED" -> PaymentStatus.CANCELLED;
      // Approval only authorises the capture that follows on the return redirect.
      case "CHECKOUT.ORDER.APPROVED", "PAYMENT.CAPTURE.PENDING" -> PaymentStatus.PENDING;
      default -> null;
    };
  }

  private CaptureResult toCaptureResult(JsonNode order) {
    var capture = order.path("purchase_units").path(0).path("payments").path("captures").path(0);
    var orderStatus = order.path("status").asText("");
    PaymentStatus status =
        switch (orderStatus) {
          case "COMPLETED" -> captureStatus(capture.path("status").asText("COMPLETED"));
          case "VOIDED" -> PaymentStatus.CANCELLED;
          default -> PaymentStatus.PENDING;
        };
    var amount = textOrNull(capture.path("amount").path("value"));
    return new CaptureResult(
        status,
        textOrNull(capture.path("id")),
        amount != null && status == PaymentStatus.PAID ? new BigDecimal(amount) : null);
  }

  private static PaymentStatus captureStatus(String captureStatus) {
    return switch (captureStatus) {
      case "COMPLETED" -> PaymentStatus.PAID;
      case "DECLINED", "FAILED" -> PaymentStatus.FAILED;
      case "REFUNDED" -> PaymentStatus.REFUNDED;
      default -> PaymentStatus.PENDING;
    };
  }

  private String accessToken() {
    return accessTokens.get(TOKEN_KEY, key -> fetchAccessToken());
  }

  private String fetchAccessToken() {
    var paypal = properties.paypal();
    if (paypal.clientId() == null
        || paypal.clientId().isBlank()
        || paypal.clientSecret() == null
        || paypal.clientSecret().isBlank()) {
      throw new PaymentProviderException(
          kind().slug(), "PayPal client credentials are not configured", false);
    }
    try {
      var response =
          restClient
              .post()
              .uri(baseUrl() + "/v1/oauth2/token")
              .headers(h -> h.setBasicAuth(paypal.clientId(), paypal.clientSecret()))
              .contentType(MediaType.APPLICATION_FORM_URLENCODED)
              .body("grant_type=client_credentials")
              .retrieve()
              .body(JsonNode.class);
      var token = textOrNull(response.path("access_token"));
      if (token == null) {
        throw new PaymentProviderException(
            kind().slug(), "PayPal token response has no access_token", true);
      }
      return token;
    } catch (RestClientException e) {
      throw new PaymentProviderException(
          kind().slug(), "PayPal authentication failed: " + e.getMessage(), true, e);
    }
  }

  private String baseUrl() {
    return properties.paypal().live() ? LIVE_URL : SANDBOX_URL;
  }

  private static String link(JsonNode response, String... rels) {
    for (var rel : rels) {
      for (var link : response.path("links")) {
        if (rel.equals(link.path("rel").asText())) {
          return link.path("href").asText();
        }
      }
    }
    return null;
  }

  private static String formatAmount(BigDecimal amount) {
    return amount.setScale(2, RoundingMode.HALF_UP).toPlainString();
  }

  private static String truncate(String value, int max) {
    return value.length() <= max ? value : value.substring(0, max);
  }

  private static String textOrNull(JsonNode node) {
    return node.isValueNode() && !node.asText().isBlank() ? node.asText() : null;
  }
}
