package io.b2mash.commerce.integration.payment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stripe.exception.SignatureVerificationException;
import com.stripe.exception.StripeException;
import com.stripe.model.Invoice;
import com.stripe.model.PaymentIntent;
import com.stripe.model.Subscription;
import com.stripe.model.checkout.Session;
import com.stripe.net.RequestOptions;
import com.stripe.net.Webhook;
import com.stripe.param.checkout.SessionCreateParams;
import io.b2mash.commerce.config.PaymentProperties;
import io.b2mash.commerce.exception.PaymentProviderException;
import io.b2mash.commerce.payment.PaymentStatus;
import io.b2mash.commerce.payment.PaymentType;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Stripe Checkout adapter. API calls go through the Stripe SDK with per-request options (the global
 * {@code Stripe.apiKey} is never set). Webhook bodies are read as raw JSON so that event parsing
 * does not depend on the SDK's pinned API version.
 */
@Component
public class StripePaymentGateway implements PaymentGateway {

  private static final Logger log = LoggerFactory.getLogger(StripePaymentGateway.class);

  /**
   * Zero-decimal currencies where the amount is already in the smallest unit. See
   * https://docs.stripe.com/currencies#zero-decimal
   */
  private static final Set<String> ZERO_DECIMAL_CURRENCIES =
      Set.of(
          "BIF", "CLP", "DJF", "GNF", "JPY", "KMF", "KRW", "MGA", "PYG", "RWF", "UGX", "VND", "VUV",
          "XAF", "XOF", "XPF");

  private static final String SUBSCRIPTION_CYCLE = "subscription_cycle";

  private static final List<String> IRRELEVANT_PREFIXES =
      List.of("customer.", "product.", "price.", "plan.", "setup_intent.", "billing_portal.");

  private final PaymentProperties properties;
  private final ObjectMapper objectMapper;

  public StripePaymentGateway(PaymentProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
  }

  @Override
  public ProviderKind kind() {
    return ProviderKind.STRIPE;
  }

  @Override
  public PaymentSession initializePayment(PaymentInitRequest request) {
    var currency = request.currency().toLowerCase();
    var metadata = request.correlation().toMap();
    var builder =
        SessionCreateParams.builder()
            .setClientReferenceId(request.paymentId().toString())
            .setSuccessUrl(
                properties.serverUrl()
                    + "/payment/redirect/success?session_id={CHECKOUT_SESSION_ID}")
            .setCancelUrl(properties.serverUrl() + "/payment/redirect/cancel")
            .putAllMetadata(metadata);
    if (request.customerEmail() != null) {
      builder.setCustomerEmail(request.customerEmail());
    }

    if (request.type() == PaymentType.SUBSCRIPTION) {
      builder
          .setMode(SessionCreateParams.Mode.SUBSCRIPTION)
          .setSubscriptionData(
              SessionCreateParams.SubscriptionData.builder().putAllMetadata(metadata).build())
          .addLineItem(
              SessionCreateParams.LineItem.builder()
                  .setQuantity(1L)
                  .setPriceData(
                      SessionCreateParams.LineItem.PriceData.builder()
                          .setCurrency(currency)
                          .setUnitAmount(toSmallestUnit(request.amount(), request.currency()))
                          .setRecurring(
                              SessionCreateParams.LineItem.PriceData.Recurring.builder()
                                  .setInterval(
                                      SessionCreateParams.LineItem.PriceData.Recurring.Interval
                                          .DAY)
                                  .setIntervalCount(request.intervalDays().longValue())
                                  .build())
                          .setProductData(productData(request.description()))
                          .build())
                  .build());
    } else {
      builder
          .setMode(SessionCreateParams.Mode.PAYMENT)
          .setPaymentIntentData(
              SessionCreateParams.PaymentIntentData.builder().putAllMetadata(metadata).build());
      for (var line : request.lineItems()) {
        builder.addLineItem(lineItem(line, request.currency()));
      }
      if (request.shippingCost() != null && request.shippingCost().signum() > 0) {
        builder.addLineItem(
            lineItem(
                new PaymentInitRequest.LineItem("Shipping", 1, request.shippingCost()),
                request.currency()));
      }
    }

    try {
      var session = Session.create(builder.build(), requestOptions());
      log.info(
          "Created Stripe checkout session {} for payment {}",
          session.getId(),
          request.paymentId());
      return new PaymentSession(session.getId(), session.getUrl());
    } catch (StripeException e) {
      throw new PaymentProviderException(
          kind().slug(), "Stripe session creation failed: " + e.getMessage(), true, e);
    }
  }

  @Override
  public CaptureResult capturePayment(String providerRef) {
    // Checkout sessions settle on Stripe's side; capturing means reading the settled state.
    return verifyPaymentStatus(providerRef);
  }

  @Override
  public CaptureResult verifyPaymentStatus(String providerRef) {
    try {
      var session = Session.retrieve(providerRef, requestOptions());
      var status = sessionStatus(session.getStatus(), session.getPaymentStatus());
      var transactionId =
          session.getPaymentIntent() != null ? session.getPaymentIntent() : session.getInvoice();
      var captured =
          session.getAmountTotal() != null && status == PaymentStatus.PAID
              ? fromSmallestUnit(session.getAmountTotal(), session.getCurrency())
              : null;
      return new CaptureResult(status, transactionId, captured, session.getSubscription());
    } catch (StripeException e) {
      throw new PaymentProviderException(
          kind().slug(), "Stripe session lookup failed for " + providerRef, true, e);
    }
  }

  @Override
  public boolean verifyWebhook(Map<String, String> headers, String rawBody) {
    if (rawBody == null || rawBody.isBlank()) {
      log.warn("Stripe webhook has no raw body, rejecting");
      return false;
    }
    var secret = properties.stripe().webhookSecret();
    if (secret == null || secret.isBlank()) {
      log.warn("Stripe webhook secret is not configured, rejecting webhook");
      return false;
    }
    var signature = WebhookHeaders.get(headers, "Stripe-Signature");
    if (signature == null) {
      log.warn("Stripe webhook missing Stripe-Signature header");
      return false;
    }
    try {
      Webhook.constructEvent(rawBody, signature, secret);
      return true;
    } catch (SignatureVerificationException e) {
      log.warn("Stripe webhook signature verification failed: {}", e.getMessage());
      return false;
    }
  }

  @Override
  public WebhookResult parseWebhook(String rawBody) {
    var root = readTree(rawBody);
    var eventType = root.path("type").asText("");
    var object = root.path("data").path("object");
    var correlation = CorrelationMetadata.fromMap(metadata(object.path("metadata")));

    return switch (eventType) {
      case "checkout.session.completed" ->
          new WebhookResult(
              eventType,
              text(object, "id"),
              completedSessionStatus(object),
              correlation,
              text(object, "payment_intent"),
              text(object, "subscription"),
              null,
              false,
              false);
      case "checkout.session.async_payment_succeeded" ->
          sessionEvent(eventType, object, PaymentStatus.PAID, correlation);
      case "checkout.session.async_payment_failed" ->
          sessionEvent(eventType, object, PaymentStatus.FAILED, correlation);
      case "checkout.session.expired" ->
          sessionEvent(eventType, object, PaymentStatus.CANCELLED, correlation);
      case "payment_intent.succeeded" ->
          WebhookResult.of(
              eventType,
              text(object, "id"),
              PaymentStatus.PAID,
              correlation,
              text(object, "latest_charge"));
      case "payment_intent.payment_failed" ->
          WebhookResult.of(
              eventType, text(object, "id"), PaymentStatus.FAILED, correlation, null);
      case "payment_intent.canceled" ->
          WebhookResult.of(
              eventType, text(object, "id"), PaymentStatus.CANCELLED, correlation, null);
      case "charge.refunded" ->
          new WebhookResult(
              eventType,
              text(object, "payment_intent"),
              PaymentStatus.REFUNDED,
              correlation,
              text(object, "id"),
              null,
              null,
              false,
              correlation.isEmpty() && text(object, "payment_intent") != null);
      case "invoice.paid", "invoice.payment_succeeded" ->
          invoiceEvent(eventType, object, PaymentStatus.PAID);
      case "invoice.payment_failed" -> invoiceEvent(eventType, object, PaymentStatus.FAILED);
      default -> {
        log.debug("Stripe webhook: unhandled event type '{}'", eventType);
        yield WebhookResult.unhandled(eventType);
      }
    };
  }

  @Override
  public boolean isPaymentRelevant(String eventType) {
    if (eventType == null) {
      return false;
    }
    return IRRELEVANT_PREFIXES.stream().noneMatch(eventType::startsWith);
  }

  @Override
  public Optional<CorrelationMetadata> fetchCorrelationMetadata(String providerRef) {
    try {
      var options = requestOptions();
      var intent = PaymentIntent.retrieve(providerRef, options);
      var correlation = CorrelationMetadata.fromMap(intent.getMetadata());
      if (!correlation.isEmpty()) {
        return Optional.of(correlation);
      }
      if (intent.getInvoice() == null) {
        return Optional.empty();
      }
      return invoiceCorrelation(Invoice.retrieve(intent.getInvoice(), options), options);
    } catch (StripeException e) {
      throw new PaymentProviderException(
          kind().slug(), "Stripe payment intent lookup failed for " + providerRef, true, e);
    }
  }

  /**
   * Subscription charges carry no metadata on their payment intent. The first invoice belongs to
   * the checkout's payment, found through the subscription's metadata; every later invoice is a
   * renewal, recorded under the invoice id.
   */
  private Optional<CorrelationMetadata> invoiceCorrelation(Invoice invoice, RequestOptions options)
      throws StripeException {
    if (SUBSCRIPTION_CYCLE.equals(invoice.getBillingReason())) {
      return Optional.of(
          new CorrelationMetadata(
              null, null, invoice.getId(), PaymentType.SUBSCRIPTION.wireValue(), null));
    }
    if (invoice.getSubscription() == null) {
      return Optional.empty();
    }
    var subscription = Subscription.retrieve(invoice.getSubscription(), options);
    var correlation = CorrelationMetadata.fromMap(subscription.getMetadata());
    return correlation.isEmpty() ? Optional.empty() : Optional.of(correlation);
  }

  @Override
  public boolean cancelSession(String providerRef) {
    try {
      var options = requestOptions();
      Session.retrieve(providerRef, options).expire(options);
      log.info("Stripe session {} expired", providerRef);
      return true;
    } catch (StripeException e) {
      log.warn("Failed to expire Stripe session {}: {}", providerRef, e.getMessage());
      return false;
    }
  }

  /**
   * Converts a BigDecimal amount to the smallest currency unit (e.g., cents). For zero-decimal
   * currencies like JPY, returns the amount as-is.
   */
  long toSmallestUnit(BigDecimal amount, String currency) {
    if (ZERO_DECIMAL_CURRENCIES.contains(currency.toUpperCase())) {
      return amount.setScale(0, RoundingMode.HALF_UP).longValueExact();
    }
    return amount.movePointRight(2).setScale(0, RoundingMode.HALF_UP).longValueExact();
  }

  BigDecimal fromSmallestUnit(long amount, String currency) {
    if (currency != null && ZERO_DECIMAL_CURRENCIES.contains(currency.toUpperCase())) {
      return BigDecimal.valueOf(amount).setScale(2);
    }
    return BigDecimal.valueOf(amount, 2);
  }

  static PaymentStatus sessionStatus(String sessionStatus, String paymentStatus) {
    if ("paid".equals(paymentStatus) || "no_payment_required".equals(paymentStatus)) {
      return PaymentStatus.PAID;
    }
    if ("expired".equals(sessionStatus)) {
      return PaymentStatus.CANCELLED;
    }
    return PaymentStatus.PENDING;
  }

  /** Subscription sessions complete once the first invoice is settled. */
  private static PaymentStatus completedSessionStatus(JsonNode session) {
    if ("subscription".equals(text(session, "mode"))) {
      return PaymentStatus.PAID;
    }
    return sessionStatus("complete", text(session, "payment_status"));
  }

  private WebhookResult sessionEvent(
      String eventType, JsonNode session, PaymentStatus status, CorrelationMetadata correlation) {
    return WebhookResult.of(
        eventType, text(session, "id"), status, correlation, text(session, "payment_intent"));
  }

  private WebhookResult invoiceEvent(String eventType, JsonNode invoice, PaymentStatus status) {
    var subscriptionDetails =
        invoice.path("subscription_details").isMissingNode()
            ? invoice.path("parent").path("subscription_details")
            : invoice.path("subscription_details");
    var providerSubscriptionId =
        text(invoice, "subscription") != null
            ? text(invoice, "subscription")
            : text(subscriptionDetails, "subscription");
    var period = invoice.path("lines").path("data").path(0).path("period");
    var currency = text(invoice, "currency");
    var renewal =
        new RenewalInvoice(
            text(invoice, "id"),
            providerSubscriptionId,
            text(invoice, "billing_reason"),
            epoch(period.path("start"), invoice.path("period_start")),
            epoch(period.path("end"), invoice.path("period_end")),
            fromSmallestUnit(invoice.path("amount_paid").asLong(0), currency),
            currency != null ? currency.toUpperCase() : null);
    return new WebhookResult(
        eventType,
        text(invoice, "id"),
        status,
        CorrelationMetadata.fromMap(metadata(subscriptionDetails.path("metadata"))),
        text(invoice, "payment_intent"),
        providerSubscriptionId,
        renewal,
        false,
        false);
  }

  private SessionCreateParams.LineItem lineItem(PaymentInitRequest.LineItem line, String currency) {
    long total = toSmallestUnit(line.lineTotal(), currency);
    boolean evenSplit = line.quantity() > 0 && total % line.quantity() == 0;
    long quantity = evenSplit ? line.quantity() : 1L;
    String name = evenSplit ? line.name() : line.name() + " x " + line.quantity();
    return SessionCreateParams.LineItem.builder()
        .setQuantity(quantity)
        .setPriceData(
            SessionCreateParams.LineItem.PriceData.builder()
                .setCurrency(currency.toLowerCase())
                .setUnitAmount(total / quantity)
                .setProductData(productData(name))
                .build())
        .build();
  }

  private static SessionCreateParams.LineItem.PriceData.ProductData productData(String name) {
    return SessionCreateParams.LineItem.PriceData.ProductData.builder().setName(name).build();
  }

  private RequestOptions requestOptions() {
    var apiKey = properties.stripe().apiKey();
    if (apiKey == null || apiKey.isBlank()) {
      throw new PaymentProviderException(kind().slug(), "Stripe API key is not configured", false);
    }
    var timeouts = properties.timeouts();
    return RequestOptions.builder()
        .setApiKey(apiKey)
        .setConnectTimeout((int) timeouts.connect().toMillis())
        .setReadTimeout((int) timeouts.read().toMillis())
        .build();
  }

  private JsonNode readTree(String rawBody) {
    try {
      return objectMapper.readTree(rawBody);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Malformed Stripe webhook payload", e);
    }
  }

  private static Map<String, String> metadata(JsonNode node) {
    var map = new HashMap<String, String>();
    if (node.isObject()) {
      node.fields().forEachRemaining(e -> map.put(e.getKey(), e.getValue().asText()));
    }
    return map;
  }

  /** Text of a field that may be a plain id or an expanded object. */
  private static String text(JsonNode node, String field) {
    var value = node.path(field);
    if (value.isTextual()) {
      return value.asText();
    }
    if (value.isObject() && value.path("id").isTextual()) {
      return value.path("id").asText();
    }
    return null;
  }

  private static Instant epoch(JsonNode primary, JsonNode fallback) {
    var node = primary.isNumber() ? primary : fallback;
    return node.isNumber() ? Instant.ofEpochSecond(node.asLong()) : null;
  }
}
