package io.b2mash.commerce.integration.payment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.mockStatic;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.stripe.exception.ApiConnectionException;
import com.stripe.exception.SignatureVerificationException;
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
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.mockito.MockedStatic;

class StripePaymentGatewayTest {

  private static final UUID PAYMENT_ID = UUID.fromString("0b5e6a3c-8f8e-4d4e-9f63-0c1a1f1e2d01");
  private static final UUID ORDER_ID = UUID.fromString("7d1c2b3a-4e5f-4a6b-8c7d-9e0f1a2b3c4d");

  private final StripePaymentGateway gateway =
      new StripePaymentGateway(properties("sk_test_123"), new ObjectMapper());

  // --- Session creation ---

  @Test
  void initializePayment_buildsStoreCheckoutSession() {
    try (MockedStatic<Session> sessionMock = mockStatic(Session.class)) {
      var session = mock(Session.class);
      when(session.getId()).thenReturn("cs_test_abc");
      when(session.getUrl()).thenReturn("https://checkout.stripe.com/c/pay/cs_test_abc");
      sessionMock
          .when(() -> Session.create(any(SessionCreateParams.class), any(RequestOptions.class)))
          .thenAnswer(
              invocation -> {
                SessionCreateParams params = invocation.getArgument(0);
                assertThat(params.getMode()).isEqualTo(SessionCreateParams.Mode.PAYMENT);
                assertThat(params.getMetadata())
                    .containsEntry("paymentId", PAYMENT_ID.toString())
                    .containsEntry("orderId", ORDER_ID.toString())
                    .containsEntry("type", "store_checkout");
                assertThat(params.getPaymentIntentData().getMetadata())
                    .containsEntry("paymentId", PAYMENT_ID.toString());
                assertThat(params.getSuccessUrl())
                    .isEqualTo(
                        "https://shop.example.com/payment/redirect/success"
                            + "?session_id={CHECKOUT_SESSION_ID}");
                assertThat(params.getLineItems()).hasSize(3);
                assertThat(params.getLineItems().get(0).getPriceData().getUnitAmount())
                    .isEqualTo(1000L);
                assertThat(params.getLineItems().get(2).getPriceData().getUnitAmount())
                    .isEqualTo(350L);
                assertThat(params.getLineItems().get(2).getPriceData().getProductData().getName())
                    .isEqualTo("Shipping");
                return session;
              });

      var result = gateway.initializePayment(storeRequest());

      assertThat(result.providerRef()).isEqualTo("cs_test_abc");
      assertThat(result.approvalUrl()).isEqualTo("https://checkout.stripe.com/c/pay/cs_test_abc");
    }
  }

  @Test
  void initializePayment_collapsesLinesThatDoNotSplitEvenly() {
    var request =
        new PaymentInitRequest(
            PAYMENT_ID,
            PaymentType.STORE_CHECKOUT,
            UUID.randomUUID(),
            null,
            ORDER_ID,
            null,
            new BigDecimal("10.00"),
            "GBP",
            "Order",
            List.of(new PaymentInitRequest.LineItem("Pens", 3, new BigDecimal("10.00"))),
            BigDecimal.ZERO,
            null);

    try (MockedStatic<Session> sessionMock = mockStatic(Session.class)) {
      var session = mock(Session.class);
      sessionMock
          .when(() -> Session.create(any(SessionCreateParams.class), any(RequestOptions.class)))
          .thenAnswer(
              invocation -> {
                SessionCreateParams params = invocation.getArgument(0);
                assertThat(params.getLineItems()).hasSize(1);
                var line = params.getLineItems().get(0);
                assertThat(line.getQuantity()).isEqualTo(1L);
                assertThat(line.getPriceData().getUnitAmount()).isEqualTo(1000L);
                assertThat(line.getPriceData().getProductData().getName()).isEqualTo("Pens x 3");
                return session;
              });

      gateway.initializePayment(request);
    }
  }

  @Test
  void initializePayment_buildsRecurringSubscriptionSession() {
    var request =
        new PaymentInitRequest(
            PAYMENT_ID,
            PaymentType.SUBSCRIPTION,
            UUID.randomUUID(),
            "member@example.com",
            null,
            "corr-1",
            new BigDecimal("9.99"),
            "GBP",
            "Gold",
            List.of(),
            null,
            30);

    try (MockedStatic<Session> sessionMock = mockStatic(Session.class)) {
      var session = mock(Session.class);
      sessionMock
          .when(() -> Session.create(any(SessionCreateParams.class), any(RequestOptions.class)))
          .thenAnswer(
              invocation -> {
                SessionCreateParams params = invocation.getArgument(0);
                assertThat(params.getMode()).isEqualTo(SessionCreateParams.Mode.SUBSCRIPTION);
                assertThat(params.getSubscriptionData().getMetadata())
                    .containsEntry("subscriptionId", "corr-1");
                var recurring = params.getLineItems().get(0).getPriceData().getRecurring();
                assertThat(recurring.getInterval())
                    .isEqualTo(SessionCreateParams.LineItem.PriceData.Recurring.Interval.DAY);
                assertThat(recurring.getIntervalCount()).isEqualTo(30L);
                return session;
              });

      gateway.initializePayment(request);
    }
  }

  @Test
  void initializePayment_wrapsStripeFailureAsRetryableProviderError() {
    try (MockedStatic<Session> sessionMock = mockStatic(Session.class)) {
      sessionMock
          .when(() -> Session.create(any(SessionCreateParams.class), any(RequestOptions.class)))
          .thenThrow(new ApiConnectionException("connection reset"));

      assertThatThrownBy(() -> gateway.initializePayment(storeRequest()))
          .isInstanceOfSatisfying(
              PaymentProviderException.class,
              e -> {
                assertThat(e.getProvider()).isEqualTo("stripe");
                assertThat(e.isRetryable()).isTrue();
              });
    }
  }

  @Test
  void missingApiKeyIsANonRetryableProviderError() {
    var unconfigured = new StripePaymentGateway(properties(""), new ObjectMapper());

    assertThatThrownBy(() -> unconfigured.verifyPaymentStatus("cs_test_abc"))
        .isInstanceOfSatisfying(
            PaymentProviderException.class, e -> assertThat(e.isRetryable()).isFalse());
  }

  // --- Status pull ---

  @Test
  void verifyPaymentStatus_mapsPaidSession() {
    try (MockedStatic<Session> sessionMock = mockStatic(Session.class)) {
      var session = mock(Session.class);
      when(session.getStatus()).thenReturn("complete");
      when(session.getPaymentStatus()).thenReturn("paid");
      when(session.getPaymentIntent()).thenReturn("pi_123");
      when(session.getAmountTotal()).thenReturn(2850L);
      when(session.getCurrency()).thenReturn("gbp");
      sessionMock
          .when(() -> Session.retrieve(eq("cs_test_abc"), any(RequestOptions.class)))
          .thenReturn(session);

      var result = gateway.verifyPaymentStatus("cs_test_abc");

      assertThat(result.status()).isEqualTo(PaymentStatus.PAID);
      assertThat(result.transactionId()).isEqualTo("pi_123");
      assertThat(result.capturedAmount()).isEqualByComparingTo("28.50");
      assertThat(result.providerSubscriptionId()).isNull();
    }
  }

  @Test
  void verifyPaymentStatus_carriesSubscriptionOfRecurringSession() {
    try (MockedStatic<Session> sessionMock = mockStatic(Session.class)) {
      var session = mock(Session.class);
      when(session.getStatus()).thenReturn("complete");
      when(session.getPaymentStatus()).thenReturn("paid");
      when(session.getInvoice()).thenReturn("in_1");
      when(session.getSubscription()).thenReturn("sub_1");
      when(session.getAmountTotal()).thenReturn(999L);
      when(session.getCurrency()).thenReturn("gbp");
      sessionMock
          .when(() -> Session.retrieve(eq("cs_test_sub"), any(RequestOptions.class)))
          .thenReturn(session);

      var result = gateway.verifyPaymentStatus("cs_test_sub");

      assertThat(result.status()).isEqualTo(PaymentStatus.PAID);
      assertThat(result.transactionId()).isEqualTo("in_1");
      assertThat(result.providerSubscriptionId()).isEqualTo("sub_1");
    }
  }

  @Test
  void sessionStatusMapping() {
    assertThat(StripePaymentGateway.sessionStatus("complete", "paid"))
        .isEqualTo(PaymentStatus.PAID);
    assertThat(StripePaymentGateway.sessionStatus("complete", "no_payment_required"))
        .isEqualTo(PaymentStatus.PAID);
    assertThat(StripePaymentGateway.sessionStatus("expired", "unpaid"))
        .isEqualTo(PaymentStatus.CANCELLED);
    assertThat(StripePaymentGateway.sessionStatus("open", "unpaid"))
        .isEqualTo(PaymentStatus.PENDING);
  }

  // --- Webhook verification ---

  @Test
  void verifyWebhook_rejectsMissingSignatureHeader() {
    assertThat(gateway.verifyWebhook(Map.of(), "{\"type\":\"x\"}")).isFalse();
  }

  @Test
  void verifyWebhook_rejectsBadSignature() {
    try (MockedStatic<Webhook> webhookMock = mockStatic(Webhook.class)) {
      webhookMock
          .when(() -> Webhook.constructEvent(anyString(), anyString(), anyString()))
          .thenThrow(new SignatureVerificationException("No signatures found", "t=1,v1=bad"));

      assertThat(gateway.verifyWebhook(Map.of("stripe-signature", "t=1,v1=bad"), "{}")).isFalse();
    }
  }

  @Test
  void verifyWebhook_acceptsValidSignatureWithAnyHeaderCase() {
    try (MockedStatic<Webhook> webhookMock = mockStatic(Webhook.class)) {
      webhookMock
          .when(() -> Webhook.constructEvent("{}", "t=1,v1=good", "whsec_test"))
          .thenReturn(null);

      assertThat(gateway.verifyWebhook(Map.of("stripe-signature", "t=1,v1=good"), "{}"))
          .isTrue();
    }
  }

  // --- Webhook parsing ---

  @Test
  void parsesCompletedCheckoutSession() {
    var payload =
        """
        {
          "type": "checkout.session.completed",
          "data": {
            "object": {
              "id": "cs_test_abc",
              "mode": "payment",
              "payment_status": "paid",
              "payment_intent": "pi_123",
              "metadata": {
                "paymentId": "%s",
                "orderId": "%s",
                "type": "store_checkout"
              }
            }
          }
        }
        """
            .formatted(PAYMENT_ID, ORDER_ID);

    var result = gateway.parseWebhook(payload);

    assertThat(result.eventType()).isEqualTo("checkout.session.completed");
    assertThat(result.providerRef()).isEqualTo("cs_test_abc");
    assertThat(result.status()).isEqualTo(PaymentStatus.PAID);
    assertThat(result.transactionId()).isEqualTo("pi_123");
    assertThat(result.correlation().paymentId()).isEqualTo(PAYMENT_ID);
    assertThat(result.correlation().orderId()).isEqualTo(ORDER_ID);
    assertThat(result.unhandledEvent()).isFalse();
  }

  @Test
  void completedSessionAwaitingAsyncPaymentStaysPending() {
    var payload =
        """
        {"type": "checkout.session.completed",
         "data": {"object": {"id": "cs_1", "mode": "payment", "payment_status": "unpaid"}}}
        """;

    assertThat(gateway.parseWebhook(payload).status()).isEqualTo(PaymentStatus.PENDING);
  }

  @Test
  void malformedMetadataIdsDoNotFailParsing() {
    var payload =
        """
        {"type": "payment_intent.payment_failed",
         "data": {"object": {"id": "pi_1", "metadata": {"paymentId": "not-a-uuid"}}}}
        """;

    var result = gateway.parseWebhook(payload);

    assertThat(result.status()).isEqualTo(PaymentStatus.FAILED);
    assertThat(result.correlation().paymentId()).isNull();
    assertThat(result.providerRef()).isEqualTo("pi_1");
  }

  @Test
  void refundWithoutMetadataDefersCorrelationToPaymentIntent() {
    var payload =
        """
        {"type": "charge.refunded",
         "data": {"object": {"id": "ch_1", "payment_intent": "pi_123", "metadata": {}}}}
        """;

    var result = gateway.parseWebhook(payload);

    assertThat(result.status()).isEqualTo(PaymentStatus.REFUNDED);
    assertThat(result.providerRef()).isEqualTo("pi_123");
    assertThat(result.correlationDeferred()).isTrue();
  }

  @Test
  void parsesRenewalInvoice() {
    var payload =
        """
        {
          "type": "invoice.paid",
          "data": {
            "object": {
              "id": "in_002",
              "billing_reason": "subscription_cycle",
              "amount_paid": 999,
              "currency": "gbp",
              "parent": {"subscription_details": {"subscription": "sub_1", "metadata": {}}},
              "lines": {"data": [{"period": {"start": 1767225600, "end": 1769817600}}]}
            }
          }
        }
        """;

    var result = gateway.parseWebhook(payload);

    assertThat(result.status()).isEqualTo(PaymentStatus.PAID);
    assertThat(result.providerSubscriptionId()).isEqualTo("sub_1");
    var renewal = result.renewal();
    assertThat(renewal.isCycleRenewal()).isTrue();
    assertThat(renewal.invoiceId()).isEqualTo("in_002");
    assertThat(renewal.amountPaid()).isEqualByComparingTo("9.99");
    assertThat(renewal.currency()).isEqualTo("GBP");
    assertThat(renewal.periodStart()).isEqualTo(Instant.ofEpochSecond(1767225600));
    assertThat(renewal.periodEnd()).isEqualTo(Instant.ofEpochSecond(1769817600));
  }

  @Test
  void unknownEventIsUnhandled() {
    var result = gateway.parseWebhook("{\"type\": \"radar.early_fraud_warning.created\"}");

    assertThat(result.unhandledEvent()).isTrue();
    assertThat(result.status()).isEqualTo(PaymentStatus.PENDING);
  }

  @Test
  void customerAndCatalogEventsAreNotPaymentRelevant() {
    assertThat(gateway.isPaymentRelevant("customer.created")).isFalse();
    assertThat(gateway.isPaymentRelevant("price.updated")).isFalse();
    assertThat(gateway.isPaymentRelevant("charge.refunded")).isTrue();
  }

  @Test
  void fetchCorrelationMetadata_readsPaymentIntentMetadata() {
    try (MockedStatic<PaymentIntent> intentMock = mockStatic(PaymentIntent.class)) {
      var intent = mock(PaymentIntent.class);
      when(intent.getMetadata()).thenReturn(Map.of("paymentId", PAYMENT_ID.toString()));
      intentMock
          .when(() -> PaymentIntent.retrieve(eq("pi_123"), any(RequestOptions.class)))
          .thenReturn(intent);

      var correlation = gateway.fetchCorrelationMetadata("pi_123");

      assertThat(correlation)
          .hasValueSatisfying(c -> assertThat(c.paymentId()).isEqualTo(PAYMENT_ID));
    }
  }

  @Test
  void fetchCorrelationMetadata_followsFirstInvoiceToSubscriptionMetadata() {
    try (MockedStatic<PaymentIntent> intentMock = mockStatic(PaymentIntent.class);
        MockedStatic<Invoice> invoiceMock = mockStatic(Invoice.class);
        MockedStatic<Subscription> subscriptionMock = mockStatic(Subscription.class)) {
      var intent = mock(PaymentIntent.class);
      when(intent.getMetadata()).thenReturn(Map.of());
      when(intent.getInvoice()).thenReturn("in_1");
      intentMock
          .when(() -> PaymentIntent.retrieve(eq("pi_sub"), any(RequestOptions.class)))
          .thenReturn(intent);
      var invoice = mock(Invoice.class);
      when(invoice.getBillingReason()).thenReturn("subscription_create");
      when(invoice.getSubscription()).thenReturn("sub_1");
      invoiceMock
          .when(() -> Invoice.retrieve(eq("in_1"), any(RequestOptions.class)))
          .thenReturn(invoice);
      var subscription = mock(Subscription.class);
      when(subscription.getMetadata())
          .thenReturn(Map.of("paymentId", PAYMENT_ID.toString(), "type", "subscription"));
      subscriptionMock
          .when(() -> Subscription.retrieve(eq("sub_1"), any(RequestOptions.class)))
          .thenReturn(subscription);

      var correlation = gateway.fetchCorrelationMetadata("pi_sub");

      assertThat(correlation)
          .hasValueSatisfying(c -> assertThat(c.paymentId()).isEqualTo(PAYMENT_ID));
    }
  }

  @Test
  void fetchCorrelationMetadata_pointsRenewalChargeAtItsInvoice() {
    try (MockedStatic<PaymentIntent> intentMock = mockStatic(PaymentIntent.class);
        MockedStatic<Invoice> invoiceMock = mockStatic(Invoice.class)) {
      var intent = mock(PaymentIntent.class);
      when(intent.getMetadata()).thenReturn(Map.of());
      when(intent.getInvoice()).thenReturn("in_002");
      intentMock
          .when(() -> PaymentIntent.retrieve(eq("pi_2"), any(RequestOptions.class)))
          .thenReturn(intent);
      var invoice = mock(Invoice.class);
      when(invoice.getId()).thenReturn("in_002");
      when(invoice.getBillingReason()).thenReturn("subscription_cycle");
      invoiceMock
          .when(() -> Invoice.retrieve(eq("in_002"), any(RequestOptions.class)))
          .thenReturn(invoice);

      var correlation = gateway.fetchCorrelationMetadata("pi_2");

      assertThat(correlation)
          .hasValueSatisfying(
              c -> {
                assertThat(c.paymentId()).isNull();
                assertThat(c.subscriptionId()).isEqualTo("in_002");
              });
    }
  }

  @Test
  void cancelSession_reportsOpenSessionThatCouldNotBeExpired() throws Exception {
    try (MockedStatic<Session> sessionMock = mockStatic(Session.class)) {
      var session = mock(Session.class);
      when(session.expire(any(RequestOptions.class)))
          .thenThrow(new ApiConnectionException("connection reset"));
      sessionMock
          .when(() -> Session.retrieve(eq("cs_open"), any(RequestOptions.class)))
          .thenReturn(session);

      assertThat(gateway.cancelSession("cs_open")).isFalse();
    }
  }

  @Test
  void cancelSession_expiresSession() throws Exception {
    try (MockedStatic<Session> sessionMock = mockStatic(Session.class)) {
      var session = mock(Session.class);
      when(session.expire(any(RequestOptions.class))).thenReturn(session);
      sessionMock
          .when(() -> Session.retrieve(eq("cs_open"), any(RequestOptions.class)))
          .thenReturn(session);

      assertThat(gateway.cancelSession("cs_open")).isTrue();
    }
  }

  @Test
  void zeroDecimalCurrencyIsNotScaled() {
    assertThat(gateway.toSmallestUnit(new BigDecimal("500"), "JPY")).isEqualTo(500L);
    assertThat(gateway.toSmallestUnit(new BigDecimal("28.50"), "GBP")).isEqualTo(2850L);
    assertThat(gateway.fromSmallestUnit(2850L, "gbp")).isEqualByComparingTo("28.50");
  }

  private static PaymentInitRequest storeRequest() {
    return new PaymentInitRequest(
        PAYMENT_ID,
        PaymentType.STORE_CHECKOUT,
        UUID.randomUUID(),
        "buyer@example.com",
        ORDER_ID,
        null,
        new BigDecimal("28.50"),
        "GBP",
        "Order " + ORDER_ID,
        List.of(
            new PaymentInitRequest.LineItem("Mug", 1, new BigDecimal("10.00")),
            new PaymentInitRequest.LineItem("Poster", 1, new BigDecimal("15.00"))),
        new BigDecimal("3.50"),
        null);
  }

  static PaymentProperties properties(String stripeKey) {
    return new PaymentProperties(
        ProviderKind.STRIPE,
        "https://shop.example.com",
        "https://app.example.com",
        "GBP",
        new PaymentProperties.Timeouts(Duration.ofSeconds(2), Duration.ofSeconds(5)),
        new PaymentProperties.Stripe(stripeKey, "whsec_test"),
        new PaymentProperties.PayPal("client", "secret", "sandbox", "WH-1", "Shop"));
  }
}
