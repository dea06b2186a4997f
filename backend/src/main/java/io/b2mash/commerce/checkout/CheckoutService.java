package io.b2mash.commerce.checkout;

import io.b2mash.commerce.cart.CartItem;
import io.b2mash.commerce.cart.CartItemRepository;
import io.b2mash.commerce.catalog.StoreItem;
import io.b2mash.commerce.catalog.StoreItemRepository;
import io.b2mash.commerce.config.PaymentProperties;
import io.b2mash.commerce.exception.InvalidStateException;
import io.b2mash.commerce.exception.ResourceConflictException;
import io.b2mash.commerce.exception.ResourceNotFoundException;
import io.b2mash.commerce.integration.payment.PaymentGateway;
import io.b2mash.commerce.integration.payment.PaymentGatewayRegistry;
import io.b2mash.commerce.integration.payment.PaymentInitRequest;
import io.b2mash.commerce.integration.payment.PaymentSession;
import io.b2mash.commerce.order.Order;
import io.b2mash.commerce.order.OrderItem;
import io.b2mash.commerce.order.OrderItemRepository;
import io.b2mash.commerce.order.OrderRepository;
import io.b2mash.commerce.payment.Payment;
import io.b2mash.commerce.payment.PaymentMetadata;
import io.b2mash.commerce.payment.PaymentRepository;
import io.b2mash.commerce.payment.PaymentStatus;
import io.b2mash.commerce.payment.PaymentType;
import io.b2mash.commerce.pricing.CartPricingCalculator;
import io.b2mash.commerce.pricing.CartSummary;
import io.b2mash.commerce.pricing.Money;
import io.b2mash.commerce.pricing.PricedLine;
import io.b2mash.commerce.pricing.PricingLine;
import io.b2mash.commerce.security.AuthenticatedUser;
import io.b2mash.commerce.settings.StoreSettingsService;
import io.b2mash.commerce.shipping.DeliveryAddress;
import io.b2mash.commerce.shipping.DeliveryAddressRepository;
import io.b2mash.commerce.shipping.ShippingService;
import io.b2mash.commerce.subscription.Subscription;
import io.b2mash.commerce.subscription.SubscriptionPlan;
import io.b2mash.commerce.subscription.SubscriptionPlanRepository;
import io.b2mash.commerce.subscription.SubscriptionRepository;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Opens processor checkout sessions for carts and subscription plans.
 *
 * <p>The processor session is created first, with locally pre-assigned payment and order ids in its
 * metadata, and local records are written afterwards in one transaction. A processor failure
 * therefore leaves nothing behind; a failure to persist cancels the session that was just opened.
 */
@Service
public class CheckoutService {

  private static final Logger log = LoggerFactory.getLogger(CheckoutService.class);

  private final CartItemRepository cartItemRepository;
  private final StoreItemRepository storeItemRepository;
  private final StoreSettingsService storeSettingsService;
  private final CartPricingCalculator pricingCalculator;
  private final ShippingService shippingService;
  private final DeliveryAddressRepository deliveryAddressRepository;
  private final OrderRepository orderRepository;
  private final OrderItemRepository orderItemRepository;
  private final PaymentRepository paymentRepository;
  private final SubscriptionPlanRepository planRepository;
  private final SubscriptionRepository subscriptionRepository;
  private final PaymentGatewayRegistry gatewayRegistry;
  private final PaymentProperties paymentProperties;
  private final TransactionTemplate transactionTemplate;
  private final Clock clock;

  public CheckoutService(
      CartItemRepository cartItemRepository,
      StoreItemRepository storeItemRepository,
      StoreSettingsService storeSettingsService,
      CartPricingCalculator pricingCalculator,
      ShippingService shippingService,
      DeliveryAddressRepository deliveryAddressRepository,
      OrderRepository orderRepository,
      OrderItemRepository orderItemRepository,
      PaymentRepository paymentRepository,
      SubscriptionPlanRepository planRepository,
      SubscriptionRepository subscriptionRepository,
      PaymentGatewayRegistry gatewayRegistry,
      PaymentProperties paymentProperties,
      TransactionTemplate transactionTemplate,
      Clock clock) {
    this.cartItemRepository = cartItemRepository;
    this.storeItemRepository = storeItemRepository;
    this.storeSettingsService = storeSettingsService;
    this.pricingCalculator = pricingCalculator;
    this.shippingService = shippingService;
    this.deliveryAddressRepository = deliveryAddressRepository;
    this.orderRepository = orderRepository;
    this.orderItemRepository = orderItemRepository;
    this.paymentRepository = paymentRepository;
    this.planRepository = planRepository;
    this.subscriptionRepository = subscriptionRepository;
    this.gatewayRegistry = gatewayRegistry;
    this.paymentProperties = paymentProperties;
    this.transactionTemplate = transactionTemplate;
    this.clock = clock;
  }

  /**
   * Prices the caller's cart, quotes shipping and opens a checkout session with the active
   * processor. The cart itself is left alone; items are removed when the payment is confirmed.
   */
  public CartCheckoutResult checkoutCart(AuthenticatedUser user, DeliveryDetails delivery) {
    var cartItems = cartItemRepository.findByUserIdOrderByCreatedAt(user.userId());
    if (cartItems.isEmpty()) {
      throw new InvalidStateException("Cart is empty", "Add items to your cart before checkout");
    }

    var summary = priceCart(cartItems);
    var address = resolveAddress(user.userId(), delivery);
    var shipping =
        shippingService.quote(
            totalWeight(summary), delivery == null ? null : delivery.shippingService());
    var total = Money.round(summary.total().add(shipping.cost()));
    var currency = paymentProperties.currency();

    var paymentId = UUID.randomUUID();
    var orderId = UUID.randomUUID();
    var gateway = gatewayRegistry.active();
    var session =
        gateway.initializePayment(
            new PaymentInitRequest(
                paymentId,
                PaymentType.STORE_CHECKOUT,
                user.userId(),
                user.email(),
                orderId,
                null,
                total,
                currency,
                "Order " + orderId,
                lineItems(summary),
                shipping.cost(),
                null));

    persistOrCancel(
        gateway,
        session,
        () -> {
          var payment =
              new Payment(
                  paymentId,
                  user.userId(),
                  user.email(),
                  gateway.kind(),
                  session.providerRef(),
                  total,
                  currency,
                  summary.preOrder(),
                  new PaymentMetadata.StoreCheckout(null));
          paymentRepository.save(payment);
          var addressId =
              address.existingId() != null
                  ? address.existingId()
                  : deliveryAddressRepository.save(address.newAddress()).getId();
          orderRepository.save(
              new Order(
                  orderId,
                  user.userId(),
                  paymentId,
                  total,
                  shipping.cost(),
                  shipping.serviceKey(),
                  summary.preOrder(),
                  addressId));
          orderItemRepository.saveAll(orderItems(orderId, summary));
        });

    log.info(
        "Opened {} checkout {} for order {} ({} {}, {} lines)",
        gateway.kind(),
        paymentId,
        orderId,
        total,
        currency,
        summary.lines().size());
    return new CartCheckoutResult(
        paymentId,
        orderId,
        session.providerRef(),
        session.approvalUrl(),
        summary.baseSubtotal(),
        summary.discountTotal(),
        shipping.cost(),
        total,
        currency,
        summary.preOrder());
  }

  /**
   * Opens a recurring checkout for a plan. A caller with a paid subscription that has not yet
   * expired is refused.
   */
  public SubscriptionCheckoutResult checkoutSubscription(AuthenticatedUser user, UUID planId) {
    var plan =
        planRepository
            .findById(planId)
            .orElseThrow(() -> new ResourceNotFoundException("SubscriptionPlan", planId));
    if (!plan.isActive()) {
      throw new InvalidStateException(
          "Plan not available", "Subscription plan " + plan.getName() + " is no longer offered");
    }
    var now = clock.instant();
    if (subscriptionRepository.existsByUserIdAndStatusAndEndDateAfter(
        user.userId(), PaymentStatus.PAID, now)) {
      throw ResourceConflictException.activeSubscription();
    }

    var paymentId = UUID.randomUUID();
    // Temporary correlation id; the row is keyed by the processor reference once it exists
    var correlationId = UUID.randomUUID().toString();
    var amount = Money.round(plan.getPrice());
    var gateway = gatewayRegistry.active();
    var session =
        gateway.initializePayment(
            new PaymentInitRequest(
                paymentId,
                PaymentType.SUBSCRIPTION,
                user.userId(),
                user.email(),
                null,
                correlationId,
                amount,
                plan.getCurrency(),
                plan.getName(),
                List.of(new PaymentInitRequest.LineItem(plan.getName(), 1, amount)),
                null,
                plan.getDurationDays()));

    persistOrCancel(
        gateway,
        session,
        () -> {
          paymentRepository.save(
              new Payment(
                  paymentId,
                  user.userId(),
                  user.email(),
                  gateway.kind(),
                  session.providerRef(),
                  amount,
                  plan.getCurrency(),
                  false,
                  new PaymentMetadata.Subscription(plan.getName(), null)));
          subscriptionRepository.save(
              newSubscription(session.providerRef(), user, plan, paymentId));
        });

    log.info(
        "Opened {} subscription checkout {} for plan {}", gateway.kind(), paymentId, plan.getId());
    return new SubscriptionCheckoutResult(
        paymentId,
        session.providerRef(),
        session.providerRef(),
        session.approvalUrl(),
        plan.getName(),
        amount,
        plan.getCurrency());
  }

  private CartSummary priceCart(List<CartItem> cartItems) {
    var productIds = cartItems.stream().map(CartItem::getProductId).distinct().toList();
    Map<UUID, StoreItem> products =
        storeItemRepository.findAllById(productIds).stream()
            .collect(Collectors.toMap(StoreItem::getId, Function.identity()));
    var lines =
        cartItems.stream()
            .map(c -> pricingLine(c, products))
            .toList();
    return pricingCalculator.summarize(
        lines, storeSettingsService.getGlobalDiscount(), clock.instant());
  }

  private static PricingLine pricingLine(CartItem cartItem, Map<UUID, StoreItem> products) {
    return new PricingLine(
        cartItem.getProductId(), cartItem.getQuantity(), products.get(cartItem.getProductId()));
  }

  private int totalWeight(CartSummary summary) {
    int fallback = shippingService.defaultItemWeightGrams();
    return summary.lines().stream()
        .mapToInt(l -> (l.weightGrams() != null ? l.weightGrams() : fallback) * l.quantity())
        .sum();
  }

  private ResolvedAddress resolveAddress(UUID userId, DeliveryDetails delivery) {
    if (delivery != null && delivery.addressId() != null) {
      var saved =
          deliveryAddressRepository
              .findByIdAndUserId(delivery.addressId(), userId)
              .orElseThrow(
                  () -> new ResourceNotFoundException("DeliveryAddress", delivery.addressId()));
      return new ResolvedAddress(saved.getId(), null);
    }
    if (delivery == null || delivery.address() == null) {
      throw new InvalidStateException(
          "Delivery address required", "Choose a saved address or enter a new one");
    }
    var input = delivery.address();
    var missing = new ArrayList<String>();
    requirePresent(input.fullName(), "fullName", missing);
    requirePresent(input.line1(), "line1", missing);
    requirePresent(input.city(), "city", missing);
    requirePresent(input.postcode(), "postcode", missing);
    requirePresent(input.country(), "country", missing);
    if (!missing.isEmpty()) {
      throw new InvalidStateException(
          "Invalid delivery address", "Missing address fields: " + String.join(", ", missing));
    }
    return new ResolvedAddress(
        null,
        new DeliveryAddress(
            userId,
            input.fullName(),
            input.line1(),
            input.line2(),
            input.city(),
            input.postcode(),
            input.country(),
            input.phone()));
  }

  private static void requirePresent(String value, String field, List<String> missing) {
    if (value == null || value.isBlank()) {
      missing.add(field);
    }
  }

  private static List<PaymentInitRequest.LineItem> lineItems(CartSummary summary) {
    return summary.lines().stream()
        .map(l -> new PaymentInitRequest.LineItem(l.name(), l.quantity(), l.lineTotal()))
        .toList();
  }

  private static List<OrderItem> orderItems(UUID orderId, CartSummary summary) {
    return summary.lines().stream().map(l -> orderItem(orderId, l)).toList();
  }

  private static OrderItem orderItem(UUID orderId, PricedLine line) {
    // Pre-order stock is taken when the release ships, not on payment
    return new OrderItem(
        orderId, line.productId(), line.name(), line.quantity(), line.unitPrice(), line.preOrder());
  }

  private Subscription newSubscription(
      String subscriptionId, AuthenticatedUser user, SubscriptionPlan plan, UUID paymentId) {
    var start = clock.instant();
    var end = start.plus(Duration.ofDays(plan.getDurationDays()));
    return new Subscription(subscriptionId, user.userId(), plan.getId(), paymentId, start, end, 1);
  }

  private void persistOrCancel(PaymentGateway gateway, PaymentSession session, Runnable writes) {
    try {
      transactionTemplate.executeWithoutResult(status -> writes.run());
    } catch (RuntimeException e) {
      log.error(
          "Saving checkout failed, expiring {} session {}",
          gateway.kind(),
          session.providerRef(),
          e);
      gateway.cancelSession(session.providerRef());
      throw e;
    }
  }

  private record ResolvedAddress(UUID existingId, DeliveryAddress newAddress) {}
}
