package io.b2mash.commerce.subscription;

import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Read side of a user's subscription ledger. */
@Service
public class SubscriptionQueryService {

  private final SubscriptionRepository subscriptionRepository;
  private final SubscriptionPlanRepository planRepository;
  private final Clock clock;

  public SubscriptionQueryService(
      SubscriptionRepository subscriptionRepository,
      SubscriptionPlanRepository planRepository,
      Clock clock) {
    this.subscriptionRepository = subscriptionRepository;
    this.planRepository = planRepository;
    this.clock = clock;
  }

  /** The latest subscription row of the user and whether it covers the current instant. */
  @Transactional(readOnly = true)
  public SubscriptionStatus currentStatus(UUID userId) {
    return subscriptionRepository
        .findFirstByUserIdOrderByCreatedAtDesc(userId)
        .map(
            latest ->
                new SubscriptionStatus(
                    true, latest.isActiveAt(clock.instant()), toViews(List.of(latest)).get(0)))
        .orElseGet(SubscriptionStatus::none);
  }

  /** Every billing cycle of the user, newest first. */
  @Transactional(readOnly = true)
  public List<SubscriptionView> history(UUID userId) {
    var subscriptions = subscriptionRepository.findByUserIdOrderByCreatedAtDesc(userId);
    return toViews(subscriptions);
  }

  @Transactional(readOnly = true)
  public List<SubscriptionView> forPayment(UUID paymentId) {
    return toViews(subscriptionRepository.findByPaymentId(paymentId));
  }

  private List<SubscriptionView> toViews(List<Subscription> subscriptions) {
    var names = planNames(subscriptions);
    return subscriptions.stream()
        .map(s -> SubscriptionView.from(s, names.get(s.getPlanId())))
        .toList();
  }

  private Map<UUID, String> planNames(Collection<Subscription> subscriptions) {
    var planIds = subscriptions.stream().map(Subscription::getPlanId).distinct().toList();
    return planRepository.findAllById(planIds).stream()
        .collect(Collectors.toMap(SubscriptionPlan::getId, SubscriptionPlan::getName));
  }

  public record SubscriptionStatus(
      boolean hasSubscription, boolean isActive, SubscriptionView subscription) {

    static SubscriptionStatus none() {
      return new SubscriptionStatus(false, false, null);
    }
  }
}
