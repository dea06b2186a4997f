package io.b2mash.commerce.subscription;

import io.b2mash.commerce.payment.PaymentStatus;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SubscriptionRepository extends JpaRepository<Subscription, String> {

  List<Subscription> findByPaymentId(UUID paymentId);

  Optional<Subscription> findFirstByProviderSubscriptionIdOrderByBillingCycleDesc(
      String providerSubscriptionId);

  Optional<Subscription> findFirstByUserIdOrderByCreatedAtDesc(UUID userId);

  List<Subscription> findByUserIdOrderByCreatedAtDesc(UUID userId);

  boolean existsByUserIdAndStatusAndEndDateAfter(
      UUID userId, PaymentStatus status, Instant instant);
}
