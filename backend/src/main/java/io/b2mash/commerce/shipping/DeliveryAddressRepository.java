package io.b2mash.commerce.shipping;

import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface DeliveryAddressRepository extends JpaRepository<DeliveryAddress, UUID> {

  Optional<DeliveryAddress> findByIdAndUserId(UUID id, UUID userId);
}
