package io.b2mash.commerce.cart;

import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CartItemRepository extends JpaRepository<CartItem, UUID> {

  List<CartItem> findByUserIdOrderByCreatedAt(UUID userId);

  @Modifying
  @Query(
      """
      DELETE FROM CartItem c
      WHERE c.userId = :userId AND c.productId IN :productIds
      """)
  int deleteByUserIdAndProductIds(
      @Param("userId") UUID userId, @Param("productIds") Collection<UUID> productIds);
}
