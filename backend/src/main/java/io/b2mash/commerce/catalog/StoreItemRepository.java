package io.b2mash.commerce.catalog;

import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface StoreItemRepository extends JpaRepository<StoreItem, UUID> {

  /**
   * Decrements stock only when enough units remain. Returns the number of rows updated: 0 means the
   * decrement was refused and stock is untouched.
   */
  @Modifying
  @Query(
      """
      UPDATE StoreItem s SET s.stock = s.stock - :quantity
      WHERE s.id = :id AND s.stock >= :quantity
      """)
  int decrementStock(@Param("id") UUID id, @Param("quantity") int quantity);
}
