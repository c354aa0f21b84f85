package io.pixmarket.commerce.infrastructure.persistence.cart;

import io.pixmarket.commerce.domain.cart.CartItem;
import io.pixmarket.commerce.domain.cart.CartItemRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaCartItemRepository extends JpaRepository<CartItem, Long>, CartItemRepository {

    @Override
    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM CartItem ci WHERE ci.cart.id IN (SELECT c.id FROM Cart c WHERE c.userId = :userId)")
    int deleteByUserId(@Param("userId") Long userId);
}
