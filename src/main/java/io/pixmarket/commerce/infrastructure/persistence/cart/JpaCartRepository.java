package io.pixmarket.commerce.infrastructure.persistence.cart;

import io.pixmarket.commerce.domain.cart.Cart;
import io.pixmarket.commerce.domain.cart.CartRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface JpaCartRepository extends JpaRepository<Cart, Long>, CartRepository {

    @Override
    @Query("SELECT c FROM Cart c LEFT JOIN FETCH c.cartItems WHERE c.userId = :userId")
    Optional<Cart> findByUserId(@Param("userId") Long userId);

    @Override
    Cart save(Cart cart);

    @Override
    Cart saveAndFlush(Cart cart);

    /**
     * 조건부 bulk delete: 이미 삭제된 장바구니면 0을 반환 (재실행 안전)
     */
    @Override
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM Cart c WHERE c.userId = :userId")
    int deleteByUserId(@Param("userId") Long userId);
}
