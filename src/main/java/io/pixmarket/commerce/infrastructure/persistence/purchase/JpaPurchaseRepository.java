package io.pixmarket.commerce.infrastructure.persistence.purchase;

import io.pixmarket.commerce.domain.purchase.Purchase;
import io.pixmarket.commerce.domain.purchase.PurchaseRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface JpaPurchaseRepository extends JpaRepository<Purchase, Long>, PurchaseRepository {

    @Override
    Purchase save(Purchase purchase);

    @Override
    boolean existsByUserIdAndPhotoId(Long userId, Long photoId);

    @Override
    List<Purchase> findByUserIdOrderByPurchasedAtDesc(Long userId);

    @Override
    List<Purchase> findBySessionId(String sessionId);

    @Override
    @Query("SELECT p.photoId FROM Purchase p WHERE p.userId = :userId AND p.photoId IN :photoIds")
    List<Long> findPurchasedPhotoIds(@Param("userId") Long userId,
                                     @Param("photoIds") Collection<Long> photoIds);

    @Override
    long count();
}
