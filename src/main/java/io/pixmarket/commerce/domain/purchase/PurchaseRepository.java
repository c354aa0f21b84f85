package io.pixmarket.commerce.domain.purchase;

import java.util.Collection;
import java.util.List;

public interface PurchaseRepository {

    Purchase save(Purchase purchase);

    boolean existsByUserIdAndPhotoId(Long userId, Long photoId);

    List<Purchase> findByUserIdOrderByPurchasedAtDesc(Long userId);

    List<Purchase> findBySessionId(String sessionId);

    /**
     * 주어진 사진 중 사용자가 이미 구매한 사진 ID
     */
    List<Long> findPurchasedPhotoIds(Long userId, Collection<Long> photoIds);

    long count();
}
