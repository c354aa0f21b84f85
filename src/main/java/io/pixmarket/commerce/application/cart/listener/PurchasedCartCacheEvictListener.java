package io.pixmarket.commerce.application.cart.listener;

import io.pixmarket.commerce.domain.payment.PurchaseCompletedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * 구매 완료로 장바구니가 삭제되면 장바구니 캐시도 비운다
 */
@Slf4j
@Component
public class PurchasedCartCacheEvictListener {

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    @CacheEvict(value = "carts", key = "#event.userId")
    public void evictCart(PurchaseCompletedEvent event) {
        log.debug("Cart cache evicted after purchase: userId={}", event.getUserId());
    }
}
