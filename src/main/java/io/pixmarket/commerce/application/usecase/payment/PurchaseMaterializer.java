package io.pixmarket.commerce.application.usecase.payment;

import io.pixmarket.commerce.domain.cart.CartItemRepository;
import io.pixmarket.commerce.domain.cart.CartRepository;
import io.pixmarket.commerce.domain.payment.PaymentTransaction;
import io.pixmarket.commerce.domain.payment.PaymentTransactionRepository;
import io.pixmarket.commerce.domain.payment.PurchaseCompletedEvent;
import io.pixmarket.commerce.domain.purchase.Purchase;
import io.pixmarket.commerce.domain.purchase.PurchaseRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 결제 완료 처리 + 구매 내역 반영
 * <p>
 * 하나의 DB 트랜잭션 안에서:
 * 1. 조건부 UPDATE (PENDING → COMPLETED). 0행이면 다른 호출이 이미 완료 → 아무것도 하지 않음
 * 2. 사진별 Purchase 저장 (이미 있는 (user, photo)는 건너뜀)
 * 3. 사용자 장바구니 삭제 (없어도 정상)
 * 4. PurchaseCompletedEvent 발행 (커밋 후 리스너 실행)
 * <p>
 * 도중에 실패하면 전체가 롤백되어 원장은 PENDING으로 남고 다음 트리거가 다시 처리한다.
 * <p>
 * 재시도: @Retryable이 @Transactional 바깥 프록시이므로 시도마다 새 트랜잭션.
 * 유니크 제약 충돌은 다음 시도에서 exists 검사로 건너뛴다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PurchaseMaterializer {

    private final PaymentTransactionRepository paymentTransactionRepository;
    private final PurchaseRepository purchaseRepository;
    private final CartRepository cartRepository;
    private final CartItemRepository cartItemRepository;
    private final PurchaseEventPublisher purchaseEventPublisher;

    /**
     * @return true: 이번 호출이 완료 처리함, false: 이미 완료된 트랜잭션
     */
    @Retryable(
        retryFor = {DataIntegrityViolationException.class, TransientDataAccessException.class},
        maxAttempts = 3,
        backoff = @Backoff(delay = 50, multiplier = 2)
    )
    @Transactional
    public boolean completeAndMaterialize(String sessionId) {
        LocalDateTime completedAt = LocalDateTime.now();

        int updated = paymentTransactionRepository.markCompletedIfPending(sessionId, completedAt);
        if (updated == 0) {
            log.debug("Transaction already completed by another caller: sessionId={}", sessionId);
            return false;
        }

        PaymentTransaction transaction = paymentTransactionRepository.findBySessionIdOrThrow(sessionId);
        Long userId = transaction.getUserId();

        List<Long> granted = new ArrayList<>();
        for (Long photoId : transaction.getPhotoIds()) {
            if (purchaseRepository.existsByUserIdAndPhotoId(userId, photoId)) {
                log.info("Purchase already exists, skipped: userId={}, photoId={}", userId, photoId);
                continue;
            }
            purchaseRepository.save(Purchase.create(userId, photoId, sessionId, completedAt));
            granted.add(photoId);
        }

        cartItemRepository.deleteByUserId(userId);
        int deletedCarts = cartRepository.deleteByUserId(userId);

        purchaseEventPublisher.publish(PurchaseCompletedEvent.of(transaction, granted, completedAt));

        log.info("Payment transaction completed: sessionId={}, transactionId={}, userId={}, granted={}, cartDeleted={}",
            sessionId, transaction.getTransactionId(), userId, granted, deletedCarts > 0);
        return true;
    }
}
