package io.pixmarket.commerce.domain.payment;

import lombok.Getter;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 구매 완료 이벤트
 * <p>
 * 결제 트랜잭션 완료와 구매 내역 반영이 같은 DB 트랜잭션에서 커밋된 뒤
 * {@code @TransactionalEventListener(phase = AFTER_COMMIT)}에서 수신한다.
 * 이벤트 전달이 실패해도 구매 내역은 유지된다.
 */
@Getter
public class PurchaseCompletedEvent {

    private final String sessionId;
    private final String transactionId;
    private final Long userId;
    private final List<Long> photoIds;         // 결제된 전체 사진
    private final List<Long> grantedPhotoIds;  // 이번에 새로 부여된 사진
    private final Long amount;
    private final String currency;
    private final LocalDateTime completedAt;

    public PurchaseCompletedEvent(String sessionId, String transactionId, Long userId,
                                  List<Long> photoIds, List<Long> grantedPhotoIds,
                                  Long amount, String currency, LocalDateTime completedAt) {
        this.sessionId = sessionId;
        this.transactionId = transactionId;
        this.userId = userId;
        this.photoIds = List.copyOf(photoIds);
        this.grantedPhotoIds = List.copyOf(grantedPhotoIds);
        this.amount = amount;
        this.currency = currency;
        this.completedAt = completedAt;
    }

    public static PurchaseCompletedEvent of(PaymentTransaction transaction, List<Long> grantedPhotoIds,
                                            LocalDateTime completedAt) {
        return new PurchaseCompletedEvent(
            transaction.getSessionId(),
            transaction.getTransactionId(),
            transaction.getUserId(),
            transaction.getPhotoIds(),
            grantedPhotoIds,
            transaction.getAmount(),
            transaction.getCurrency(),
            completedAt
        );
    }
}
