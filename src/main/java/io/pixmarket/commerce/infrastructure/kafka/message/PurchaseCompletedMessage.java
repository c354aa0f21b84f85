package io.pixmarket.commerce.infrastructure.kafka.message;

import io.pixmarket.commerce.domain.payment.PurchaseCompletedEvent;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Kafka 구매 완료 메시지 DTO
 * - Kafka Topic: purchase-completed
 * - Producer: PurchaseEventProducer
 * - Key: sessionId (같은 세션 메시지는 같은 파티션)
 */
public record PurchaseCompletedMessage(
    String sessionId,
    String transactionId,
    Long userId,
    List<Long> photoIds,
    List<Long> grantedPhotoIds,
    Long amount,
    String currency,
    LocalDateTime completedAt
) {
    public static PurchaseCompletedMessage from(PurchaseCompletedEvent event) {
        return new PurchaseCompletedMessage(
            event.getSessionId(),
            event.getTransactionId(),
            event.getUserId(),
            event.getPhotoIds(),
            event.getGrantedPhotoIds(),
            event.getAmount(),
            event.getCurrency(),
            event.getCompletedAt()
        );
    }
}
