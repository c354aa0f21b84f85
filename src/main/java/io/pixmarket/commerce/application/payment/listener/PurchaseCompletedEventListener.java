package io.pixmarket.commerce.application.payment.listener;

import io.pixmarket.commerce.domain.payment.PurchaseCompletedEvent;
import io.pixmarket.commerce.infrastructure.kafka.message.PurchaseCompletedMessage;
import io.pixmarket.commerce.infrastructure.kafka.producer.PurchaseEventProducer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * 구매 완료 → Kafka(purchase-completed) 발행
 * <p>
 * 커밋 이후 비동기로 실행되므로 발행 실패가 구매 반영에 영향을 주지 않는다.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PurchaseCompletedEventListener {

    private final PurchaseEventProducer purchaseEventProducer;

    @Async
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    @Retryable(
        maxAttempts = 3,
        backoff = @Backoff(delay = 1000, multiplier = 2),
        retryFor = {RuntimeException.class}
    )
    public void handlePurchaseCompleted(PurchaseCompletedEvent event) {
        log.info("Publishing purchase completed: sessionId={}, userId={}, granted={}",
            event.getSessionId(), event.getUserId(), event.getGrantedPhotoIds());

        purchaseEventProducer.publishPurchaseCompleted(PurchaseCompletedMessage.from(event));
    }

    @Recover
    public void recover(RuntimeException e, PurchaseCompletedEvent event) {
        log.error("Kafka 메시지 발행 최종 실패 (3회 재시도 후): sessionId={}, error={}",
            event.getSessionId(), e.getMessage(), e);
    }
}
