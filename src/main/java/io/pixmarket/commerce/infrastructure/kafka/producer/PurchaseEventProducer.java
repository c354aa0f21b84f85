package io.pixmarket.commerce.infrastructure.kafka.producer;

import io.pixmarket.commerce.infrastructure.kafka.message.PurchaseCompletedMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Slf4j
@Component
@RequiredArgsConstructor
public class PurchaseEventProducer {

    public static final String PURCHASE_COMPLETED_TOPIC = "purchase-completed";

    private static final long SEND_TIMEOUT_SECONDS = 10;

    private final KafkaTemplate<String, Object> kafkaTemplate;

    /**
     * 브로커 확인(ack)까지 대기한다. 실패 시 예외를 던져 호출 측 @Retryable이 재시도하도록 한다.
     */
    public void publishPurchaseCompleted(PurchaseCompletedMessage message) {
        try {
            SendResult<String, Object> result = kafkaTemplate
                .send(PURCHASE_COMPLETED_TOPIC, message.sessionId(), message)
                .get(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS);

            var metadata = result.getRecordMetadata();
            log.info("Kafka message published: sessionId={}, topic={}, partition={}, offset={}",
                message.sessionId(),
                metadata.topic(),
                metadata.partition(),
                metadata.offset()
            );
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Kafka 메시지 발행 중 인터럽트", e);
        } catch (ExecutionException | TimeoutException e) {
            log.error("Failed to publish Kafka message: sessionId={}, error={}",
                message.sessionId(), e.getMessage());
            throw new IllegalStateException("Kafka 메시지 발행 실패", e);
        }
    }
}
