package io.pixmarket.commerce.application.payment.listener;

import io.pixmarket.commerce.domain.payment.PurchaseCompletedEvent;
import io.pixmarket.commerce.infrastructure.kafka.message.PurchaseCompletedMessage;
import io.pixmarket.commerce.infrastructure.kafka.producer.PurchaseEventProducer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.verify;

/**
 * PurchaseCompletedEventListener Unit Test
 *
 * 재시도(@Retryable)와 비동기 실행은 프록시 동작이므로 통합 테스트에서 확인한다.
 */
@ExtendWith(MockitoExtension.class)
class PurchaseCompletedEventListenerTest {

    @Mock
    private PurchaseEventProducer purchaseEventProducer;

    @InjectMocks
    private PurchaseCompletedEventListener listener;

    @Test
    @DisplayName("구매 완료 이벤트를 Kafka 메시지로 변환해 발행")
    void handlePurchaseCompleted_발행() {
        // Given
        PurchaseCompletedEvent event = event();

        // When
        listener.handlePurchaseCompleted(event);

        // Then
        ArgumentCaptor<PurchaseCompletedMessage> captor = ArgumentCaptor.forClass(PurchaseCompletedMessage.class);
        verify(purchaseEventProducer).publishPurchaseCompleted(captor.capture());
        PurchaseCompletedMessage message = captor.getValue();
        assertThat(message.sessionId()).isEqualTo("cs_test_1");
        assertThat(message.transactionId()).isEqualTo("txn_1");
        assertThat(message.photoIds()).containsExactly(1L, 2L);
        assertThat(message.grantedPhotoIds()).containsExactly(2L);
        assertThat(message.amount()).isEqualTo(1500L);
    }

    @Test
    @DisplayName("최종 실패 복구 처리는 예외를 다시 던지지 않는다 (구매 반영에 영향 없음)")
    void recover_예외없음() {
        assertThatCode(() -> listener.recover(new IllegalStateException("broker down"), event()))
            .doesNotThrowAnyException();
    }

    private PurchaseCompletedEvent event() {
        return new PurchaseCompletedEvent("cs_test_1", "txn_1", 1L, List.of(1L, 2L), List.of(2L),
            1500L, "eur", LocalDateTime.of(2025, 1, 1, 12, 0));
    }
}
