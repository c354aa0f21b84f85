package io.pixmarket.commerce.domain.payment;

import io.pixmarket.commerce.common.exception.BusinessException;
import io.pixmarket.commerce.common.exception.ErrorCode;
import io.pixmarket.commerce.domain.checkout.PriceSnapshot;
import io.pixmarket.commerce.domain.checkout.PriceSnapshotLine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class PaymentTransactionTest {

    private final PriceSnapshot snapshot = PriceSnapshot.of(List.of(
        new PriceSnapshotLine(3L, 1000L),
        new PriceSnapshotLine(4L, 250L)
    ));

    @Test
    @DisplayName("결제 트랜잭션은 PENDING으로 생성되고 스냅샷 금액을 그대로 가진다")
    void create_PENDING() {
        // When
        PaymentTransaction transaction = PaymentTransaction.create("cs_test_9", 7L, snapshot, "eur");

        // Then
        assertThat(transaction.getStatus()).isEqualTo(PaymentTransactionStatus.PENDING);
        assertThat(transaction.isCompleted()).isFalse();
        assertThat(transaction.getCompletedAt()).isNull();
        assertThat(transaction.getTransactionId()).startsWith("txn_");
        assertThat(transaction.getAmount()).isEqualTo(1250L);
        assertThat(transaction.getPhotoIds()).containsExactly(3L, 4L);
    }

    @Test
    @DisplayName("트랜잭션 ID는 생성마다 다르다")
    void create_트랜잭션ID_고유() {
        PaymentTransaction first = PaymentTransaction.create("cs_a", 7L, snapshot, "eur");
        PaymentTransaction second = PaymentTransaction.create("cs_b", 7L, snapshot, "eur");

        assertThat(first.getTransactionId()).isNotEqualTo(second.getTransactionId());
    }

    @Test
    @DisplayName("소유자 확인")
    void isOwnedBy() {
        PaymentTransaction transaction = PaymentTransaction.create("cs_test_9", 7L, snapshot, "eur");

        assertThat(transaction.isOwnedBy(7L)).isTrue();
        assertThat(transaction.isOwnedBy(8L)).isFalse();
    }

    @Test
    @DisplayName("빈 스냅샷으로는 생성할 수 없다")
    void create_실패_빈스냅샷() {
        assertThatThrownBy(() -> PaymentTransaction.create("cs_test_9", 7L, PriceSnapshot.of(List.of()), "eur"))
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.EMPTY_CART);
    }
}
