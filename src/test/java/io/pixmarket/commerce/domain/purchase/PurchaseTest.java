package io.pixmarket.commerce.domain.purchase;

import io.pixmarket.commerce.common.exception.BusinessException;
import io.pixmarket.commerce.common.exception.ErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.*;

class PurchaseTest {

    @Test
    @DisplayName("구매 생성 - 결제 세션과 구매 시각 기록")
    void create_성공() {
        LocalDateTime now = LocalDateTime.now();

        Purchase purchase = Purchase.create(1L, 5L, "cs_test_1", now);

        assertThat(purchase.getPurchaseNumber()).startsWith("purch_");
        assertThat(purchase.getUserId()).isEqualTo(1L);
        assertThat(purchase.getPhotoId()).isEqualTo(5L);
        assertThat(purchase.getSessionId()).isEqualTo("cs_test_1");
        assertThat(purchase.getPurchasedAt()).isEqualTo(now);
    }

    @Test
    @DisplayName("사진 ID가 없으면 실패")
    void create_실패() {
        assertThatThrownBy(() -> Purchase.create(1L, null, "cs_test_1", LocalDateTime.now()))
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.INVALID_INPUT);
    }
}
