package io.pixmarket.commerce.application.usecase.payment;

import io.pixmarket.commerce.domain.payment.PurchaseCompletedEvent;

/**
 * 구매 완료 이벤트 퍼블리셔 추상화
 * - 테스트에서 mock/verify 가능하도록 분리
 */
public interface PurchaseEventPublisher {

    void publish(PurchaseCompletedEvent event);
}
