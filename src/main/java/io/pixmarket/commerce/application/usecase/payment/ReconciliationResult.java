package io.pixmarket.commerce.application.usecase.payment;

import io.pixmarket.commerce.domain.payment.PaymentTransaction;

/**
 * 정산 결과
 *
 * @param transaction 정산 후 다시 읽은 원장 레코드
 * @param outcome     이번 호출의 결과
 */
public record ReconciliationResult(PaymentTransaction transaction, Outcome outcome) {

    public enum Outcome {
        /**
         * 이번 호출이 PENDING → COMPLETED 전이와 구매 반영을 수행
         */
        COMPLETED,

        /**
         * 이미 다른 호출이 완료 처리함 (구매 반영 없이 성공)
         */
        ALREADY_COMPLETED,

        /**
         * 아직 결제되지 않음
         */
        PENDING;

        public String tag() {
            return name().toLowerCase();
        }
    }

    public boolean isFulfilled() {
        return transaction.isCompleted();
    }
}
