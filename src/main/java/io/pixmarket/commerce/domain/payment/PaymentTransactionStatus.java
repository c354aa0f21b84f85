package io.pixmarket.commerce.domain.payment;

/**
 * 결제 트랜잭션 상태
 * <p>
 * PENDING → COMPLETED 한 방향으로만 전이된다.
 */
public enum PaymentTransactionStatus {
    /**
     * 대기중 (결제 세션 생성됨, 결제 확인 전)
     */
    PENDING,

    /**
     * 완료 (결제 확인 + 구매 내역 반영)
     */
    COMPLETED
}
