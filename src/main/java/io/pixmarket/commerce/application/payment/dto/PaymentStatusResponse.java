package io.pixmarket.commerce.application.payment.dto;

import io.pixmarket.commerce.domain.payment.PaymentTransaction;
import io.pixmarket.commerce.infrastructure.external.GatewaySessionStatus;

/**
 * 결제 상태 응답 (폴링)
 *
 * @param status        결제사 세션 상태 (open, complete, expired)
 * @param paymentStatus 결제사 결제 상태 (unpaid, paid)
 * @param amountTotal   결제 금액 (최소 화폐 단위)
 * @param fulfilled     구매 내역 반영 완료 여부 (원장 COMPLETED)
 */
public record PaymentStatusResponse(
    String sessionId,
    String status,
    String paymentStatus,
    Long amountTotal,
    String currency,
    boolean fulfilled
) {
    public static PaymentStatusResponse of(PaymentTransaction transaction, GatewaySessionStatus gatewayStatus) {
        return new PaymentStatusResponse(
            transaction.getSessionId(),
            gatewayStatus.status(),
            gatewayStatus.paymentStatus(),
            gatewayStatus.amountTotal(),
            gatewayStatus.currency(),
            transaction.isCompleted()
        );
    }

    /**
     * 결제사 응답 없이 원장만으로 상태 구성 (결제사 장애 또는 이미 완료된 경우)
     */
    public static PaymentStatusResponse fromLedger(PaymentTransaction transaction) {
        boolean completed = transaction.isCompleted();
        return new PaymentStatusResponse(
            transaction.getSessionId(),
            completed ? "complete" : "open",
            completed ? GatewaySessionStatus.PAID : "unpaid",
            transaction.getAmount(),
            transaction.getCurrency(),
            completed
        );
    }
}
