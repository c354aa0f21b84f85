package io.pixmarket.commerce.application.usecase.payment;

import io.pixmarket.commerce.application.payment.dto.PaymentStatusResponse;
import io.pixmarket.commerce.application.usecase.UseCase;
import io.pixmarket.commerce.common.exception.BusinessException;
import io.pixmarket.commerce.common.exception.ErrorCode;
import io.pixmarket.commerce.domain.payment.PaymentTransaction;
import io.pixmarket.commerce.domain.payment.PaymentTransactionRepository;
import io.pixmarket.commerce.infrastructure.external.GatewaySessionStatus;
import io.pixmarket.commerce.infrastructure.external.PaymentGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 결제 상태 폴링 UseCase (결제 완료 페이지에서 호출)
 * <p>
 * 1. 세션 소유자 확인 (다른 사용자의 세션은 존재 여부도 노출하지 않음)
 * 2. 결제사 상태 조회 (트랜잭션 밖, 타임아웃/장애 시 "아직 미결제"로 간주)
 * 3. 정산기 호출
 */
@Slf4j
@UseCase
@RequiredArgsConstructor
public class ReconcileByPollUseCase {

    private final PaymentTransactionRepository paymentTransactionRepository;
    private final PaymentGateway paymentGateway;
    private final PaymentReconciler paymentReconciler;

    public PaymentStatusResponse execute(String sessionId, Long userId) {
        PaymentTransaction transaction = paymentTransactionRepository.findBySessionId(sessionId)
            .filter(tx -> tx.isOwnedBy(userId))
            .orElseThrow(() -> new BusinessException(ErrorCode.UNKNOWN_SESSION,
                "결제 세션을 찾을 수 없습니다. sessionId: " + sessionId));

        if (transaction.isCompleted()) {
            return PaymentStatusResponse.fromLedger(transaction);
        }

        GatewaySessionStatus gatewayStatus = queryGateway(sessionId);
        boolean paid = gatewayStatus != null && gatewayStatus.isPaid();

        ReconciliationResult result = paymentReconciler.reconcile(sessionId, paid, ReconciliationTrigger.POLL);

        return gatewayStatus != null
            ? PaymentStatusResponse.of(result.transaction(), gatewayStatus)
            : PaymentStatusResponse.fromLedger(result.transaction());
    }

    private GatewaySessionStatus queryGateway(String sessionId) {
        try {
            return paymentGateway.getStatus(sessionId);
        } catch (RuntimeException e) {
            log.warn("Payment gateway status query failed, treating as unpaid: sessionId={}, error={}",
                sessionId, e.getMessage());
            return null;
        }
    }
}
