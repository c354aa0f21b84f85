package io.pixmarket.commerce.application.usecase.payment;

import io.pixmarket.commerce.common.exception.BusinessException;
import io.pixmarket.commerce.common.exception.ErrorCode;
import io.pixmarket.commerce.domain.payment.PaymentTransaction;
import io.pixmarket.commerce.domain.payment.PaymentTransactionRepository;
import io.pixmarket.commerce.infrastructure.metrics.MetricsCollector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;

/**
 * 결제 정산기
 * <p>
 * 폴링, 콜백, 점검 스케줄러가 모두 이 경로로 들어온다.
 * 트리거가 몇 번, 어떤 순서로 호출되더라도 결제 세션당 구매 반영은 정확히 한 번이다.
 * <p>
 * 동시성 제어는 원장의 조건부 UPDATE 하나로만 한다. (애플리케이션 락 없음)
 * 완료 처리에서 진 호출이나 일시적 DB 오류를 만난 호출은 원장을 다시 읽어 결과를 정한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentReconciler {

    private final PaymentTransactionRepository paymentTransactionRepository;
    private final PurchaseMaterializer purchaseMaterializer;
    private final MetricsCollector metricsCollector;

    /**
     * @param sessionId 결제 세션 ID
     * @param paid      결제사가 결제 완료를 확인했는지
     * @throws BusinessException UNKNOWN_SESSION, RECONCILIATION_CONFLICT
     */
    public ReconciliationResult reconcile(String sessionId, boolean paid, ReconciliationTrigger trigger) {
        PaymentTransaction transaction = paymentTransactionRepository.findBySessionIdOrThrow(sessionId);

        if (transaction.isCompleted()) {
            return record(trigger, new ReconciliationResult(transaction, ReconciliationResult.Outcome.ALREADY_COMPLETED));
        }
        if (!paid) {
            return record(trigger, new ReconciliationResult(transaction, ReconciliationResult.Outcome.PENDING));
        }

        boolean won;
        try {
            won = purchaseMaterializer.completeAndMaterialize(sessionId);
        } catch (DataIntegrityViolationException | TransientDataAccessException e) {
            log.warn("Materialization failed after retries, re-reading ledger: sessionId={}, trigger={}, error={}",
                sessionId, trigger.tag(), e.getMessage());
            won = false;
        }

        PaymentTransaction current = paymentTransactionRepository.findBySessionIdOrThrow(sessionId);
        if (won) {
            return record(trigger, new ReconciliationResult(current, ReconciliationResult.Outcome.COMPLETED));
        }
        if (current.isCompleted()) {
            return record(trigger, new ReconciliationResult(current, ReconciliationResult.Outcome.ALREADY_COMPLETED));
        }

        metricsCollector.recordReconciliation(trigger.tag(), "conflict");
        throw new BusinessException(ErrorCode.RECONCILIATION_CONFLICT,
            "결제 완료 처리에 실패했습니다. sessionId: " + sessionId);
    }

    private ReconciliationResult record(ReconciliationTrigger trigger, ReconciliationResult result) {
        metricsCollector.recordReconciliation(trigger.tag(), result.outcome().tag());
        if (result.outcome() == ReconciliationResult.Outcome.COMPLETED) {
            log.info("Reconciled by {}: sessionId={}", trigger.tag(), result.transaction().getSessionId());
        }
        return result;
    }
}
