package io.pixmarket.commerce.infrastructure.batch;

import io.pixmarket.commerce.application.usecase.payment.PaymentReconciler;
import io.pixmarket.commerce.application.usecase.payment.ReconciliationResult;
import io.pixmarket.commerce.application.usecase.payment.ReconciliationTrigger;
import io.pixmarket.commerce.common.exception.BusinessException;
import io.pixmarket.commerce.config.ReconciliationProperties;
import io.pixmarket.commerce.domain.payment.PaymentTransaction;
import io.pixmarket.commerce.domain.payment.PaymentTransactionRepository;
import io.pixmarket.commerce.domain.payment.PaymentTransactionStatus;
import io.pixmarket.commerce.infrastructure.external.GatewaySessionStatus;
import io.pixmarket.commerce.infrastructure.external.PaymentGateway;
import io.pixmarket.commerce.infrastructure.metrics.MetricsCollector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.Limit;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 미완료(PENDING) 결제 점검 스케줄러
 * <p>
 * 사용자가 결제 후 완료 페이지를 닫고 콜백도 유실된 경우를 위한 세 번째 트리거.
 * 오래된 PENDING 트랜잭션의 결제사 상태를 조회해 폴링/콜백과 같은 정산기로 넘긴다.
 * <p>
 * 만료 처리는 하지 않는다. 남은 PENDING 건수는 게이지(payment_pending_stale)와 WARN 로그로 남긴다.
 * <p>
 * payment.reconciliation.sweep-enabled=false 이면 등록되지 않는다. (테스트 프로파일)
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "payment.reconciliation", name = "sweep-enabled", havingValue = "true", matchIfMissing = true)
public class PendingPaymentSweepScheduler {

    private final PaymentTransactionRepository paymentTransactionRepository;
    private final PaymentGateway paymentGateway;
    private final PaymentReconciler paymentReconciler;
    private final ReconciliationProperties properties;
    private final MetricsCollector metricsCollector;

    @Scheduled(
        fixedDelayString = "${payment.reconciliation.sweep-interval-ms:60000}",
        initialDelayString = "${payment.reconciliation.sweep-initial-delay-ms:30000}"
    )
    public void sweepPendingPayments() {
        LocalDateTime staleBefore = LocalDateTime.now().minus(properties.getStaleAfter());

        List<PaymentTransaction> stale = paymentTransactionRepository
            .findByStatusAndCreatedAtBeforeOrderByCreatedAtAsc(
                PaymentTransactionStatus.PENDING, staleBefore, Limit.of(properties.getBatchSize()));

        int completed = 0;
        for (PaymentTransaction transaction : stale) {
            if (sweep(transaction.getSessionId())) {
                completed++;
            }
        }

        long remaining = paymentTransactionRepository
            .countByStatusAndCreatedAtBefore(PaymentTransactionStatus.PENDING, staleBefore);
        metricsCollector.updateStalePendingCount(remaining);

        if (completed > 0) {
            log.info("Pending payment sweep completed {} transaction(s)", completed);
        }
        if (remaining > 0) {
            log.warn("{} payment transaction(s) still pending after {}", remaining, properties.getStaleAfter());
        }
    }

    private boolean sweep(String sessionId) {
        GatewaySessionStatus status;
        try {
            status = paymentGateway.getStatus(sessionId);
        } catch (RuntimeException e) {
            log.warn("Sweep status query failed: sessionId={}, error={}", sessionId, e.getMessage());
            return false;
        }

        try {
            ReconciliationResult result = paymentReconciler.reconcile(
                sessionId, status.isPaid(), ReconciliationTrigger.SWEEP);
            return result.outcome() == ReconciliationResult.Outcome.COMPLETED;
        } catch (BusinessException e) {
            log.warn("Sweep reconciliation failed: sessionId={}, code={}, error={}",
                sessionId, e.getCode(), e.getMessage());
            return false;
        }
    }
}
