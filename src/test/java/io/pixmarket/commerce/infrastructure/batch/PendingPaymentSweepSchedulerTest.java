package io.pixmarket.commerce.infrastructure.batch;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.pixmarket.commerce.application.usecase.payment.PaymentReconciler;
import io.pixmarket.commerce.application.usecase.payment.ReconciliationResult;
import io.pixmarket.commerce.application.usecase.payment.ReconciliationTrigger;
import io.pixmarket.commerce.common.exception.BusinessException;
import io.pixmarket.commerce.common.exception.ErrorCode;
import io.pixmarket.commerce.config.ReconciliationProperties;
import io.pixmarket.commerce.domain.checkout.PriceSnapshot;
import io.pixmarket.commerce.domain.checkout.PriceSnapshotLine;
import io.pixmarket.commerce.domain.payment.PaymentTransaction;
import io.pixmarket.commerce.domain.payment.PaymentTransactionRepository;
import io.pixmarket.commerce.domain.payment.PaymentTransactionStatus;
import io.pixmarket.commerce.infrastructure.external.GatewaySessionStatus;
import io.pixmarket.commerce.infrastructure.external.PaymentGateway;
import io.pixmarket.commerce.infrastructure.metrics.MetricsCollector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Limit;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PendingPaymentSweepSchedulerTest {

    @Mock
    private PaymentTransactionRepository paymentTransactionRepository;

    @Mock
    private PaymentGateway paymentGateway;

    @Mock
    private PaymentReconciler paymentReconciler;

    private SimpleMeterRegistry meterRegistry;
    private PendingPaymentSweepScheduler scheduler;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        scheduler = new PendingPaymentSweepScheduler(
            paymentTransactionRepository,
            paymentGateway,
            paymentReconciler,
            new ReconciliationProperties(),
            new MetricsCollector(meterRegistry)
        );
    }

    @Test
    @DisplayName("오래된 PENDING 건마다 결제사 상태를 조회해 SWEEP 트리거로 정산")
    void sweep_결제완료건정산() {
        // Given
        PaymentTransaction paid = transaction("cs_paid");
        PaymentTransaction unpaid = transaction("cs_unpaid");
        when(paymentTransactionRepository.findByStatusAndCreatedAtBeforeOrderByCreatedAtAsc(
            eq(PaymentTransactionStatus.PENDING), any(LocalDateTime.class), eq(Limit.of(50))))
            .thenReturn(List.of(paid, unpaid));
        when(paymentGateway.getStatus("cs_paid")).thenReturn(new GatewaySessionStatus("complete", "paid", 700L, "eur"));
        when(paymentGateway.getStatus("cs_unpaid")).thenReturn(new GatewaySessionStatus("open", "unpaid", 700L, "eur"));
        when(paymentReconciler.reconcile("cs_paid", true, ReconciliationTrigger.SWEEP))
            .thenReturn(new ReconciliationResult(paid, ReconciliationResult.Outcome.COMPLETED));
        when(paymentReconciler.reconcile("cs_unpaid", false, ReconciliationTrigger.SWEEP))
            .thenReturn(new ReconciliationResult(unpaid, ReconciliationResult.Outcome.PENDING));
        when(paymentTransactionRepository.countByStatusAndCreatedAtBefore(
            eq(PaymentTransactionStatus.PENDING), any(LocalDateTime.class)))
            .thenReturn(1L);

        // When
        scheduler.sweepPendingPayments();

        // Then
        verify(paymentReconciler).reconcile("cs_paid", true, ReconciliationTrigger.SWEEP);
        verify(paymentReconciler).reconcile("cs_unpaid", false, ReconciliationTrigger.SWEEP);
        assertThat(meterRegistry.get("payment_pending_stale").gauge().value()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("결제사 조회 실패나 정산 충돌은 해당 건만 건너뛰고 계속 진행")
    void sweep_실패건건너뜀() {
        // Given
        PaymentTransaction down = transaction("cs_down");
        PaymentTransaction conflict = transaction("cs_conflict");
        PaymentTransaction ok = transaction("cs_ok");
        when(paymentTransactionRepository.findByStatusAndCreatedAtBeforeOrderByCreatedAtAsc(
            eq(PaymentTransactionStatus.PENDING), any(LocalDateTime.class), any(Limit.class)))
            .thenReturn(List.of(down, conflict, ok));
        when(paymentGateway.getStatus("cs_down"))
            .thenThrow(new BusinessException(ErrorCode.PAYMENT_GATEWAY_ERROR));
        when(paymentGateway.getStatus("cs_conflict")).thenReturn(new GatewaySessionStatus("complete", "paid", 700L, "eur"));
        when(paymentGateway.getStatus("cs_ok")).thenReturn(new GatewaySessionStatus("complete", "paid", 700L, "eur"));
        when(paymentReconciler.reconcile("cs_conflict", true, ReconciliationTrigger.SWEEP))
            .thenThrow(new BusinessException(ErrorCode.RECONCILIATION_CONFLICT));
        when(paymentReconciler.reconcile("cs_ok", true, ReconciliationTrigger.SWEEP))
            .thenReturn(new ReconciliationResult(ok, ReconciliationResult.Outcome.COMPLETED));
        when(paymentTransactionRepository.countByStatusAndCreatedAtBefore(
            eq(PaymentTransactionStatus.PENDING), any(LocalDateTime.class)))
            .thenReturn(2L);

        // When
        scheduler.sweepPendingPayments();

        // Then
        verify(paymentReconciler, never()).reconcile(eq("cs_down"), anyBoolean(), any());
        verify(paymentReconciler).reconcile("cs_ok", true, ReconciliationTrigger.SWEEP);
        assertThat(meterRegistry.get("payment_pending_stale").gauge().value()).isEqualTo(2.0);
    }

    private PaymentTransaction transaction(String sessionId) {
        return PaymentTransaction.create(sessionId, 1L,
            PriceSnapshot.of(List.of(new PriceSnapshotLine(3L, 700L))), "eur");
    }
}
