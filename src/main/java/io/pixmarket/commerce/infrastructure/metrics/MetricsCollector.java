package io.pixmarket.commerce.infrastructure.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 결제/정산 메트릭을 수집하는 컴포넌트
 *
 * 수집 메트릭:
 * - checkout_total{status}: 체크아웃 세션 생성 성공/실패 카운터
 * - checkout_duration_seconds: 체크아웃 처리 시간 (결제사 호출 포함)
 * - reconciliation_total{trigger, outcome}: 정산 시도 결과 (poll/callback/sweep)
 * - payment_callback_rejected_total: 서명 검증 실패 콜백
 * - payment_pending_stale: 오래된 PENDING 트랜잭션 수 (게이지)
 */
@Component
public class MetricsCollector {

    private final MeterRegistry meterRegistry;

    private final Counter checkoutSuccessCounter;
    private final Counter checkoutFailureCounter;
    private final Timer checkoutDurationTimer;

    private final Counter callbackRejectedCounter;

    private final AtomicLong stalePendingCount = new AtomicLong();

    public MetricsCollector(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.checkoutSuccessCounter = Counter.builder("checkout_total")
                .tag("status", "success")
                .description("Total number of created checkout sessions")
                .register(meterRegistry);

        this.checkoutFailureCounter = Counter.builder("checkout_total")
                .tag("status", "failure")
                .description("Total number of failed checkout attempts")
                .register(meterRegistry);

        this.checkoutDurationTimer = Timer.builder("checkout_duration_seconds")
                .description("Checkout processing duration including the processor call")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry);

        this.callbackRejectedCounter = Counter.builder("payment_callback_rejected_total")
                .description("Total number of callbacks rejected by signature verification")
                .register(meterRegistry);

        Gauge.builder("payment_pending_stale", stalePendingCount, AtomicLong::get)
                .description("Pending payment transactions older than the sweep threshold")
                .register(meterRegistry);
    }

    // ============================================================
    // 체크아웃
    // ============================================================

    public void recordCheckoutSuccess() {
        checkoutSuccessCounter.increment();
    }

    public void recordCheckoutFailure() {
        checkoutFailureCounter.increment();
    }

    public void recordCheckoutDuration(long startTimeMs) {
        long duration = System.currentTimeMillis() - startTimeMs;
        checkoutDurationTimer.record(duration, TimeUnit.MILLISECONDS);
    }

    // ============================================================
    // 정산
    // ============================================================

    /**
     * @param trigger poll, callback, sweep
     * @param outcome completed(이번 호출이 완료 처리), already_completed, pending, conflict
     */
    public void recordReconciliation(String trigger, String outcome) {
        Counter.builder("reconciliation_total")
                .tag("trigger", trigger)
                .tag("outcome", outcome)
                .description("Reconciliation attempts by trigger and outcome")
                .register(meterRegistry)
                .increment();
    }

    public void recordCallbackRejected() {
        callbackRejectedCounter.increment();
    }

    public void updateStalePendingCount(long count) {
        stalePendingCount.set(count);
    }
}
