package io.pixmarket.commerce.application.usecase.payment;

/**
 * 정산 트리거 (결제 확인 경로)
 */
public enum ReconciliationTrigger {
    /**
     * 클라이언트 결제 상태 폴링
     */
    POLL,

    /**
     * 결제사 콜백 (webhook)
     */
    CALLBACK,

    /**
     * 미완료 결제 점검 스케줄러
     */
    SWEEP;

    public String tag() {
        return name().toLowerCase();
    }
}
