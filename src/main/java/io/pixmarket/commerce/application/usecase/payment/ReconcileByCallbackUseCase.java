package io.pixmarket.commerce.application.usecase.payment;

import io.pixmarket.commerce.application.payment.dto.CallbackAckResponse;
import io.pixmarket.commerce.application.usecase.UseCase;
import io.pixmarket.commerce.common.exception.BusinessException;
import io.pixmarket.commerce.infrastructure.external.GatewayCallback;
import io.pixmarket.commerce.infrastructure.external.PaymentGateway;
import io.pixmarket.commerce.infrastructure.metrics.MetricsCollector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 결제사 콜백 UseCase
 * <p>
 * 서명 검증이 가장 먼저다. 검증 실패 시 상태 변경 없이 INVALID_SIGNATURE.
 * 결제 완료 세션 이벤트가 아니면 상태 변경 없이 수신 확인만 한다.
 */
@Slf4j
@UseCase
@RequiredArgsConstructor
public class ReconcileByCallbackUseCase {

    private final PaymentGateway paymentGateway;
    private final PaymentReconciler paymentReconciler;
    private final MetricsCollector metricsCollector;

    public CallbackAckResponse execute(String rawBody, String signature) {
        GatewayCallback callback;
        try {
            callback = paymentGateway.verifyCallback(rawBody, signature);
        } catch (BusinessException e) {
            metricsCollector.recordCallbackRejected();
            log.warn("Payment callback rejected: code={}, reason={}", e.getCode(), e.getMessage());
            throw e;
        }

        if (!callback.isPaidCheckoutSession()) {
            log.debug("Payment callback ignored: type={}, sessionId={}, paymentStatus={}",
                callback.eventType(), callback.sessionId(), callback.paymentStatus());
            return CallbackAckResponse.ok();
        }

        paymentReconciler.reconcile(callback.sessionId(), true, ReconciliationTrigger.CALLBACK);
        return CallbackAckResponse.ok();
    }
}
