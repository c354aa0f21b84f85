package io.pixmarket.commerce.infrastructure.external;

/**
 * 서명 검증을 통과한 결제사 콜백
 * <p>
 * 결제 완료 세션 이벤트가 아니면 sessionId, paymentStatus가 null일 수 있다.
 */
public record GatewayCallback(String eventType, String sessionId, String paymentStatus) {

    public static final String CHECKOUT_SESSION_COMPLETED = "checkout.session.completed";
    public static final String CHECKOUT_SESSION_ASYNC_PAYMENT_SUCCEEDED = "checkout.session.async_payment_succeeded";

    public boolean isPaidCheckoutSession() {
        boolean checkoutEvent = CHECKOUT_SESSION_COMPLETED.equals(eventType)
            || CHECKOUT_SESSION_ASYNC_PAYMENT_SUCCEEDED.equals(eventType);
        return checkoutEvent
            && sessionId != null
            && GatewaySessionStatus.PAID.equals(paymentStatus);
    }
}
