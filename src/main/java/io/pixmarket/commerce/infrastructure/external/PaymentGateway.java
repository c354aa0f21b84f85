package io.pixmarket.commerce.infrastructure.external;

/**
 * 결제사(Payment Processor) 연동 인터페이스
 * <p>
 * Stripe Checkout 호환 결제사를 추상화한다.
 * <p>
 * 현재 구현:
 * - MockPaymentGateway: 인메모리 세션 + Stripe 호환 서명 (prod 외 프로파일)
 * - StripePaymentGateway: stripe-java SDK (prod 프로파일)
 * <p>
 * 모든 호출은 DB 트랜잭션 밖에서 수행해야 한다.
 */
public interface PaymentGateway {

    /**
     * 결제 세션 생성
     *
     * @throws io.pixmarket.commerce.common.exception.BusinessException PAYMENT_GATEWAY_ERROR
     */
    GatewaySession createSession(CreateSessionCommand command);

    /**
     * 결제 세션 상태 조회 (연결/읽기 타임아웃 적용)
     *
     * @throws io.pixmarket.commerce.common.exception.BusinessException PAYMENT_GATEWAY_ERROR
     */
    GatewaySessionStatus getStatus(String sessionId);

    /**
     * 콜백 서명 검증 후 본문 해석
     *
     * @param rawBody   서명 대상 원문 (파싱 전 바이트 그대로)
     * @param signature Stripe-Signature 헤더 값
     * @throws io.pixmarket.commerce.common.exception.BusinessException INVALID_SIGNATURE
     */
    GatewayCallback verifyCallback(String rawBody, String signature);
}
