package io.pixmarket.commerce.infrastructure.external;

/**
 * 결제사가 발급한 세션 (세션 ID + 결제 페이지 URL)
 */
public record GatewaySession(String sessionId, String redirectUrl) {
}
