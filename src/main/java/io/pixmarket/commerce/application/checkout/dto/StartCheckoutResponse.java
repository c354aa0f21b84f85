package io.pixmarket.commerce.application.checkout.dto;

import io.pixmarket.commerce.domain.checkout.CheckoutSession;

/**
 * 체크아웃 시작 응답 (결제 페이지로 리다이렉트)
 */
public record StartCheckoutResponse(
    String sessionId,
    String url,
    Long amount,
    String currency
) {
    public static StartCheckoutResponse of(CheckoutSession session, String redirectUrl) {
        return new StartCheckoutResponse(
            session.getSessionId(),
            redirectUrl,
            session.getTotalAmount(),
            session.getCurrency()
        );
    }
}
