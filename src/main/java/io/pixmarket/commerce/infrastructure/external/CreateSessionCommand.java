package io.pixmarket.commerce.infrastructure.external;

import java.util.List;

/**
 * 결제 세션 생성 요청
 *
 * @param amount 결제 금액 (최소 화폐 단위, 예: 센트)
 */
public record CreateSessionCommand(
    Long userId,
    Long amount,
    String currency,
    List<Long> photoIds,
    String successUrl,
    String cancelUrl
) {
}
