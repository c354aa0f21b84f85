package io.pixmarket.commerce.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 비즈니스 에러 코드 정의
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // ====================================
    // 사진(카탈로그) 관련 (PH)
    // ====================================
    PHOTO_NOT_FOUND("PH001", "사진을 찾을 수 없습니다"),

    // ====================================
    // 장바구니 관련 (CART)
    // ====================================
    EMPTY_CART("CART003", "장바구니가 비어 있어 결제할 수 없습니다"),

    // ====================================
    // 결제/정산 관련 (PAY)
    // ====================================
    UNKNOWN_SESSION("PAY003", "결제 세션을 찾을 수 없습니다"),
    INVALID_SIGNATURE("PAY004", "결제 콜백 서명 검증에 실패했습니다"),
    PAYMENT_GATEWAY_ERROR("PAY005", "결제사 호출에 실패했습니다"),
    RECONCILIATION_CONFLICT("PAY006", "결제 정산이 다른 요청과 충돌했습니다. 잠시 후 다시 시도해주세요"),

    // ====================================
    // 구매 관련 (PUR)
    // ====================================
    ALREADY_PURCHASED("PUR001", "이미 구매한 사진입니다"),

    // ====================================
    // 공통 (COMMON)
    // ====================================
    INTERNAL_SERVER_ERROR("COMMON001", "서버 내부 오류가 발생했습니다"),
    INVALID_INPUT("COMMON002", "입력값이 올바르지 않습니다");

    private final String code;
    private final String message;
}
