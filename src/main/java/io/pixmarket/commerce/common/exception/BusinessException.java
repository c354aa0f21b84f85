package io.pixmarket.commerce.common.exception;

import lombok.Getter;

/**
 * 비즈니스 규칙 위반 예외
 * <p>
 * 장바구니/체크아웃/정산 흐름에서 발생하는 모든 예상된 실패는 이 예외와 {@link ErrorCode}로 표현한다.
 * HTTP 상태 매핑은 GlobalExceptionHandler가 담당한다.
 */
@Getter
public class BusinessException extends RuntimeException {

    private final ErrorCode errorCode;

    public BusinessException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String customMessage) {
        super(customMessage);
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String customMessage, Throwable cause) {
        super(customMessage, cause);
        this.errorCode = errorCode;
    }

    public String getCode() {
        return errorCode.getCode();
    }
}
