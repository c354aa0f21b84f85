package io.pixmarket.commerce.application.payment.dto;

/**
 * 결제사 콜백 수신 확인
 */
public record CallbackAckResponse(String status) {

    public static CallbackAckResponse ok() {
        return new CallbackAckResponse("ok");
    }
}
