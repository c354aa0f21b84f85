package io.pixmarket.commerce.presentation.api.payment;

import io.pixmarket.commerce.application.payment.dto.CallbackAckResponse;
import io.pixmarket.commerce.application.usecase.payment.ReconcileByCallbackUseCase;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.charset.StandardCharsets;

/**
 * 결제사 콜백 수신
 * <p>
 * 서명은 원문 바이트 기준이므로 본문을 객체로 바인딩하지 않는다.
 * 빈 본문도 서명 검증에서 INVALID_SIGNATURE로 거부되도록 required = false.
 */
@RestController
@RequestMapping("/api/webhooks")
@RequiredArgsConstructor
public class PaymentWebhookController {

    static final String SIGNATURE_HEADER = "Stripe-Signature";

    private final ReconcileByCallbackUseCase reconcileByCallbackUseCase;

    @PostMapping("/payment")
    public ResponseEntity<CallbackAckResponse> receive(
        @RequestBody(required = false) byte[] body,
        @RequestHeader(value = SIGNATURE_HEADER, required = false) String signature
    ) {
        String rawBody = body == null ? null : new String(body, StandardCharsets.UTF_8);
        return ResponseEntity.ok(reconcileByCallbackUseCase.execute(rawBody, signature));
    }
}
