package io.pixmarket.commerce.presentation.api.checkout;

import io.pixmarket.commerce.application.checkout.dto.StartCheckoutRequest;
import io.pixmarket.commerce.application.checkout.dto.StartCheckoutResponse;
import io.pixmarket.commerce.application.payment.dto.PaymentStatusResponse;
import io.pixmarket.commerce.application.usecase.checkout.StartCheckoutUseCase;
import io.pixmarket.commerce.application.usecase.payment.ReconcileByPollUseCase;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

@Validated
@RestController
@RequestMapping("/api/checkout/sessions")
@RequiredArgsConstructor
public class CheckoutController {

    private final StartCheckoutUseCase startCheckoutUseCase;
    private final ReconcileByPollUseCase reconcileByPollUseCase;

    /**
     * 체크아웃 시작: 장바구니 가격 스냅샷으로 결제 세션 생성 후 결제 페이지 URL 반환
     */
    @PostMapping
    public ResponseEntity<StartCheckoutResponse> startCheckout(
        @Valid @RequestBody StartCheckoutRequest request
    ) {
        return ResponseEntity
            .status(HttpStatus.CREATED)
            .body(startCheckoutUseCase.execute(request));
    }

    /**
     * 결제 상태 폴링 (결제 완료 페이지). 결제가 확인되면 이 호출에서 구매가 반영될 수 있다.
     */
    @GetMapping("/{sessionId}/status")
    public ResponseEntity<PaymentStatusResponse> getStatus(
        @PathVariable String sessionId,
        @RequestParam Long userId
    ) {
        return ResponseEntity.ok(reconcileByPollUseCase.execute(sessionId, userId));
    }
}
