package io.pixmarket.commerce.presentation.api.purchase;

import io.pixmarket.commerce.application.purchase.dto.AccessGrantResponse;
import io.pixmarket.commerce.application.purchase.dto.PurchaseResponse;
import io.pixmarket.commerce.application.usecase.purchase.CheckAccessGrantUseCase;
import io.pixmarket.commerce.application.usecase.purchase.GetPurchasesUseCase;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/purchases")
@RequiredArgsConstructor
public class PurchaseController {

    private final GetPurchasesUseCase getPurchasesUseCase;
    private final CheckAccessGrantUseCase checkAccessGrantUseCase;

    @GetMapping
    public ResponseEntity<List<PurchaseResponse>> getPurchases(
        @RequestParam Long userId
    ) {
        return ResponseEntity.ok(getPurchasesUseCase.execute(userId));
    }

    /**
     * 원본 사진 열람 권한 확인
     */
    @GetMapping("/check")
    public ResponseEntity<AccessGrantResponse> checkAccess(
        @RequestParam Long userId,
        @RequestParam Long photoId
    ) {
        return ResponseEntity.ok(checkAccessGrantUseCase.execute(userId, photoId));
    }
}
