package io.pixmarket.commerce.presentation.api.admin;

import io.pixmarket.commerce.application.admin.dto.SalesStatsResponse;
import io.pixmarket.commerce.application.usecase.admin.GetSalesStatsUseCase;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
public class SalesAdminController {

    private final GetSalesStatsUseCase getSalesStatsUseCase;

    @GetMapping("/sales")
    public ResponseEntity<SalesStatsResponse> getSales() {
        return ResponseEntity.ok(getSalesStatsUseCase.execute());
    }
}
