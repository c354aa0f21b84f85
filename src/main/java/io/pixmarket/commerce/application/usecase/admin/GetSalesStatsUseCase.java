package io.pixmarket.commerce.application.usecase.admin;

import io.pixmarket.commerce.application.admin.dto.SalesStatsResponse;
import io.pixmarket.commerce.application.usecase.UseCase;
import io.pixmarket.commerce.config.PaymentGatewayProperties;
import io.pixmarket.commerce.config.ReconciliationProperties;
import io.pixmarket.commerce.domain.payment.PaymentTransactionRepository;
import io.pixmarket.commerce.domain.payment.PaymentTransactionStatus;
import io.pixmarket.commerce.domain.photo.PhotoRepository;
import io.pixmarket.commerce.domain.purchase.PurchaseRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

@UseCase
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class GetSalesStatsUseCase {

    private final PhotoRepository photoRepository;
    private final PurchaseRepository purchaseRepository;
    private final PaymentTransactionRepository paymentTransactionRepository;
    private final PaymentGatewayProperties gatewayProperties;
    private final ReconciliationProperties reconciliationProperties;

    public SalesStatsResponse execute() {
        LocalDateTime staleBefore = LocalDateTime.now().minus(reconciliationProperties.getStaleAfter());

        return new SalesStatsResponse(
            photoRepository.count(),
            purchaseRepository.count(),
            paymentTransactionRepository.countByStatus(PaymentTransactionStatus.COMPLETED),
            paymentTransactionRepository.countByStatus(PaymentTransactionStatus.PENDING),
            paymentTransactionRepository.sumAmountByStatus(PaymentTransactionStatus.COMPLETED),
            gatewayProperties.getCurrency(),
            paymentTransactionRepository.countByStatusAndCreatedAtBefore(PaymentTransactionStatus.PENDING, staleBefore)
        );
    }
}
