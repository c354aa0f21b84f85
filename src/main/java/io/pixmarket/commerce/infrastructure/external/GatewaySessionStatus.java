package io.pixmarket.commerce.infrastructure.external;

/**
 * 결제사 세션 상태
 *
 * @param status        세션 상태 (open, complete, expired)
 * @param paymentStatus 결제 상태 (unpaid, paid, no_payment_required)
 * @param amountTotal   결제 금액 (최소 화폐 단위)
 */
public record GatewaySessionStatus(
    String status,
    String paymentStatus,
    Long amountTotal,
    String currency
) {

    public static final String PAID = "paid";

    public boolean isPaid() {
        return PAID.equals(paymentStatus);
    }
}
