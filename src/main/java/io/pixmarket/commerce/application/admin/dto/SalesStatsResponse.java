package io.pixmarket.commerce.application.admin.dto;

/**
 * 판매 통계
 *
 * @param totalRevenue       완료된 결제 금액 합계 (최소 화폐 단위)
 * @param stalePendingCount  점검 기준보다 오래된 PENDING 트랜잭션 수
 */
public record SalesStatsResponse(
    long totalPhotos,
    long totalPurchases,
    long completedTransactions,
    long pendingTransactions,
    long totalRevenue,
    String currency,
    long stalePendingCount
) {
}
