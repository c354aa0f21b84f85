package io.pixmarket.commerce.domain.payment;

import io.pixmarket.commerce.common.exception.BusinessException;
import io.pixmarket.commerce.common.exception.ErrorCode;
import org.springframework.data.domain.Limit;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

public interface PaymentTransactionRepository {

    Optional<PaymentTransaction> findBySessionId(String sessionId);

    PaymentTransaction save(PaymentTransaction transaction);

    /**
     * 조건부 완료 처리 (compare-and-set)
     * <p>
     * status = PENDING 인 경우에만 COMPLETED로 변경한다.
     *
     * @return 변경된 행 수 (1이면 이번 호출이 완료 처리 주체, 0이면 이미 완료됨)
     */
    int markCompletedIfPending(String sessionId, LocalDateTime completedAt);

    List<PaymentTransaction> findByStatusAndCreatedAtBeforeOrderByCreatedAtAsc(
        PaymentTransactionStatus status, LocalDateTime createdAt, Limit limit);

    long countByStatusAndCreatedAtBefore(PaymentTransactionStatus status, LocalDateTime createdAt);

    long countByStatus(PaymentTransactionStatus status);

    long sumAmountByStatus(PaymentTransactionStatus status);

    default PaymentTransaction findBySessionIdOrThrow(String sessionId) {
        return findBySessionId(sessionId)
            .orElseThrow(() -> new BusinessException(ErrorCode.UNKNOWN_SESSION,
                "결제 세션을 찾을 수 없습니다. sessionId: " + sessionId));
    }
}
