package io.pixmarket.commerce.infrastructure.persistence.payment;

import io.pixmarket.commerce.domain.payment.PaymentTransaction;
import io.pixmarket.commerce.domain.payment.PaymentTransactionRepository;
import io.pixmarket.commerce.domain.payment.PaymentTransactionStatus;
import org.springframework.data.domain.Limit;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface JpaPaymentTransactionRepository
    extends JpaRepository<PaymentTransaction, Long>, PaymentTransactionRepository {

    @Override
    Optional<PaymentTransaction> findBySessionId(String sessionId);

    @Override
    PaymentTransaction save(PaymentTransaction transaction);

    /**
     * 단일 UPDATE 문으로 상태를 검사하고 변경한다. (DB 행 잠금 범위 안에서 원자적)
     * 영속성 컨텍스트를 비워 이후 조회가 갱신된 상태를 읽도록 한다.
     */
    @Override
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE PaymentTransaction t
           SET t.status = io.pixmarket.commerce.domain.payment.PaymentTransactionStatus.COMPLETED,
               t.completedAt = :completedAt
         WHERE t.sessionId = :sessionId
           AND t.status = io.pixmarket.commerce.domain.payment.PaymentTransactionStatus.PENDING
        """)
    int markCompletedIfPending(@Param("sessionId") String sessionId,
                               @Param("completedAt") LocalDateTime completedAt);

    @Override
    List<PaymentTransaction> findByStatusAndCreatedAtBeforeOrderByCreatedAtAsc(
        PaymentTransactionStatus status, LocalDateTime createdAt, Limit limit);

    @Override
    long countByStatusAndCreatedAtBefore(PaymentTransactionStatus status, LocalDateTime createdAt);

    @Override
    long countByStatus(PaymentTransactionStatus status);

    @Override
    @Query("SELECT COALESCE(SUM(t.amount), 0) FROM PaymentTransaction t WHERE t.status = :status")
    long sumAmountByStatus(@Param("status") PaymentTransactionStatus status);
}
