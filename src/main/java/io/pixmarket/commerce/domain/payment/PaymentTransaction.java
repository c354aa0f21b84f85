package io.pixmarket.commerce.domain.payment;

import io.pixmarket.commerce.common.exception.BusinessException;
import io.pixmarket.commerce.common.exception.ErrorCode;
import io.pixmarket.commerce.domain.checkout.PriceSnapshot;
import io.pixmarket.commerce.domain.common.BaseEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * 결제 트랜잭션 원장 Entity
 * <p>
 * 체크아웃 세션마다 정확히 하나 생성된다.
 * 상태 변경은 엔티티 메서드가 아니라 {@link PaymentTransactionRepository#markCompletedIfPending}
 * 조건부 UPDATE로만 이루어진다. (영향받은 행 수로 완료 처리 주체가 결정됨)
 */
@Entity
@Table(
    name = "payment_transactions",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_payment_tx_session", columnNames = "session_id"),
        @UniqueConstraint(name = "uk_payment_tx_number", columnNames = "transaction_id")
    },
    indexes = {
        @Index(name = "idx_payment_tx_status_created", columnList = "status, created_at"),
        @Index(name = "idx_payment_tx_user", columnList = "user_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PaymentTransaction extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "transaction_id", nullable = false, updatable = false, length = 40)
    private String transactionId;  // Business ID (e.g., "txn_5f2c...")

    @Column(name = "session_id", nullable = false, updatable = false, length = 255)
    private String sessionId;

    @Column(name = "user_id", nullable = false, updatable = false)
    private Long userId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(
        name = "payment_transaction_photos",
        joinColumns = @JoinColumn(name = "payment_transaction_id"),
        foreignKey = @ForeignKey(name = "fk_payment_tx_photo")
    )
    @OrderColumn(name = "line_no")
    @Column(name = "photo_id", nullable = false)
    private List<Long> photoIds = new ArrayList<>();

    @Column(nullable = false, updatable = false)
    private Long amount;

    @Column(nullable = false, updatable = false, length = 3)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PaymentTransactionStatus status;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    public static PaymentTransaction create(String sessionId, Long userId, PriceSnapshot snapshot, String currency) {
        validateSessionId(sessionId);
        validateUserId(userId);
        validateSnapshot(snapshot);

        PaymentTransaction transaction = new PaymentTransaction();
        transaction.transactionId = "txn_" + UUID.randomUUID().toString().replace("-", "");
        transaction.sessionId = sessionId;
        transaction.userId = userId;
        transaction.photoIds = new ArrayList<>(snapshot.getPhotoIds());
        transaction.amount = snapshot.getTotal();
        transaction.currency = currency;
        transaction.status = PaymentTransactionStatus.PENDING;
        return transaction;
    }

    public boolean isCompleted() {
        return status == PaymentTransactionStatus.COMPLETED;
    }

    public boolean isOwnedBy(Long userId) {
        return this.userId.equals(userId);
    }

    // ====================================
    // Validation Methods
    // ====================================

    private static void validateSessionId(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "결제 세션 ID는 필수입니다");
        }
    }

    private static void validateUserId(Long userId) {
        if (userId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "사용자 ID는 필수입니다");
        }
    }

    private static void validateSnapshot(PriceSnapshot snapshot) {
        if (snapshot == null || !snapshot.isChargeable()) {
            throw new BusinessException(ErrorCode.EMPTY_CART);
        }
    }
}
