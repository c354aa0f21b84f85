package io.pixmarket.commerce.domain.checkout;

import io.pixmarket.commerce.common.exception.BusinessException;
import io.pixmarket.commerce.common.exception.ErrorCode;
import io.pixmarket.commerce.domain.common.BaseEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 체크아웃 세션 (불변)
 * <p>
 * 사용자, 가격 스냅샷, 결제사 세션 ID를 묶는 레코드.
 * 체크아웃 시도마다 한 번 생성되며 PaymentTransaction과 1:1로 대응한다.
 */
@Entity
@Table(
    name = "checkout_sessions",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_checkout_session_id", columnNames = "session_id")
    },
    indexes = {
        @Index(name = "idx_checkout_user", columnList = "user_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CheckoutSession extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "session_id", nullable = false, updatable = false, length = 255)
    private String sessionId;  // 결제사 발급 세션 ID

    @Column(name = "user_id", nullable = false, updatable = false)
    private Long userId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(
        name = "checkout_session_lines",
        joinColumns = @JoinColumn(name = "checkout_session_id"),
        foreignKey = @ForeignKey(name = "fk_snapshot_line_session")
    )
    @OrderColumn(name = "line_no")
    private List<PriceSnapshotLine> snapshotLines = new ArrayList<>();

    @Column(name = "total_amount", nullable = false, updatable = false)
    private Long totalAmount;

    @Column(nullable = false, updatable = false, length = 3)
    private String currency;

    public static CheckoutSession create(String sessionId, Long userId, PriceSnapshot snapshot, String currency) {
        validateSessionId(sessionId);
        validateUserId(userId);
        validateSnapshot(snapshot);

        CheckoutSession session = new CheckoutSession();
        session.sessionId = sessionId;
        session.userId = userId;
        session.snapshotLines = new ArrayList<>(snapshot.getLines());
        session.totalAmount = snapshot.getTotal();
        session.currency = currency;
        return session;
    }

    public PriceSnapshot getPriceSnapshot() {
        return PriceSnapshot.of(snapshotLines);
    }

    // ====================================
    // Validation Methods
    // ====================================

    static void validateSessionId(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new BusinessException(
                ErrorCode.INVALID_INPUT,
                "결제 세션 ID는 필수입니다"
            );
        }
    }

    static void validateUserId(Long userId) {
        if (userId == null) {
            throw new BusinessException(
                ErrorCode.INVALID_INPUT,
                "사용자 ID는 필수입니다"
            );
        }
    }

    static void validateSnapshot(PriceSnapshot snapshot) {
        if (snapshot == null || !snapshot.isChargeable()) {
            throw new BusinessException(ErrorCode.EMPTY_CART);
        }
    }
}
