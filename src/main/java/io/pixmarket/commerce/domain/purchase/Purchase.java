package io.pixmarket.commerce.domain.purchase;

import io.pixmarket.commerce.common.exception.BusinessException;
import io.pixmarket.commerce.common.exception.ErrorCode;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * 구매(열람 권한) Entity
 * <p>
 * (user_id, photo_id) 유니크 제약으로 사진당 한 번만 부여된다.
 */
@Entity
@Table(
    name = "purchases",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_purchase_user_photo", columnNames = {"user_id", "photo_id"}),
        @UniqueConstraint(name = "uk_purchase_number", columnNames = "purchase_number")
    },
    indexes = {
        @Index(name = "idx_purchase_session", columnList = "session_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Purchase {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "purchase_number", nullable = false, updatable = false, length = 40)
    private String purchaseNumber;

    @Column(name = "user_id", nullable = false, updatable = false)
    private Long userId;

    @Column(name = "photo_id", nullable = false, updatable = false)
    private Long photoId;

    @Column(name = "session_id", nullable = false, updatable = false, length = 255)
    private String sessionId;  // 구매를 발생시킨 결제 세션

    @Column(name = "purchased_at", nullable = false, updatable = false)
    private LocalDateTime purchasedAt;

    public static Purchase create(Long userId, Long photoId, String sessionId, LocalDateTime purchasedAt) {
        if (userId == null || photoId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "사용자 ID와 사진 ID는 필수입니다");
        }
        if (sessionId == null || sessionId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "결제 세션 ID는 필수입니다");
        }

        Purchase purchase = new Purchase();
        purchase.purchaseNumber = "purch_" + UUID.randomUUID().toString().replace("-", "");
        purchase.userId = userId;
        purchase.photoId = photoId;
        purchase.sessionId = sessionId;
        purchase.purchasedAt = purchasedAt;
        return purchase;
    }
}
