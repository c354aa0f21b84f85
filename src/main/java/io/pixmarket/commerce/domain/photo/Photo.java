package io.pixmarket.commerce.domain.photo;

import io.pixmarket.commerce.common.exception.BusinessException;
import io.pixmarket.commerce.common.exception.ErrorCode;
import io.pixmarket.commerce.domain.common.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Photo Entity (판매 카탈로그)
 *
 * 카탈로그 CRUD와 이미지 변환은 이 서비스의 범위가 아니다.
 * 결제 흐름은 사진의 존재 여부와 현재 가격만 조회한다.
 *
 * 가격 단위: 최소 화폐 단위 (EUR 센트)
 */
@Entity
@Table(
    name = "photos",
    indexes = {
        @Index(name = "idx_event_id", columnList = "event_id")
    }
)
@Getter
@NoArgsConstructor
public class Photo extends BaseTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "event_id", nullable = false)
    private Long eventId;  // 촬영 이벤트 ID (카탈로그 서비스 소유)

    @Column(nullable = false, length = 255)
    private String filename;

    @Column(nullable = false)
    private Long price;

    public static Photo create(Long eventId, String filename, Long price) {
        validateEventId(eventId);
        validateFilename(filename);
        validatePrice(price);

        Photo photo = new Photo();
        photo.eventId = eventId;
        photo.filename = filename;
        photo.price = price;
        return photo;
    }

    /**
     * 카탈로그 가격 변경
     * 이미 생성된 체크아웃 세션의 금액에는 영향이 없다 (PriceSnapshot)
     */
    public void changePrice(Long price) {
        validatePrice(price);
        this.price = price;
    }

    // ====================================
    // Validation Methods
    // ====================================

    private static void validateEventId(Long eventId) {
        if (eventId == null) {
            throw new BusinessException(
                ErrorCode.INVALID_INPUT,
                "이벤트 ID는 필수입니다"
            );
        }
    }

    private static void validateFilename(String filename) {
        if (filename == null || filename.trim().isEmpty()) {
            throw new BusinessException(
                ErrorCode.INVALID_INPUT,
                "파일명은 필수입니다"
            );
        }
    }

    private static void validatePrice(Long price) {
        if (price == null || price < 0) {
            throw new BusinessException(
                ErrorCode.INVALID_INPUT,
                "가격은 0 이상이어야 합니다"
            );
        }
    }
}
