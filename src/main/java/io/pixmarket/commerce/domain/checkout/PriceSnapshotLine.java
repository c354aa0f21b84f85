package io.pixmarket.commerce.domain.checkout;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 가격 스냅샷의 한 줄 (사진 ID, 체크아웃 시점 단가)
 */
@Embeddable
@Getter
@EqualsAndHashCode
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PriceSnapshotLine {

    @Column(name = "photo_id", nullable = false)
    private Long photoId;

    @Column(name = "unit_price", nullable = false)
    private Long unitPrice;

    public PriceSnapshotLine(Long photoId, Long unitPrice) {
        this.photoId = photoId;
        this.unitPrice = unitPrice;
    }
}
