package io.pixmarket.commerce.domain.checkout;

import io.pixmarket.commerce.common.exception.BusinessException;
import io.pixmarket.commerce.common.exception.ErrorCode;

import java.util.List;

/**
 * 가격 스냅샷 (불변 값 객체)
 * <p>
 * 체크아웃 세션 생성 시점의 카탈로그 가격으로 고정된 (사진, 단가) 목록과 합계.
 * 이후 카탈로그 가격이 바뀌어도 다시 계산하지 않는다.
 */
public final class PriceSnapshot {

    private final List<PriceSnapshotLine> lines;
    private final long total;

    private PriceSnapshot(List<PriceSnapshotLine> lines) {
        this.lines = List.copyOf(lines);
        this.total = lines.stream()
            .mapToLong(PriceSnapshotLine::getUnitPrice)
            .sum();
    }

    public static PriceSnapshot of(List<PriceSnapshotLine> lines) {
        if (lines == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "스냅샷 항목은 필수입니다");
        }
        return new PriceSnapshot(lines);
    }

    /**
     * 결제 가능 여부: 항목이 하나 이상이고 합계가 0보다 커야 한다
     */
    public boolean isChargeable() {
        return !lines.isEmpty() && total > 0;
    }

    public List<Long> getPhotoIds() {
        return lines.stream()
            .map(PriceSnapshotLine::getPhotoId)
            .toList();
    }

    public List<PriceSnapshotLine> getLines() {
        return lines;
    }

    public long getTotal() {
        return total;
    }
}
