package io.pixmarket.commerce.application.usecase.purchase;

import io.pixmarket.commerce.application.purchase.dto.AccessGrantResponse;
import io.pixmarket.commerce.application.usecase.UseCase;
import io.pixmarket.commerce.domain.purchase.PurchaseRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.transaction.annotation.Transactional;

/**
 * 사진 열람 권한 조회 (원본 다운로드 허용 여부)
 * <p>
 * 캐시하지 않는다. 완료 트랜잭션이 커밋된 직후부터 true.
 */
@UseCase
@RequiredArgsConstructor
public class CheckAccessGrantUseCase {

    private final PurchaseRepository purchaseRepository;

    @Transactional(readOnly = true)
    public AccessGrantResponse execute(Long userId, Long photoId) {
        return new AccessGrantResponse(
            userId,
            photoId,
            purchaseRepository.existsByUserIdAndPhotoId(userId, photoId)
        );
    }
}
