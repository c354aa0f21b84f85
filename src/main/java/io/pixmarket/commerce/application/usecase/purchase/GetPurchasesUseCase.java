package io.pixmarket.commerce.application.usecase.purchase;

import io.pixmarket.commerce.application.purchase.dto.PurchaseResponse;
import io.pixmarket.commerce.application.usecase.UseCase;
import io.pixmarket.commerce.domain.photo.Photo;
import io.pixmarket.commerce.domain.photo.PhotoRepository;
import io.pixmarket.commerce.domain.purchase.Purchase;
import io.pixmarket.commerce.domain.purchase.PurchaseRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 구매 내역 조회 (최근 구매 순)
 * 카탈로그에서 사라진 사진의 구매 내역은 목록에서 제외한다.
 */
@UseCase
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class GetPurchasesUseCase {

    private final PurchaseRepository purchaseRepository;
    private final PhotoRepository photoRepository;

    public List<PurchaseResponse> execute(Long userId) {
        List<Purchase> purchases = purchaseRepository.findByUserIdOrderByPurchasedAtDesc(userId);
        if (purchases.isEmpty()) {
            return List.of();
        }

        Map<Long, Photo> photos = photoRepository.findAllById(
                purchases.stream().map(Purchase::getPhotoId).toList())
            .stream()
            .collect(Collectors.toMap(Photo::getId, Function.identity()));

        return purchases.stream()
            .filter(purchase -> photos.containsKey(purchase.getPhotoId()))
            .map(purchase -> PurchaseResponse.of(purchase, photos.get(purchase.getPhotoId())))
            .toList();
    }
}
