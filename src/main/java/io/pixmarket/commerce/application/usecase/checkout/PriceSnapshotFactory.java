package io.pixmarket.commerce.application.usecase.checkout;

import io.pixmarket.commerce.domain.cart.Cart;
import io.pixmarket.commerce.domain.cart.CartRepository;
import io.pixmarket.commerce.domain.checkout.PriceSnapshot;
import io.pixmarket.commerce.domain.checkout.PriceSnapshotLine;
import io.pixmarket.commerce.domain.photo.Photo;
import io.pixmarket.commerce.domain.photo.PhotoRepository;
import io.pixmarket.commerce.domain.purchase.PurchaseRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 장바구니 + 현재 카탈로그 가격으로 가격 스냅샷 생성
 * <p>
 * 제외 대상 (로그만 남기고 건너뜀):
 * - 카탈로그에서 사라진 사진
 * - 이미 구매한 사진
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PriceSnapshotFactory {

    private final CartRepository cartRepository;
    private final PhotoRepository photoRepository;
    private final PurchaseRepository purchaseRepository;

    @Transactional(readOnly = true)
    public PriceSnapshot create(Long userId) {
        List<Long> photoIds = cartRepository.findByUserId(userId)
            .map(Cart::getPhotoIds)
            .orElse(List.of());

        if (photoIds.isEmpty()) {
            return PriceSnapshot.of(List.of());
        }

        Map<Long, Photo> photos = photoRepository.findAllById(photoIds).stream()
            .collect(Collectors.toMap(Photo::getId, Function.identity()));
        Set<Long> owned = new HashSet<>(purchaseRepository.findPurchasedPhotoIds(userId, photoIds));

        List<PriceSnapshotLine> lines = new ArrayList<>();
        for (Long photoId : photoIds) {
            Photo photo = photos.get(photoId);
            if (photo == null) {
                log.warn("Photo missing from catalog, skipped in snapshot: userId={}, photoId={}", userId, photoId);
                continue;
            }
            if (owned.contains(photoId)) {
                log.info("Photo already purchased, skipped in snapshot: userId={}, photoId={}", userId, photoId);
                continue;
            }
            lines.add(new PriceSnapshotLine(photoId, photo.getPrice()));
        }
        return PriceSnapshot.of(lines);
    }
}
