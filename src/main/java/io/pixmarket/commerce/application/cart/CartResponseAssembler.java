package io.pixmarket.commerce.application.cart;

import io.pixmarket.commerce.application.cart.dto.CartItemResponse;
import io.pixmarket.commerce.application.cart.dto.CartResponse;
import io.pixmarket.commerce.domain.cart.Cart;
import io.pixmarket.commerce.domain.photo.Photo;
import io.pixmarket.commerce.domain.photo.PhotoRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 장바구니 엔티티 → 응답 변환
 * <p>
 * 조회(캐시)와 담기/삭제(방금 변경한 엔티티)가 같은 변환을 쓴다.
 * 가격은 변환 시점의 카탈로그 가격이고, 카탈로그에서 사라진 사진은 목록에서 제외한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CartResponseAssembler {

    private final PhotoRepository photoRepository;

    public CartResponse toResponse(Long userId, Cart cart) {
        if (cart == null || cart.isEmpty()) {
            return CartResponse.of(userId, List.of());
        }

        List<Long> photoIds = cart.getPhotoIds();
        Map<Long, Photo> photos = photoRepository.findAllById(photoIds).stream()
            .collect(Collectors.toMap(Photo::getId, Function.identity()));

        List<CartItemResponse> items = photoIds.stream()
            .map(photos::get)
            .filter(Objects::nonNull)
            .map(CartItemResponse::from)
            .toList();

        if (items.size() < photoIds.size()) {
            log.warn("Cart contains photos missing from catalog: userId={}, missing={}",
                userId, photoIds.size() - items.size());
        }
        return CartResponse.of(userId, items);
    }
}
