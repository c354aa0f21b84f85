package io.pixmarket.commerce.application.usecase.cart;

import io.pixmarket.commerce.application.cart.CartResponseAssembler;
import io.pixmarket.commerce.application.cart.dto.CartResponse;
import io.pixmarket.commerce.application.usecase.UseCase;
import io.pixmarket.commerce.domain.cart.Cart;
import io.pixmarket.commerce.domain.cart.CartRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@UseCase
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class GetCartUseCase {

    private final CartRepository cartRepository;
    private final CartResponseAssembler cartResponseAssembler;

    /**
     * 장바구니 조회 (캐시 적용)
     *
     * 캐시 키: "carts::{userId}"
     * - 담기/삭제, 구매 완료 시 @CacheEvict로 무효화
     * - 가격은 조회 시점의 카탈로그 가격 (체크아웃 스냅샷과 무관)
     */
    @Cacheable(value = "carts", key = "#userId", sync = true)
    public CartResponse execute(Long userId) {
        Cart cart = cartRepository.findByUserId(userId).orElse(null);
        if (cart == null || cart.isEmpty()) {
            log.debug("Empty cart for user: {}", userId);
        }
        return cartResponseAssembler.toResponse(userId, cart);
    }
}
