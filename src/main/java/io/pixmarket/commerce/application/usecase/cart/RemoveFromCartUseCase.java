package io.pixmarket.commerce.application.usecase.cart;

import io.pixmarket.commerce.application.cart.CartResponseAssembler;
import io.pixmarket.commerce.application.cart.dto.CartResponse;
import io.pixmarket.commerce.application.usecase.UseCase;
import io.pixmarket.commerce.domain.cart.Cart;
import io.pixmarket.commerce.domain.cart.CartRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@UseCase
@RequiredArgsConstructor
public class RemoveFromCartUseCase {

    private final CartRepository cartRepository;
    private final CartResponseAssembler cartResponseAssembler;

    /**
     * 장바구니에서 사진 제거 (없는 사진이나 없는 장바구니도 정상 처리)
     * <p>
     * 응답은 방금 변경한 엔티티로 만든다. 캐시 무효화는 커밋 후라 캐시 조회를 거치면 변경 전 목록이 나온다.
     */
    @Transactional
    @CacheEvict(value = "carts", key = "#userId")
    public CartResponse execute(Long userId, Long photoId) {
        Cart cart = cartRepository.findByUserId(userId).orElse(null);
        if (cart != null && cart.removePhoto(photoId)) {
            cartRepository.save(cart);
            log.info("Photo removed from cart: userId={}, photoId={}", userId, photoId);
        }

        return cartResponseAssembler.toResponse(userId, cart);
    }
}
