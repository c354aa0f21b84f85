package io.pixmarket.commerce.application.usecase.cart;

import io.pixmarket.commerce.application.cart.CartResponseAssembler;
import io.pixmarket.commerce.application.cart.dto.AddCartItemRequest;
import io.pixmarket.commerce.application.cart.dto.CartResponse;
import io.pixmarket.commerce.application.usecase.UseCase;
import io.pixmarket.commerce.common.exception.BusinessException;
import io.pixmarket.commerce.common.exception.ErrorCode;
import io.pixmarket.commerce.domain.cart.Cart;
import io.pixmarket.commerce.domain.cart.CartRepository;
import io.pixmarket.commerce.domain.photo.PhotoRepository;
import io.pixmarket.commerce.domain.purchase.PurchaseRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@UseCase
@RequiredArgsConstructor
public class AddToCartUseCase {

    private final CartRepository cartRepository;
    private final PhotoRepository photoRepository;
    private final PurchaseRepository purchaseRepository;
    private final CartResponseAssembler cartResponseAssembler;

    /**
     * 장바구니에 사진 담기 (캐시 무효화)
     *
     * - 카탈로그에 없는 사진: PHOTO_NOT_FOUND
     * - 이미 구매한 사진: ALREADY_PURCHASED
     * - 이미 담긴 사진: 무시 (집합)
     *
     * 동시 담기 충돌:
     * - 첫 담기가 겹치면 uk_cart_user, 같은 사진이 겹치면 uk_cart_photo 위반
     * - 충돌한 트랜잭션은 롤백되고 @Retryable이 새 트랜잭션으로 다시 시도한다
     * - 재시도에서는 먼저 커밋된 장바구니/항목을 재조회하므로 이미 담긴 사진은 무시된다
     */
    @Retryable(
        retryFor = {DataIntegrityViolationException.class, TransientDataAccessException.class},
        maxAttempts = 3,
        backoff = @Backoff(delay = 20, multiplier = 2)
    )
    @Transactional
    @CacheEvict(value = "carts", key = "#request.userId()")
    public CartResponse execute(AddCartItemRequest request) {
        log.info("Adding photo to cart: userId={}, photoId={}", request.userId(), request.photoId());

        photoRepository.findByIdOrThrow(request.photoId());

        if (purchaseRepository.existsByUserIdAndPhotoId(request.userId(), request.photoId())) {
            throw new BusinessException(
                ErrorCode.ALREADY_PURCHASED,
                "이미 구매한 사진입니다. photoId: " + request.photoId()
            );
        }

        Cart cart = cartRepository.findByUserId(request.userId())
            .orElseGet(() -> Cart.create(request.userId()));

        if (cart.addPhoto(request.photoId())) {
            // 유니크 제약 충돌을 이 메서드 안에서 드러내기 위해 즉시 flush
            cart = cartRepository.saveAndFlush(cart);
        } else {
            log.debug("Photo already in cart: userId={}, photoId={}", request.userId(), request.photoId());
        }

        return cartResponseAssembler.toResponse(request.userId(), cart);
    }
}
