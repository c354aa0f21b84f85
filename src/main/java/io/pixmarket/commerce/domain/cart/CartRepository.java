package io.pixmarket.commerce.domain.cart;

import java.util.Optional;

public interface CartRepository {

    Optional<Cart> findByUserId(Long userId);

    Cart save(Cart cart);

    /**
     * 저장 후 즉시 flush (유니크 제약 위반을 호출 지점에서 DataIntegrityViolationException으로 받는다)
     */
    Cart saveAndFlush(Cart cart);

    /**
     * 사용자 장바구니 삭제 (bulk delete)
     * CartItem은 CartItemRepository.deleteByUserId로 먼저 지워야 한다.
     *
     * @return 삭제된 행 수 (장바구니가 없으면 0, 예외 아님)
     */
    int deleteByUserId(Long userId);
}
