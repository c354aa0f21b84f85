package io.pixmarket.commerce.domain.cart;

public interface CartItemRepository {

    /**
     * 사용자 장바구니의 모든 항목 삭제 (bulk delete)
     *
     * @return 삭제된 행 수
     */
    int deleteByUserId(Long userId);
}
