package io.pixmarket.commerce.domain.cart;

import io.pixmarket.commerce.common.exception.BusinessException;
import io.pixmarket.commerce.common.exception.ErrorCode;
import io.pixmarket.commerce.domain.common.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Cart Entity (장바구니 집합 루트)
 *
 * 라이프사이클:
 * 1. 체크아웃 전: 사용자가 사진을 담고 뺀다 (집합 의미, 같은 사진은 한 번만)
 * 2. 체크아웃 시: 읽기 전용 스냅샷(PriceSnapshot)만 생성, 장바구니는 변경하지 않음
 * 3. 결제 정산 완료 시: 장바구니 자체를 삭제 (비우기가 아님)
 *
 * 사용자당 하나 (uk_cart_user)
 */
@Entity
@Table(
    name = "carts",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_cart_user", columnNames = "user_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Cart extends BaseTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    /**
     * 양방향 관계: Cart 1 : N CartItem
     * - cascade ALL + orphanRemoval: CartItem 라이프사이클을 Cart가 관리
     */
    @OneToMany(mappedBy = "cart", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.LAZY)
    @OrderBy("id ASC")
    private List<CartItem> cartItems = new ArrayList<>();

    public static Cart create(Long userId) {
        validateUserId(userId);

        Cart cart = new Cart();
        cart.userId = userId;
        return cart;
    }

    /**
     * 사진 추가 (이미 담긴 사진이면 무시)
     *
     * @return 새로 추가되었으면 true
     */
    public boolean addPhoto(Long photoId) {
        if (contains(photoId)) {
            return false;
        }
        CartItem cartItem = CartItem.create(this, photoId);
        this.cartItems.add(cartItem);
        return true;
    }

    /**
     * 사진 제거 (없으면 무시)
     */
    public boolean removePhoto(Long photoId) {
        return this.cartItems.removeIf(item -> item.getPhotoId().equals(photoId));
    }

    public boolean contains(Long photoId) {
        return this.cartItems.stream()
            .anyMatch(item -> item.getPhotoId().equals(photoId));
    }

    /**
     * 담긴 순서대로 사진 ID 목록
     */
    public List<Long> getPhotoIds() {
        return this.cartItems.stream()
            .map(CartItem::getPhotoId)
            .toList();
    }

    public boolean isEmpty() {
        return this.cartItems.isEmpty();
    }

    private static void validateUserId(Long userId) {
        if (userId == null) {
            throw new BusinessException(
                ErrorCode.INVALID_INPUT,
                "사용자 ID는 필수입니다"
            );
        }
    }
}
