package io.pixmarket.commerce.domain.cart;

import io.pixmarket.commerce.common.exception.BusinessException;
import io.pixmarket.commerce.common.exception.ErrorCode;
import io.pixmarket.commerce.domain.common.BaseEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * CartItem Entity
 *
 * photoId는 간접 참조: 카탈로그에서 사라진 사진도 장바구니에는 남아 있을 수 있고,
 * 체크아웃 시 가격 스냅샷 생성 단계에서 제외된다.
 */
@Entity
@Table(
    name = "cart_items",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_cart_photo", columnNames = {"cart_id", "photo_id"})
    },
    indexes = {
        @Index(name = "idx_cart_id", columnList = "cart_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CartItem extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "cart_id", nullable = false, foreignKey = @ForeignKey(name = "fk_cart_item_cart"))
    private Cart cart;

    @Column(name = "photo_id", nullable = false)
    private Long photoId;

    static CartItem create(Cart cart, Long photoId) {
        validatePhotoId(photoId);

        CartItem cartItem = new CartItem();
        cartItem.cart = cart;
        cartItem.photoId = photoId;
        return cartItem;
    }

    private static void validatePhotoId(Long photoId) {
        if (photoId == null) {
            throw new BusinessException(
                ErrorCode.INVALID_INPUT,
                "사진 ID는 필수입니다"
            );
        }
    }
}
