package io.pixmarket.commerce.domain.cart;

import io.pixmarket.commerce.common.exception.BusinessException;
import io.pixmarket.commerce.common.exception.ErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class CartTest {

    @Test
    @DisplayName("장바구니 생성 - 성공")
    void create_성공() {
        // When
        Cart cart = Cart.create(1L);

        // Then
        assertThat(cart.getUserId()).isEqualTo(1L);
        assertThat(cart.isEmpty()).isTrue();
        assertThat(cart.getId()).isNull(); // ID는 JPA에 의해 자동 생성됨
    }

    @Test
    @DisplayName("장바구니 생성 - userId가 null")
    void create_실패_userId_null() {
        assertThatThrownBy(() -> Cart.create(null))
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.INVALID_INPUT)
            .hasMessageContaining("사용자 ID는 필수입니다");
    }

    @Test
    @DisplayName("같은 사진을 두 번 담아도 한 번만 들어간다")
    void addPhoto_중복무시() {
        // Given
        Cart cart = Cart.create(1L);

        // When
        boolean first = cart.addPhoto(10L);
        boolean second = cart.addPhoto(10L);

        // Then
        assertThat(first).isTrue();
        assertThat(second).isFalse();
        assertThat(cart.getPhotoIds()).containsExactly(10L);
        assertThat(cart.getCartItems().get(0).getCart()).isSameAs(cart); // 양방향 관계 확인
    }

    @Test
    @DisplayName("담은 순서대로 사진 ID를 반환한다")
    void getPhotoIds_순서유지() {
        Cart cart = Cart.create(1L);
        cart.addPhoto(30L);
        cart.addPhoto(10L);
        cart.addPhoto(20L);

        assertThat(cart.getPhotoIds()).containsExactly(30L, 10L, 20L);
    }

    @Test
    @DisplayName("사진 제거 - 없는 사진 제거는 무시")
    void removePhoto() {
        // Given
        Cart cart = Cart.create(1L);
        cart.addPhoto(10L);

        // When & Then
        assertThat(cart.removePhoto(99L)).isFalse();
        assertThat(cart.removePhoto(10L)).isTrue();
        assertThat(cart.isEmpty()).isTrue();
        assertThat(cart.contains(10L)).isFalse();
    }
}
