package io.pixmarket.commerce.application.usecase.cart;

import io.pixmarket.commerce.application.cart.CartResponseAssembler;
import io.pixmarket.commerce.application.cart.dto.CartResponse;
import io.pixmarket.commerce.domain.cart.Cart;
import io.pixmarket.commerce.domain.cart.CartRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RemoveFromCartUseCaseTest {

    @Mock
    private CartRepository cartRepository;

    @Mock
    private CartResponseAssembler cartResponseAssembler;

    @InjectMocks
    private RemoveFromCartUseCase removeFromCartUseCase;

    @Test
    @DisplayName("제거 후 응답은 방금 변경한 장바구니로 만든다")
    void execute_응답은_변경된장바구니() {
        // Given
        Cart cart = Cart.create(1L);
        cart.addPhoto(10L);
        cart.addPhoto(20L);
        when(cartRepository.findByUserId(1L)).thenReturn(Optional.of(cart));
        when(cartResponseAssembler.toResponse(eq(1L), any(Cart.class))).thenReturn(CartResponse.of(1L, List.of()));

        // When
        removeFromCartUseCase.execute(1L, 10L);

        // Then
        verify(cartRepository).save(cart);
        ArgumentCaptor<Cart> captor = ArgumentCaptor.forClass(Cart.class);
        verify(cartResponseAssembler).toResponse(eq(1L), captor.capture());
        assertThat(captor.getValue().getPhotoIds()).containsExactly(20L);
    }

    @Test
    @DisplayName("장바구니가 없으면 저장 없이 빈 응답")
    void execute_장바구니없음() {
        // Given
        when(cartRepository.findByUserId(1L)).thenReturn(Optional.empty());
        when(cartResponseAssembler.toResponse(eq(1L), isNull())).thenReturn(CartResponse.of(1L, List.of()));

        // When
        CartResponse response = removeFromCartUseCase.execute(1L, 10L);

        // Then
        assertThat(response.items()).isEmpty();
        verify(cartRepository, never()).save(any());
    }

    @Test
    @DisplayName("담기지 않은 사진 제거는 저장하지 않는다")
    void execute_없는사진() {
        // Given
        Cart cart = Cart.create(1L);
        cart.addPhoto(20L);
        when(cartRepository.findByUserId(1L)).thenReturn(Optional.of(cart));
        when(cartResponseAssembler.toResponse(1L, cart)).thenReturn(CartResponse.of(1L, List.of()));

        // When
        removeFromCartUseCase.execute(1L, 10L);

        // Then
        verify(cartRepository, never()).save(any());
        assertThat(cart.getPhotoIds()).containsExactly(20L);
    }
}
