package io.pixmarket.commerce.presentation.api.cart;

import io.pixmarket.commerce.application.cart.dto.AddCartItemRequest;
import io.pixmarket.commerce.application.cart.dto.CartResponse;
import io.pixmarket.commerce.application.usecase.cart.AddToCartUseCase;
import io.pixmarket.commerce.application.usecase.cart.GetCartUseCase;
import io.pixmarket.commerce.application.usecase.cart.RemoveFromCartUseCase;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

@Validated
@RestController
@RequestMapping("/api/cart")
@RequiredArgsConstructor
public class CartController {

    private final AddToCartUseCase addToCartUseCase;
    private final GetCartUseCase getCartUseCase;
    private final RemoveFromCartUseCase removeFromCartUseCase;

    @PostMapping("/items")
    public ResponseEntity<CartResponse> addItem(
        @Valid @RequestBody AddCartItemRequest request
    ) {
        CartResponse response = addToCartUseCase.execute(request);
        return ResponseEntity
            .status(HttpStatus.CREATED)
            .body(response);
    }

    @GetMapping
    public ResponseEntity<CartResponse> getCart(
        @RequestParam Long userId
    ) {
        return ResponseEntity.ok(getCartUseCase.execute(userId));
    }

    @DeleteMapping("/items/{photoId}")
    public ResponseEntity<CartResponse> removeItem(
        @PathVariable Long photoId,
        @RequestParam Long userId
    ) {
        return ResponseEntity.ok(removeFromCartUseCase.execute(userId, photoId));
    }
}
