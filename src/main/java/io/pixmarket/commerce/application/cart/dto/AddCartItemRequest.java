package io.pixmarket.commerce.application.cart.dto;

import jakarta.validation.constraints.NotNull;

public record AddCartItemRequest(
    @NotNull(message = "사용자 ID는 필수입니다")
    Long userId,

    @NotNull(message = "사진 ID는 필수입니다")
    Long photoId
) {}
