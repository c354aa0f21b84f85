package io.pixmarket.commerce.application.checkout.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * 체크아웃 시작 요청
 *
 * @param originUrl 결제 후 돌아올 프론트엔드 origin (예: https://shop.example.com)
 */
public record StartCheckoutRequest(
    @NotNull(message = "사용자 ID는 필수입니다")
    Long userId,

    @NotBlank(message = "origin URL은 필수입니다")
    String originUrl
) {}
