package io.pixmarket.commerce.application.cart.dto;

import io.pixmarket.commerce.domain.photo.Photo;

/**
 * 장바구니 항목 (현재 카탈로그 가격 기준)
 */
public record CartItemResponse(
    Long photoId,
    Long eventId,
    String filename,
    Long price
) {
    public static CartItemResponse from(Photo photo) {
        return new CartItemResponse(
            photo.getId(),
            photo.getEventId(),
            photo.getFilename(),
            photo.getPrice()
        );
    }
}
