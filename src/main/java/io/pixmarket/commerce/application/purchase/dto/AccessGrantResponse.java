package io.pixmarket.commerce.application.purchase.dto;

/**
 * 사진 열람 권한 여부
 */
public record AccessGrantResponse(Long userId, Long photoId, boolean purchased) {
}
