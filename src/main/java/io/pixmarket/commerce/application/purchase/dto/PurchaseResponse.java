package io.pixmarket.commerce.application.purchase.dto;

import io.pixmarket.commerce.domain.photo.Photo;
import io.pixmarket.commerce.domain.purchase.Purchase;

import java.time.LocalDateTime;

public record PurchaseResponse(
    String purchaseId,
    Long photoId,
    Long eventId,
    String filename,
    String sessionId,
    LocalDateTime purchasedAt
) {
    public static PurchaseResponse of(Purchase purchase, Photo photo) {
        return new PurchaseResponse(
            purchase.getPurchaseNumber(),
            photo.getId(),
            photo.getEventId(),
            photo.getFilename(),
            purchase.getSessionId(),
            purchase.getPurchasedAt()
        );
    }
}
