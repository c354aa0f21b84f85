package io.pixmarket.commerce.infrastructure.event;

import io.pixmarket.commerce.application.usecase.payment.PurchaseEventPublisher;
import io.pixmarket.commerce.domain.payment.PurchaseCompletedEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Spring ApplicationEventPublisher 기반 구현체
 */
@Component
@RequiredArgsConstructor
public class SpringPurchaseEventPublisher implements PurchaseEventPublisher {

    private final ApplicationEventPublisher delegate;

    @Override
    public void publish(PurchaseCompletedEvent event) {
        delegate.publishEvent(event);
    }
}
