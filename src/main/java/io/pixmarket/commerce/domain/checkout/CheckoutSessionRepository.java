package io.pixmarket.commerce.domain.checkout;

import java.util.Optional;

public interface CheckoutSessionRepository {

    Optional<CheckoutSession> findBySessionId(String sessionId);

    CheckoutSession save(CheckoutSession checkoutSession);

    long count();
}
