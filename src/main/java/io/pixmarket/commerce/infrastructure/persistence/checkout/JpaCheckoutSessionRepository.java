package io.pixmarket.commerce.infrastructure.persistence.checkout;

import io.pixmarket.commerce.domain.checkout.CheckoutSession;
import io.pixmarket.commerce.domain.checkout.CheckoutSessionRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface JpaCheckoutSessionRepository
    extends JpaRepository<CheckoutSession, Long>, CheckoutSessionRepository {

    @Override
    Optional<CheckoutSession> findBySessionId(String sessionId);

    @Override
    CheckoutSession save(CheckoutSession checkoutSession);

    @Override
    long count();
}
