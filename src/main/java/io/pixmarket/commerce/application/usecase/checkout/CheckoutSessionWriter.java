package io.pixmarket.commerce.application.usecase.checkout;

import io.pixmarket.commerce.domain.checkout.CheckoutSession;
import io.pixmarket.commerce.domain.checkout.CheckoutSessionRepository;
import io.pixmarket.commerce.domain.checkout.PriceSnapshot;
import io.pixmarket.commerce.domain.payment.PaymentTransaction;
import io.pixmarket.commerce.domain.payment.PaymentTransactionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 체크아웃 세션 + PENDING 결제 트랜잭션 저장
 * <p>
 * 결제사 세션 생성이 성공한 뒤에만 호출된다.
 * 두 레코드는 한 트랜잭션으로 저장된다. (세션만 있고 원장이 없는 상태 없음)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CheckoutSessionWriter {

    private final CheckoutSessionRepository checkoutSessionRepository;
    private final PaymentTransactionRepository paymentTransactionRepository;

    @Transactional
    public CheckoutSession save(String sessionId, Long userId, PriceSnapshot snapshot, String currency) {
        CheckoutSession session = checkoutSessionRepository.save(
            CheckoutSession.create(sessionId, userId, snapshot, currency));

        PaymentTransaction transaction = paymentTransactionRepository.save(
            PaymentTransaction.create(sessionId, userId, snapshot, currency));

        log.info("Checkout session stored: sessionId={}, transactionId={}, userId={}, amount={} {}",
            sessionId, transaction.getTransactionId(), userId, snapshot.getTotal(), currency);
        return session;
    }
}
