package io.pixmarket.commerce.infrastructure.external;

import com.stripe.exception.SignatureVerificationException;
import com.stripe.net.Webhook;
import io.pixmarket.commerce.common.exception.BusinessException;
import io.pixmarket.commerce.common.exception.ErrorCode;
import io.pixmarket.commerce.config.PaymentGatewayProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Mock 결제사 구현
 * <p>
 * 실제 결제사 없이 Checkout 세션 흐름을 시뮬레이션한다.
 * - 세션은 메모리에 보관 (status=open, payment_status=unpaid 로 시작)
 * - markPaid(): 사용자가 결제 페이지에서 결제를 마친 상황
 * - simulateOutage: 결제사 장애 (생성/조회 모두 실패)
 * <p>
 * 콜백 서명은 Stripe와 같은 "t=timestamp,v1=HMAC-SHA256" 형식으로 검증한다.
 */
@Slf4j
@Service
@Profile("!prod")
@RequiredArgsConstructor
public class MockPaymentGateway implements PaymentGateway {

    private static final String REDIRECT_BASE_URL = "https://checkout.mock.pixmarket.io/pay/";

    private final PaymentGatewayProperties properties;
    private final CallbackPayloadParser payloadParser;

    private final Map<String, MockSession> sessions = new ConcurrentHashMap<>();

    private volatile boolean simulateOutage = false;

    @Override
    public GatewaySession createSession(CreateSessionCommand command) {
        checkAvailable();

        String sessionId = "cs_test_" + UUID.randomUUID().toString().replace("-", "");
        sessions.put(sessionId, new MockSession(command.amount(), command.currency()));

        log.info("Mock gateway: session created - sessionId={}, userId={}, amount={} {}",
            sessionId, command.userId(), command.amount(), command.currency());
        return new GatewaySession(sessionId, REDIRECT_BASE_URL + sessionId);
    }

    @Override
    public GatewaySessionStatus getStatus(String sessionId) {
        checkAvailable();

        MockSession session = sessions.get(sessionId);
        if (session == null) {
            throw new BusinessException(ErrorCode.PAYMENT_GATEWAY_ERROR,
                "결제사에 존재하지 않는 세션입니다. sessionId: " + sessionId);
        }
        return session.toStatus();
    }

    @Override
    public GatewayCallback verifyCallback(String rawBody, String signature) {
        if (rawBody == null || signature == null || signature.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_SIGNATURE, "서명 헤더 또는 본문이 없습니다");
        }
        try {
            Webhook.Signature.verifyHeader(
                rawBody,
                signature,
                properties.getWebhookSecret(),
                properties.getSignatureTolerance().toSeconds()
            );
        } catch (SignatureVerificationException e) {
            throw new BusinessException(ErrorCode.INVALID_SIGNATURE, e.getMessage(), e);
        }
        return payloadParser.parse(rawBody);
    }

    /**
     * 결제 완료 시뮬레이션 (사용자가 결제 페이지에서 결제)
     */
    public void markPaid(String sessionId) {
        MockSession session = sessions.get(sessionId);
        if (session == null) {
            throw new IllegalArgumentException("Unknown mock session: " + sessionId);
        }
        session.paid = true;
        log.info("Mock gateway: session paid - sessionId={}", sessionId);
    }

    public void setSimulateOutage(boolean simulateOutage) {
        this.simulateOutage = simulateOutage;
        log.warn("Mock gateway outage simulation: {}", simulateOutage);
    }

    private void checkAvailable() {
        if (simulateOutage) {
            throw new BusinessException(ErrorCode.PAYMENT_GATEWAY_ERROR, "결제사 응답 없음 (Mock 장애)");
        }
    }

    private static final class MockSession {
        private final Long amount;
        private final String currency;
        private volatile boolean paid;

        private MockSession(Long amount, String currency) {
            this.amount = amount;
            this.currency = currency;
        }

        private GatewaySessionStatus toStatus() {
            return paid
                ? new GatewaySessionStatus("complete", "paid", amount, currency)
                : new GatewaySessionStatus("open", "unpaid", amount, currency);
        }
    }
}
