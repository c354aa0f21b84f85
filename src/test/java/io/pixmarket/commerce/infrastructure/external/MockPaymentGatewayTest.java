package io.pixmarket.commerce.infrastructure.external;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.stripe.net.Webhook;
import io.pixmarket.commerce.common.exception.BusinessException;
import io.pixmarket.commerce.common.exception.ErrorCode;
import io.pixmarket.commerce.config.PaymentGatewayProperties;
import io.pixmarket.commerce.support.WebhookTestSigner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class MockPaymentGatewayTest {

    private MockPaymentGateway gateway;

    @BeforeEach
    void setUp() {
        PaymentGatewayProperties properties = new PaymentGatewayProperties();
        properties.setWebhookSecret(WebhookTestSigner.TEST_SECRET);
        gateway = new MockPaymentGateway(properties, new CallbackPayloadParser(new ObjectMapper()));
    }

    @Nested
    @DisplayName("세션 생성/조회")
    class Session {

        @Test
        @DisplayName("생성 직후에는 open/unpaid, markPaid 이후 complete/paid")
        void createAndPay() {
            GatewaySession session = gateway.createSession(command());

            assertThat(session.sessionId()).startsWith("cs_test_");
            assertThat(session.redirectUrl()).endsWith(session.sessionId());

            GatewaySessionStatus before = gateway.getStatus(session.sessionId());
            assertThat(before.status()).isEqualTo("open");
            assertThat(before.isPaid()).isFalse();
            assertThat(before.amountTotal()).isEqualTo(1500L);

            gateway.markPaid(session.sessionId());

            GatewaySessionStatus after = gateway.getStatus(session.sessionId());
            assertThat(after.status()).isEqualTo("complete");
            assertThat(after.isPaid()).isTrue();
        }

        @Test
        @DisplayName("모르는 세션 조회는 PAYMENT_GATEWAY_ERROR")
        void unknownSession() {
            assertThatThrownBy(() -> gateway.getStatus("cs_test_missing"))
                .isInstanceOf(BusinessException.class)
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.PAYMENT_GATEWAY_ERROR);
        }

        @Test
        @DisplayName("장애 시뮬레이션 중에는 생성과 조회 모두 실패")
        void outage() {
            GatewaySession session = gateway.createSession(command());
            gateway.setSimulateOutage(true);

            assertThatThrownBy(() -> gateway.createSession(command()))
                .isInstanceOf(BusinessException.class)
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.PAYMENT_GATEWAY_ERROR);
            assertThatThrownBy(() -> gateway.getStatus(session.sessionId()))
                .isInstanceOf(BusinessException.class)
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.PAYMENT_GATEWAY_ERROR);
        }
    }

    @Nested
    @DisplayName("콜백 서명 검증")
    class Callback {

        @Test
        @DisplayName("올바른 서명이면 이벤트 타입과 세션을 해석한다")
        void validSignature() {
            String body = WebhookTestSigner.checkoutCompleted("cs_test_1", "paid");

            GatewayCallback callback = gateway.verifyCallback(body, WebhookTestSigner.sign(body));

            assertThat(callback.eventType()).isEqualTo("checkout.session.completed");
            assertThat(callback.sessionId()).isEqualTo("cs_test_1");
            assertThat(callback.isPaidCheckoutSession()).isTrue();
        }

        @Test
        @DisplayName("서명 이후 본문이 바뀌면 INVALID_SIGNATURE")
        void tamperedBody() {
            String body = WebhookTestSigner.checkoutCompleted("cs_test_1", "unpaid");
            String signature = WebhookTestSigner.sign(body);
            String tampered = body.replace("unpaid", "paid");

            assertInvalidSignature(() -> gateway.verifyCallback(tampered, signature));
        }

        @Test
        @DisplayName("다른 키로 서명하면 INVALID_SIGNATURE")
        void wrongSecret() {
            String body = WebhookTestSigner.checkoutCompleted("cs_test_1", "paid");
            String signature = WebhookTestSigner.sign(body, "whsec_other", Webhook.Util.getTimeNow());

            assertInvalidSignature(() -> gateway.verifyCallback(body, signature));
        }

        @Test
        @DisplayName("서명 헤더가 없거나 비어 있으면 INVALID_SIGNATURE")
        void missingHeader() {
            String body = WebhookTestSigner.checkoutCompleted("cs_test_1", "paid");

            assertInvalidSignature(() -> gateway.verifyCallback(body, null));
            assertInvalidSignature(() -> gateway.verifyCallback(body, " "));
        }

        @Test
        @DisplayName("허용 오차를 벗어난 타임스탬프는 INVALID_SIGNATURE")
        void expiredTimestamp() {
            String body = WebhookTestSigner.checkoutCompleted("cs_test_1", "paid");
            long tenMinutesAgo = Webhook.Util.getTimeNow() - 600;
            String signature = WebhookTestSigner.sign(body, WebhookTestSigner.TEST_SECRET, tenMinutesAgo);

            assertInvalidSignature(() -> gateway.verifyCallback(body, signature));
        }

        @Test
        @DisplayName("서명은 맞지만 JSON이 아니면 INVALID_SIGNATURE")
        void malformedJson() {
            String body = "not-json{";

            assertInvalidSignature(() -> gateway.verifyCallback(body, WebhookTestSigner.sign(body)));
        }

        @Test
        @DisplayName("결제 완료가 아닌 이벤트도 서명이 맞으면 그대로 해석한다")
        void otherEventType() {
            String body = WebhookTestSigner.event("checkout.session.expired", "cs_test_1");

            GatewayCallback callback = gateway.verifyCallback(body, WebhookTestSigner.sign(body));

            assertThat(callback.eventType()).isEqualTo("checkout.session.expired");
            assertThat(callback.paymentStatus()).isNull();
            assertThat(callback.isPaidCheckoutSession()).isFalse();
        }

        private void assertInvalidSignature(org.assertj.core.api.ThrowableAssert.ThrowingCallable call) {
            assertThatThrownBy(call)
                .isInstanceOf(BusinessException.class)
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.INVALID_SIGNATURE);
        }
    }

    private CreateSessionCommand command() {
        return new CreateSessionCommand(1L, 1500L, "eur", List.of(1L, 2L),
            "https://shop.test/checkout/success", "https://shop.test/cart");
    }
}
