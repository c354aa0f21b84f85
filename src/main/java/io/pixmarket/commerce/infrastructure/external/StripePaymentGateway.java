package io.pixmarket.commerce.infrastructure.external;

import com.stripe.exception.SignatureVerificationException;
import com.stripe.exception.StripeException;
import com.stripe.model.checkout.Session;
import com.stripe.net.RequestOptions;
import com.stripe.net.Webhook;
import com.stripe.param.checkout.SessionCreateParams;
import io.pixmarket.commerce.common.exception.BusinessException;
import io.pixmarket.commerce.common.exception.ErrorCode;
import io.pixmarket.commerce.config.PaymentGatewayProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import java.util.stream.Collectors;

/**
 * Stripe Checkout 연동 구현 (prod)
 * <p>
 * - API 키는 요청 단위 RequestOptions로 전달 (전역 Stripe.apiKey 사용 안 함)
 * - 연결/읽기 타임아웃은 payment.gateway.* 설정값
 * - 콜백 서명은 Webhook.constructEvent로 검증
 */
@Slf4j
@Service
@Profile("prod")
@RequiredArgsConstructor
public class StripePaymentGateway implements PaymentGateway {

    private final PaymentGatewayProperties properties;
    private final CallbackPayloadParser payloadParser;

    @Override
    public GatewaySession createSession(CreateSessionCommand command) {
        SessionCreateParams params = SessionCreateParams.builder()
            .setMode(SessionCreateParams.Mode.PAYMENT)
            .setClientReferenceId(String.valueOf(command.userId()))
            .setSuccessUrl(command.successUrl())
            .setCancelUrl(command.cancelUrl())
            .putMetadata("user_id", String.valueOf(command.userId()))
            .putMetadata("photo_ids", command.photoIds().stream()
                .map(String::valueOf)
                .collect(Collectors.joining(",")))
            .addLineItem(
                SessionCreateParams.LineItem.builder()
                    .setQuantity(1L)
                    .setPriceData(
                        SessionCreateParams.LineItem.PriceData.builder()
                            .setCurrency(command.currency())
                            .setUnitAmount(command.amount())
                            .setProductData(
                                SessionCreateParams.LineItem.PriceData.ProductData.builder()
                                    .setName("Event photos (" + command.photoIds().size() + ")")
                                    .build())
                            .build())
                    .build())
            .build();

        try {
            Session session = Session.create(params, requestOptions());
            return new GatewaySession(session.getId(), session.getUrl());
        } catch (StripeException e) {
            log.error("Stripe session creation failed: userId={}, message={}", command.userId(), e.getMessage(), e);
            throw new BusinessException(ErrorCode.PAYMENT_GATEWAY_ERROR, e.getMessage(), e);
        }
    }

    @Override
    public GatewaySessionStatus getStatus(String sessionId) {
        try {
            Session session = Session.retrieve(sessionId, requestOptions());
            return new GatewaySessionStatus(
                session.getStatus(),
                session.getPaymentStatus(),
                session.getAmountTotal(),
                session.getCurrency()
            );
        } catch (StripeException e) {
            log.warn("Stripe status query failed: sessionId={}, message={}", sessionId, e.getMessage());
            throw new BusinessException(ErrorCode.PAYMENT_GATEWAY_ERROR, e.getMessage(), e);
        }
    }

    @Override
    public GatewayCallback verifyCallback(String rawBody, String signature) {
        if (rawBody == null || signature == null || signature.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_SIGNATURE, "서명 헤더 또는 본문이 없습니다");
        }
        try {
            Webhook.constructEvent(
                rawBody,
                signature,
                properties.getWebhookSecret(),
                properties.getSignatureTolerance().toSeconds()
            );
        } catch (SignatureVerificationException e) {
            throw new BusinessException(ErrorCode.INVALID_SIGNATURE, e.getMessage(), e);
        } catch (RuntimeException e) {
            // 서명은 맞지만 Event 역직렬화 실패 (JSON 형식 오류)
            throw new BusinessException(ErrorCode.INVALID_SIGNATURE, "콜백 본문을 해석할 수 없습니다", e);
        }
        return payloadParser.parse(rawBody);
    }

    private RequestOptions requestOptions() {
        return RequestOptions.builder()
            .setApiKey(properties.getApiKey())
            .setConnectTimeout((int) properties.getConnectTimeout().toMillis())
            .setReadTimeout((int) properties.getReadTimeout().toMillis())
            .build();
    }
}
