package io.pixmarket.commerce.application.usecase.checkout;

import io.pixmarket.commerce.application.checkout.dto.StartCheckoutRequest;
import io.pixmarket.commerce.application.checkout.dto.StartCheckoutResponse;
import io.pixmarket.commerce.application.usecase.UseCase;
import io.pixmarket.commerce.common.exception.BusinessException;
import io.pixmarket.commerce.common.exception.ErrorCode;
import io.pixmarket.commerce.config.PaymentGatewayProperties;
import io.pixmarket.commerce.domain.checkout.CheckoutSession;
import io.pixmarket.commerce.domain.checkout.PriceSnapshot;
import io.pixmarket.commerce.infrastructure.external.CreateSessionCommand;
import io.pixmarket.commerce.infrastructure.external.GatewaySession;
import io.pixmarket.commerce.infrastructure.external.PaymentGateway;
import io.pixmarket.commerce.infrastructure.metrics.MetricsCollector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 체크아웃 시작 UseCase
 * <p>
 * 트랜잭션 분리:
 * 1. 가격 스냅샷 생성 (읽기 전용 트랜잭션)
 * 2. 결제사 세션 생성 (트랜잭션 밖, 외부 API)
 * 3. 체크아웃 세션 + PENDING 결제 트랜잭션 저장 (쓰기 트랜잭션)
 * <p>
 * 결제사 호출이 실패하면 아무것도 저장하지 않는다.
 * 장바구니는 변경하지 않는다. (결제 완료 시점에 삭제)
 */
@Slf4j
@UseCase
@RequiredArgsConstructor
public class StartCheckoutUseCase {

    static final String SUCCESS_PATH = "/checkout/success?session_id={CHECKOUT_SESSION_ID}";
    static final String CANCEL_PATH = "/cart";

    private final PriceSnapshotFactory priceSnapshotFactory;
    private final CheckoutSessionWriter checkoutSessionWriter;
    private final PaymentGateway paymentGateway;
    private final PaymentGatewayProperties gatewayProperties;
    private final MetricsCollector metricsCollector;

    public StartCheckoutResponse execute(StartCheckoutRequest request) {
        long startTime = System.currentTimeMillis();
        Long userId = request.userId();

        try {
            PriceSnapshot snapshot = priceSnapshotFactory.create(userId);
            if (!snapshot.isChargeable()) {
                throw new BusinessException(ErrorCode.EMPTY_CART,
                    "결제할 사진이 없습니다. userId: " + userId);
            }

            String origin = trimTrailingSlash(request.originUrl());
            String currency = gatewayProperties.getCurrency();
            GatewaySession gatewaySession = requestGatewaySession(new CreateSessionCommand(
                userId,
                snapshot.getTotal(),
                currency,
                snapshot.getPhotoIds(),
                origin + SUCCESS_PATH,
                origin + CANCEL_PATH
            ));

            CheckoutSession session = checkoutSessionWriter.save(
                gatewaySession.sessionId(), userId, snapshot, currency);

            metricsCollector.recordCheckoutSuccess();
            log.info("Checkout started: userId={}, sessionId={}, photos={}, amount={} {}",
                userId, session.getSessionId(), snapshot.getLines().size(), snapshot.getTotal(), currency);
            return StartCheckoutResponse.of(session, gatewaySession.redirectUrl());

        } catch (RuntimeException e) {
            metricsCollector.recordCheckoutFailure();
            throw e;
        } finally {
            metricsCollector.recordCheckoutDuration(startTime);
        }
    }

    private GatewaySession requestGatewaySession(CreateSessionCommand command) {
        try {
            return paymentGateway.createSession(command);
        } catch (BusinessException e) {
            log.error("Payment gateway session creation failed: userId={}, message={}",
                command.userId(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("Payment gateway session creation failed: userId={}", command.userId(), e);
            throw new BusinessException(ErrorCode.PAYMENT_GATEWAY_ERROR, e.getMessage(), e);
        }
    }

    private String trimTrailingSlash(String url) {
        String trimmed = url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
