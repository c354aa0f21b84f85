package io.pixmarket.commerce.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * 결제사(Stripe 호환) 연동 설정
 *
 * payment.gateway.api-key: 결제사 비밀 키 (운영에서는 환경변수로 주입)
 * payment.gateway.webhook-secret: 콜백 서명 검증 키
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "payment.gateway")
public class PaymentGatewayProperties {

    private String apiKey;

    @NotBlank
    private String webhookSecret;

    @NotBlank
    private String currency = "eur";

    private Duration connectTimeout = Duration.ofSeconds(3);

    private Duration readTimeout = Duration.ofSeconds(5);

    /**
     * 콜백 서명 타임스탬프 허용 오차
     */
    private Duration signatureTolerance = Duration.ofMinutes(5);
}
