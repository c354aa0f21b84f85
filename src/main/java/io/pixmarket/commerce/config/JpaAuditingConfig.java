package io.pixmarket.commerce.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

/**
 * JPA Auditing 설정
 *
 * @EnableJpaAuditing: @CreatedDate, @LastModifiedDate 자동 처리
 * - CheckoutSession, PaymentTransaction의 created_at은 여기서 채워진다
 */
@Configuration
@EnableJpaAuditing
public class JpaAuditingConfig {
}
