package io.pixmarket.commerce.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 미완료(PENDING) 결제 점검 스케줄러 설정
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "payment.reconciliation")
public class ReconciliationProperties {

    private boolean sweepEnabled = true;

    /**
     * 이 시간보다 오래된 PENDING 트랜잭션을 점검 대상으로 본다
     */
    private Duration staleAfter = Duration.ofMinutes(15);

    private int batchSize = 50;
}
