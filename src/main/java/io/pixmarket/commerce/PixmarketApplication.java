package io.pixmarket.commerce;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling  // 미결제 거래 스윕 스케줄러 활성화 (PendingPaymentSweepScheduler)
public class PixmarketApplication {

	public static void main(String[] args) {
		SpringApplication.run(PixmarketApplication.class, args);
	}

}
