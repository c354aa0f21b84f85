package io.pixmarket.commerce.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI openAPI() {
        return new OpenAPI()
            .info(new Info()
                .title("Pixmarket Commerce API")
                .description("이벤트 사진 마켓 - 장바구니, 체크아웃, 결제 정산, 구매 내역 API")
                .version("1.0.0"));
    }
}
