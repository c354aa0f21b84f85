package io.pixmarket.commerce.presentation.api.checkout;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.pixmarket.commerce.application.cart.dto.AddCartItemRequest;
import io.pixmarket.commerce.application.checkout.dto.StartCheckoutRequest;
import io.pixmarket.commerce.application.usecase.cart.AddToCartUseCase;
import io.pixmarket.commerce.domain.photo.Photo;
import io.pixmarket.commerce.domain.photo.PhotoRepository;
import io.pixmarket.commerce.support.IntegrationTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class CheckoutControllerIntegrationTest extends IntegrationTestSupport {

    private static final Long USER_ID = 1L;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private PhotoRepository photoRepository;

    @Autowired
    private AddToCartUseCase addToCartUseCase;

    private Long photoId;

    @BeforeEach
    void setUp() {
        photoId = photoRepository.save(Photo.create(1L, "marathon-002.jpg", 900L)).getId();
    }

    @Test
    @DisplayName("체크아웃 시작 API - 성공")
    void startCheckout_성공() throws Exception {
        addToCartUseCase.execute(new AddCartItemRequest(USER_ID, photoId));

        mockMvc.perform(post("/api/checkout/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new StartCheckoutRequest(USER_ID, "https://shop.test"))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.sessionId").value(startsWith("cs_test_")))
                .andExpect(jsonPath("$.url").value(startsWith("https://")))
                .andExpect(jsonPath("$.amount").value(900L))
                .andExpect(jsonPath("$.currency").value("eur"));
    }

    @Test
    @DisplayName("체크아웃 시작 API - 빈 장바구니")
    void startCheckout_실패_빈장바구니() throws Exception {
        mockMvc.perform(post("/api/checkout/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new StartCheckoutRequest(USER_ID, "https://shop.test"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("CART003"));
    }

    @Test
    @DisplayName("체크아웃 시작 API - 결제사 장애")
    void startCheckout_실패_결제사장애() throws Exception {
        addToCartUseCase.execute(new AddCartItemRequest(USER_ID, photoId));
        mockPaymentGateway.setSimulateOutage(true);

        mockMvc.perform(post("/api/checkout/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new StartCheckoutRequest(USER_ID, "https://shop.test"))))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.code").value("PAY005"));
    }

    @Test
    @DisplayName("결제 상태 API - 결제 전후")
    void getStatus_결제전후() throws Exception {
        String sessionId = startCheckout();

        mockMvc.perform(get("/api/checkout/sessions/" + sessionId + "/status").param("userId", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.paymentStatus").value("unpaid"))
                .andExpect(jsonPath("$.fulfilled").value(false));

        mockPaymentGateway.markPaid(sessionId);

        mockMvc.perform(get("/api/checkout/sessions/" + sessionId + "/status").param("userId", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("complete"))
                .andExpect(jsonPath("$.paymentStatus").value("paid"))
                .andExpect(jsonPath("$.amountTotal").value(900L))
                .andExpect(jsonPath("$.fulfilled").value(true));
    }

    @Test
    @DisplayName("결제 상태 API - 없는 세션이나 다른 사용자의 세션은 404")
    void getStatus_실패_알수없는세션() throws Exception {
        String sessionId = startCheckout();

        mockMvc.perform(get("/api/checkout/sessions/cs_test_unknown/status").param("userId", "1"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("PAY003"));

        mockMvc.perform(get("/api/checkout/sessions/" + sessionId + "/status").param("userId", "2"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("PAY003"));
    }

    private String startCheckout() throws Exception {
        addToCartUseCase.execute(new AddCartItemRequest(USER_ID, photoId));
        MvcResult result = mockMvc.perform(post("/api/checkout/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new StartCheckoutRequest(USER_ID, "https://shop.test"))))
                .andExpect(status().isCreated())
                .andReturn();
        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
        return body.get("sessionId").asText();
    }
}
