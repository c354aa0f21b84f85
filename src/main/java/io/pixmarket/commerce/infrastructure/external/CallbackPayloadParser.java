package io.pixmarket.commerce.infrastructure.external;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.pixmarket.commerce.common.exception.BusinessException;
import io.pixmarket.commerce.common.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 결제사 콜백 본문 해석
 * <p>
 * 형식: {"type": "...", "data": {"object": {"id": "cs_...", "payment_status": "paid"}}}
 * 서명 검증이 끝난 본문만 넘겨야 한다.
 */
@Component
@RequiredArgsConstructor
public class CallbackPayloadParser {

    private final ObjectMapper objectMapper;

    public GatewayCallback parse(String rawBody) {
        JsonNode root;
        try {
            root = objectMapper.readTree(rawBody);
        } catch (JsonProcessingException e) {
            throw new BusinessException(ErrorCode.INVALID_SIGNATURE, "콜백 본문을 해석할 수 없습니다", e);
        }
        if (root == null || !root.isObject()) {
            throw new BusinessException(ErrorCode.INVALID_SIGNATURE, "콜백 본문 형식이 올바르지 않습니다");
        }

        JsonNode object = root.path("data").path("object");
        return new GatewayCallback(
            textOrNull(root.get("type")),
            textOrNull(object.get("id")),
            textOrNull(object.get("payment_status"))
        );
    }

    private String textOrNull(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }
}
