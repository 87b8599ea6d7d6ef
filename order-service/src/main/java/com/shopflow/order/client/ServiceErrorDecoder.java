package com.shopflow.order.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shopflow.common.exception.BusinessException;
import com.shopflow.common.exception.ErrorCode;
import feign.Response;
import feign.codec.ErrorDecoder;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;

/**
 * 하위 서비스 에러 응답 분류기
 *
 * <pre>
 * 400 → BusinessException(INVALID_INPUT)        ┐
 * 404 → BusinessException(ENTITY_NOT_FOUND)     ├ 거절: 재시도 안 함, 브레이커 실패로 집계 안 함
 * 409 → BusinessException(DOWNSTREAM_REJECTED)  ┘
 * 그 외 (5xx 등) → FeignException                  장애: 재시도 / 브레이커 집계 대상
 * </pre>
 *
 * 응답 본문이 ProblemDetail이면 detail을 메시지로 옮긴다 (주문의 failureReason으로 노출됨).
 */
@Slf4j
public class ServiceErrorDecoder implements ErrorDecoder {

    private final ObjectMapper objectMapper;
    private final ErrorDecoder defaultDecoder = new ErrorDecoder.Default();

    public ServiceErrorDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public Exception decode(String methodKey, Response response) {
        ErrorCode errorCode = switch (response.status()) {
            case 400 -> ErrorCode.INVALID_INPUT;
            case 404 -> ErrorCode.ENTITY_NOT_FOUND;
            case 409 -> ErrorCode.DOWNSTREAM_REJECTED;
            default -> null;
        };
        if (errorCode == null) {
            return defaultDecoder.decode(methodKey, response);
        }
        String detail = readDetail(methodKey, response);
        return new BusinessException(errorCode,
                detail != null ? detail : methodKey + " returned " + response.status());
    }

    private String readDetail(String methodKey, Response response) {
        if (response.body() == null) {
            return null;
        }
        try (InputStream body = response.body().asInputStream()) {
            JsonNode detail = objectMapper.readTree(body).get("detail");
            return detail != null && detail.isTextual() ? detail.asText() : null;
        } catch (IOException e) {
            log.warn("Unreadable error body: method={}, status={}, error={}",
                    methodKey, response.status(), e.toString());
            return null;
        }
    }
}
