package com.shopflow.gateway.controller;

import com.shopflow.common.exception.ErrorCode;
import com.shopflow.common.exception.ProblemDetails;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;

import static org.springframework.cloud.gateway.support.ServerWebExchangeUtils.CIRCUITBREAKER_EXECUTION_EXCEPTION_ATTR;

/**
 * Circuit Breaker Fallback 컨트롤러
 *
 * <h3>Circuit Breaker 동작 흐름</h3>
 * <pre>
 * 1. Client → Gateway → [CircuitBreaker: CLOSED] → 하위 서비스 (정상)
 * 2. 장애 누적 → OPEN 전환
 * 3. Client → Gateway → [CircuitBreaker: OPEN] → 여기 (503, 백엔드 호출 없음)
 * 4. waitDurationInOpenState 후 HALF_OPEN → 시험 호출 1회
 * 5. 성공 시 CLOSED, 실패 시 다시 OPEN
 * </pre>
 *
 * 연결 실패 / 타임아웃도 여기로 온다. 응답에 원인 예외나 백엔드 주소는 넣지 않는다.
 */
@Slf4j
@RestController
public class FallbackController {

    static final String RETRY_AFTER_SECONDS = "10";

    @RequestMapping("/fallback/{serviceName}")
    public ResponseEntity<ProblemDetail> fallback(@PathVariable String serviceName, ServerWebExchange exchange) {
        Throwable cause = exchange.getAttribute(CIRCUITBREAKER_EXECUTION_EXCEPTION_ATTR);
        log.warn("Circuit breaker fallback: service={}, path={}, cause={}",
                serviceName, exchange.getRequest().getPath().value(),
                cause != null ? cause.toString() : "unknown");

        ErrorCode errorCode = ErrorCode.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(errorCode.getStatus())
                .header(HttpHeaders.RETRY_AFTER, RETRY_AFTER_SECONDS)
                .body(ProblemDetails.of(errorCode, serviceName + " is temporarily unavailable"));
    }
}
