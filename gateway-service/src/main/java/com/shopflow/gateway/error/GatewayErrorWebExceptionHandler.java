package com.shopflow.gateway.error;

import com.shopflow.common.exception.BusinessException;
import com.shopflow.common.exception.DependencyUnavailableException;
import com.shopflow.gateway.routing.RoutingDecision;
import com.shopflow.gateway.routing.RoutingDecisionPublisher;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.reactive.error.ErrorWebExceptionHandler;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.util.concurrent.TimeoutException;

import static org.springframework.cloud.gateway.support.ServerWebExchangeUtils.GATEWAY_ROUTE_ATTR;

/**
 * Gateway 전역 에러 핸들러 (리액티브) - 하위 서비스와 같은 ProblemDetail 형식, 같은 클라이언트 코드
 *
 * <h3>매핑</h3>
 * <pre>
 * 일치하는 라우트/핸들러 없음 (404)                      → 404 not-found
 * BusinessException                                    → ErrorCode의 상태 / 코드
 * DependencyUnavailable, CallNotPermitted,
 *   연결 실패, 타임아웃, 5xx ResponseStatusException    → 503 unavailable
 * 400 / 401 / 409 / 429 ResponseStatusException        → invalid-request / unauthorized / rejected / rate-limited
 * 그 외                                                 → 500 internal
 * </pre>
 *
 * 응답에 스택 트레이스, 예외 메시지 원문, 백엔드 주소는 절대 넣지 않는다.
 * Boot 기본 핸들러(@Order(-1))보다 먼저 실행된다.
 */
@Slf4j
@Component
@Order(-2)
@RequiredArgsConstructor
public class GatewayErrorWebExceptionHandler implements ErrorWebExceptionHandler {

    private final ProblemResponseWriter problemWriter;
    private final RoutingDecisionPublisher decisionPublisher;

    @Override
    public Mono<Void> handle(ServerWebExchange exchange, Throwable ex) {
        if (exchange.getResponse().isCommitted()) {
            return Mono.error(ex);
        }

        if (ex instanceof BusinessException be) {
            log.warn("Business exception at gateway: code={}, message={}", be.getErrorCode(), be.getMessage());
            return problemWriter.write(exchange, be.getErrorCode().getStatus(),
                    be.getErrorCode().getClientCode(), be.getMessage());
        }

        if (ex instanceof DependencyUnavailableException due) {
            log.warn("Dependency unavailable at gateway: target={}, cause={}", due.getTarget(), rootCause(due));
            return unavailable(exchange, due.getTarget() + " is temporarily unavailable");
        }

        if (ex instanceof CallNotPermittedException || ex instanceof ConnectException
                || ex instanceof TimeoutException) {
            log.warn("Backend unavailable: path={}, error={}", path(exchange), ex.toString());
            return unavailable(exchange, "Service temporarily unavailable");
        }

        if (ex instanceof ResponseStatusException rse) {
            return handleStatus(exchange, rse);
        }

        log.error("Unexpected gateway error: path={}", path(exchange), ex);
        return problemWriter.write(exchange, HttpStatus.INTERNAL_SERVER_ERROR, "internal",
                "Unexpected gateway error");
    }

    private Mono<Void> handleStatus(ServerWebExchange exchange, ResponseStatusException rse) {
        HttpStatusCode status = rse.getStatusCode();

        if (status.value() == HttpStatus.NOT_FOUND.value()) {
            if (exchange.getAttribute(GATEWAY_ROUTE_ATTR) == null) {
                decisionPublisher.publish(new RoutingDecision(
                        exchange.getRequest().getMethod().name(), path(exchange), null,
                        RoutingDecision.Outcome.NOT_FOUND));
            }
            return problemWriter.write(exchange, HttpStatus.NOT_FOUND, "not-found",
                    "No service is registered for path " + path(exchange));
        }
        if (status.is5xxServerError()) {
            log.warn("Backend unavailable: path={}, status={}", path(exchange), status.value());
            return unavailable(exchange, "Service temporarily unavailable");
        }

        String clientCode = switch (status.value()) {
            case 401 -> "unauthorized";
            case 409 -> "rejected";
            case 429 -> "rate-limited";
            default -> "invalid-request";
        };
        String detail = rse.getReason() != null ? rse.getReason() : "Invalid request";
        log.debug("Request rejected at gateway: path={}, status={}", path(exchange), status.value());
        return problemWriter.write(exchange, status, clientCode, detail);
    }

    private Mono<Void> unavailable(ServerWebExchange exchange, String detail) {
        return problemWriter.write(exchange, HttpStatus.SERVICE_UNAVAILABLE, "unavailable", detail);
    }

    private static String path(ServerWebExchange exchange) {
        return exchange.getRequest().getPath().value();
    }

    private static String rootCause(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        return cause.toString();
    }
}
