package com.shopflow.gateway.filter;

import com.shopflow.gateway.config.GatewayAuthProperties;
import com.shopflow.gateway.error.ProblemResponseWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * 인증 패스스루 필터
 *
 * <h3>역할</h3>
 * Gateway는 토큰을 발급하거나 검증하지 않는다. Authorization 헤더는 손대지 않고 하위 서비스로 전달된다.
 * {@code gateway.auth.require-bearer=true}일 때만 Bearer 토큰이 없는 요청을 Gateway에서 401로 끊는다.
 *
 * <h3>인증 없이 통과하는 경로</h3>
 * /actuator, /fallback (모니터링, Circuit Breaker Fallback)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AuthPassthroughFilter implements WebFilter, Ordered {

    private static final List<String> SKIP_PATHS = List.of("/actuator", "/fallback");
    private static final String BEARER_PREFIX = "Bearer ";

    private final GatewayAuthProperties properties;
    private final ProblemResponseWriter problemWriter;

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        if (!properties.requireBearer()) {
            return chain.filter(exchange);
        }
        String path = exchange.getRequest().getPath().value();
        if (SKIP_PATHS.stream().anyMatch(path::startsWith)) {
            return chain.filter(exchange);
        }

        String authorization = exchange.getRequest().getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        if (authorization == null || !authorization.startsWith(BEARER_PREFIX)
                || authorization.length() == BEARER_PREFIX.length()) {
            log.warn("Missing bearer token: method={}, path={}", exchange.getRequest().getMethod(), path);
            return problemWriter.write(exchange, HttpStatus.UNAUTHORIZED, "unauthorized",
                    "A bearer token is required");
        }
        return chain.filter(exchange);
    }

    /** RequestIdFilter 다음, 라우팅보다 먼저 */
    @Override
    public int getOrder() {
        return Ordered.HIGHEST_PRECEDENCE + 20;
    }
}
