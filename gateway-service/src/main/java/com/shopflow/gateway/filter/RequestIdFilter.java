package com.shopflow.gateway.filter;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * X-Request-Id 상관관계 헤더
 *
 * <pre>
 * 요청에 X-Request-Id가 있으면 그대로, 없으면 UUID를 생성해
 *   → 하위 서비스로 가는 요청 헤더에 설정
 *   → 클라이언트 응답 헤더에도 설정
 *   → exchange 속성과 Reactor Context에 노출
 * </pre>
 *
 * WebFilter라서 라우팅되는 요청과 Gateway 자체 컨트롤러(Fallback, 집계) 모두에 적용된다.
 */
@Slf4j
@Component
public class RequestIdFilter implements WebFilter, Ordered {

    public static final String HEADER = "X-Request-Id";
    public static final String ATTRIBUTE = RequestIdFilter.class.getName() + ".requestId";
    public static final String CONTEXT_KEY = "requestId";

    private static final int MAX_LENGTH = 128;

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String incoming = exchange.getRequest().getHeaders().getFirst(HEADER);
        String requestId = isUsable(incoming) ? incoming.trim() : UUID.randomUUID().toString();

        ServerHttpRequest request = exchange.getRequest().mutate()
                .headers(headers -> headers.set(HEADER, requestId))
                .build();
        ServerWebExchange mutated = exchange.mutate().request(request).build();
        mutated.getAttributes().put(ATTRIBUTE, requestId);
        mutated.getResponse().getHeaders().set(HEADER, requestId);

        return chain.filter(mutated).contextWrite(context -> context.put(CONTEXT_KEY, requestId));
    }

    @Override
    public int getOrder() {
        return Ordered.HIGHEST_PRECEDENCE + 10;
    }

    private static boolean isUsable(String value) {
        return value != null && !value.isBlank() && value.length() <= MAX_LENGTH;
    }
}
