package com.shopflow.gateway.filter;

import com.shopflow.gateway.error.ProblemResponseWriter;
import com.shopflow.gateway.registry.ServiceRegistry;
import com.shopflow.gateway.routing.RoutingDecision;
import com.shopflow.gateway.routing.RoutingDecision.Outcome;
import com.shopflow.gateway.routing.RoutingDecisionPublisher;
import com.shopflow.gateway.routing.RoutingEntry;
import com.shopflow.gateway.routing.RoutingTable;
import lombok.RequiredArgsConstructor;
import org.springframework.cloud.gateway.filter.GatewayFilterChain;
import org.springframework.cloud.gateway.filter.GlobalFilter;
import org.springframework.cloud.gateway.filter.RouteToRequestUrlFilter;
import org.springframework.core.Ordered;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.Optional;

import static org.springframework.cloud.gateway.support.ServerWebExchangeUtils.GATEWAY_REQUEST_URL_ATTR;

/**
 * 라우팅 테이블 + 서비스 레지스트리로 최종 요청 주소를 결정하는 GlobalFilter
 *
 * <h3>처리 흐름</h3>
 * <pre>
 * 요청 경로 → RoutingTable.match (가장 긴 접두사, 세그먼트 경계)
 *   ├─ 일치 없음         → 404 not-found  (백엔드 호출 없음)
 *   ├─ 헬스 상태 DOWN    → 503 unavailable (백엔드 호출 없음)
 *   └─ ServiceRegistry.resolve(serviceName)
 *        ├─ 주소 없음    → 503 unavailable
 *        └─ 주소 있음    → GATEWAY_REQUEST_URL_ATTR = 주소 + 원래 경로/쿼리 → NettyRoutingFilter가 전달
 * </pre>
 *
 * 모든 결정은 {@link RoutingDecisionPublisher}로 전달된다.
 * RouteToRequestUrlFilter가 라우트 URI로 채운 값을 덮어쓰므로 그 직후에 실행된다.
 */
@Component
@RequiredArgsConstructor
public class RegistryRoutingFilter implements GlobalFilter, Ordered {

    public static final int ORDER = RouteToRequestUrlFilter.ROUTE_TO_URL_FILTER_ORDER + 1;

    private final RoutingTable routingTable;
    private final ServiceRegistry serviceRegistry;
    private final RoutingDecisionPublisher decisionPublisher;
    private final ProblemResponseWriter problemWriter;

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, GatewayFilterChain chain) {
        ServerHttpRequest request = exchange.getRequest();
        String method = request.getMethod().name();
        String path = request.getPath().value();

        Optional<RoutingEntry> matched = routingTable.match(path);
        if (matched.isEmpty()) {
            decisionPublisher.publish(new RoutingDecision(method, path, null, Outcome.NOT_FOUND));
            return problemWriter.write(exchange, HttpStatus.NOT_FOUND, "not-found",
                    "No service is registered for path " + path);
        }

        RoutingEntry entry = matched.get();
        if (!entry.isAvailable()) {
            decisionPublisher.publish(new RoutingDecision(method, path, entry.serviceName(), Outcome.SERVICE_DOWN));
            return unavailable(exchange, entry.serviceName());
        }

        return serviceRegistry.resolve(entry.serviceName())
                .flatMap(base -> {
                    exchange.getAttributes().put(GATEWAY_REQUEST_URL_ATTR, target(base, request.getURI()));
                    decisionPublisher.publish(new RoutingDecision(method, path, entry.serviceName(), Outcome.ROUTED));
                    return chain.filter(exchange).thenReturn(Boolean.TRUE);
                })
                .switchIfEmpty(Mono.defer(() -> {
                    decisionPublisher.publish(new RoutingDecision(method, path, entry.serviceName(), Outcome.NO_INSTANCE));
                    return unavailable(exchange, entry.serviceName()).thenReturn(Boolean.FALSE);
                }))
                .then();
    }

    @Override
    public int getOrder() {
        return ORDER;
    }

    private Mono<Void> unavailable(ServerWebExchange exchange, String serviceName) {
        return problemWriter.write(exchange, HttpStatus.SERVICE_UNAVAILABLE, "unavailable",
                serviceName + " is temporarily unavailable");
    }

    /** 해석된 주소의 scheme/host/port + 원래 요청의 경로와 쿼리 (인코딩 유지) */
    static URI target(URI base, URI original) {
        return UriComponentsBuilder.fromUri(original)
                .scheme(base.getScheme())
                .host(base.getHost())
                .port(base.getPort())
                .build(true)
                .toUri();
    }
}
