package com.shopflow.gateway.config;

import com.shopflow.gateway.routing.RoutingEntry;
import com.shopflow.gateway.routing.RoutingTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cloud.gateway.filter.ratelimit.KeyResolver;
import org.springframework.cloud.gateway.filter.ratelimit.RedisRateLimiter;
import org.springframework.cloud.gateway.route.RouteLocator;
import org.springframework.cloud.gateway.route.builder.RouteLocatorBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;

import java.time.Duration;

/**
 * Gateway 라우트 설정 (프로그래밍 방식) - 라우팅 테이블의 엔트리마다 라우트 하나
 *
 * <h3>라우트별 필터 체인</h3>
 * <pre>
 * 1. Path Predicate  - {pathPrefix}/** (세그먼트 경계)
 * 2. RateLimiter     - Redis Token Bucket (RateLimitConfig), 초과 시 429
 * 3. CircuitBreaker  - 서비스 이름으로 된 브레이커, OPEN이면 forward:/fallback/{serviceName} (503)
 * 4. Retry           - GET만, 연결 실패 / 타임아웃일 때 최대 2회 (지수 백오프)
 * 5. RegistryRoutingFilter (GlobalFilter) - 헬스 상태 확인 + 레지스트리로 실제 주소 결정
 * </pre>
 *
 * <h3>라우팅 흐름</h3>
 * <pre>
 * Client → Gateway(:8080) → [라우트 매칭] → [필터 체인] → Service(:808x)
 *   /orders/**    → order-service(:8081)
 *   /billing/**   → billing-service(:8082)
 *   /inventory/** → inventory-service(:8083)
 * 일치하는 라우트가 없으면 404 not-found (GatewayErrorWebExceptionHandler)
 * </pre>
 */
@Slf4j
@Configuration
public class RouteConfig {

    static final int GET_RETRIES = 2;

    @Bean
    public RouteLocator serviceRouteLocator(RouteLocatorBuilder builder,
                                            RoutingTable routingTable,
                                            RedisRateLimiter redisRateLimiter,
                                            KeyResolver userKeyResolver) {
        RouteLocatorBuilder.Builder routes = builder.routes();
        for (RoutingEntry entry : routingTable.entries()) {
            String name = entry.serviceName();
            routes.route(name, r -> r
                    .path(entry.pathPrefix(), entry.pathPrefix() + "/**")
                    .filters(f -> f
                            .requestRateLimiter(c -> c
                                    .setRateLimiter(redisRateLimiter)
                                    .setKeyResolver(userKeyResolver))
                            .circuitBreaker(c -> c
                                    .setName(name)
                                    .setFallbackUri("forward:/fallback/" + name))
                            .retry(c -> c
                                    .setRetries(GET_RETRIES)
                                    .setMethods(HttpMethod.GET)
                                    .setSeries()
                                    .setBackoff(Duration.ofMillis(100), Duration.ofSeconds(1), 2, true)))
                    .uri(routeUri(entry)));
            log.info("Route registered: service={}, pathPrefix={}", name, entry.pathPrefix());
        }
        return routes.build();
    }

    /** 실제 주소는 RegistryRoutingFilter가 정한다. 여기 URI는 라우트 정의용 */
    private static String routeUri(RoutingEntry entry) {
        return entry.baseAddress() != null && !entry.baseAddress().isBlank()
                ? entry.baseAddress()
                : "http://" + entry.serviceName();
    }
}
