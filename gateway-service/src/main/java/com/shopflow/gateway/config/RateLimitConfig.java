package com.shopflow.gateway.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.cloud.gateway.filter.ratelimit.KeyResolver;
import org.springframework.cloud.gateway.filter.ratelimit.RedisRateLimiter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.publisher.Mono;

import java.net.InetSocketAddress;

/**
 * Redis 기반 분산 Rate Limiting 설정 (Token Bucket Algorithm)
 *
 * <h3>Token Bucket (Redis에서 실행)</h3>
 * <pre>
 * 사용자(또는 IP)마다 Redis에 토큰 버킷:
 * - replenishRate: 초당 충전되는 토큰 수 (gateway.rate-limit.replenish-rate)
 * - burstCapacity: 버킷 크기 (gateway.rate-limit.burst-capacity)
 * - 요청 1개 = 토큰 1개, 토큰이 없으면 429 Too Many Requests
 * </pre>
 *
 * Gateway 인스턴스가 여러 개여도 Redis가 상태를 공유하므로 제한이 일관된다.
 */
@Configuration
public class RateLimitConfig {

    static final String USER_HEADER = "X-User-Id";

    @Bean
    public RedisRateLimiter redisRateLimiter(
            @Value("${gateway.rate-limit.replenish-rate:50}") int replenishRate,
            @Value("${gateway.rate-limit.burst-capacity:100}") int burstCapacity) {
        return new RedisRateLimiter(replenishRate, burstCapacity);
    }

    /**
     * 요청 수를 세는 기준.
     * X-User-Id 헤더가 있으면 사용자별, 없으면 클라이언트 IP별.
     */
    @Bean
    public KeyResolver userKeyResolver() {
        return exchange -> {
            String userId = exchange.getRequest().getHeaders().getFirst(USER_HEADER);
            if (userId != null && !userId.isBlank()) {
                return Mono.just("user:" + userId);
            }
            InetSocketAddress remote = exchange.getRequest().getRemoteAddress();
            String ip = remote != null && remote.getAddress() != null
                    ? remote.getAddress().getHostAddress()
                    : "anonymous";
            return Mono.just("ip:" + ip);
        };
    }
}
