package com.shopflow.gateway.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.cloud.gateway.filter.ratelimit.KeyResolver;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import reactor.test.StepVerifier;

import java.net.InetSocketAddress;

class RateLimitConfigTest {

    private final KeyResolver keyResolver = new RateLimitConfig().userKeyResolver();

    @Test
    @DisplayName("X-User-Id가 있으면 사용자 기준으로 버킷을 나눔")
    void userKey() {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/orders")
                .header("X-User-Id", "42")
                .remoteAddress(new InetSocketAddress("10.1.2.3", 55000)));

        StepVerifier.create(keyResolver.resolve(exchange)).expectNext("user:42").verifyComplete();
    }

    @Test
    @DisplayName("X-User-Id가 없으면 클라이언트 IP 기준")
    void ipKey() {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/orders")
                .remoteAddress(new InetSocketAddress("10.1.2.3", 55000)));

        StepVerifier.create(keyResolver.resolve(exchange)).expectNext("ip:10.1.2.3").verifyComplete();
    }
}
