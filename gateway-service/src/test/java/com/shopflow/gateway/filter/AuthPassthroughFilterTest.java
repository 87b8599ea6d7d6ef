package com.shopflow.gateway.filter;

import com.shopflow.gateway.config.GatewayAuthProperties;
import com.shopflow.gateway.error.ProblemResponseWriter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class AuthPassthroughFilterTest {

    private final ProblemResponseWriter writer = new ProblemResponseWriter(Jackson2ObjectMapperBuilder.json().build());
    private final AtomicReference<ServerWebExchange> passed = new AtomicReference<>();

    private AuthPassthroughFilter filter(boolean requireBearer) {
        return new AuthPassthroughFilter(new GatewayAuthProperties(requireBearer), writer);
    }

    private Mono<Void> run(AuthPassthroughFilter filter, MockServerWebExchange exchange) {
        return filter.filter(exchange, e -> {
            passed.set(e);
            return Mono.empty();
        });
    }

    @Test
    @DisplayName("Bearer 필수 설정에서 토큰이 없으면 401, 하위로 전달하지 않음")
    void missingBearer_Unauthorized() {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/orders"));

        StepVerifier.create(run(filter(true), exchange)).verifyComplete();

        assertThat(exchange.getResponse().getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
        assertThat(passed.get()).isNull();
    }

    @Test
    @DisplayName("Bearer 토큰이 있으면 Authorization 헤더를 그대로 둔 채 통과")
    void bearerPresent_PassedThrough() {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/orders")
                .header(HttpHeaders.AUTHORIZATION, "Bearer abc.def"));

        StepVerifier.create(run(filter(true), exchange)).verifyComplete();

        assertThat(passed.get()).isNotNull();
        assertThat(passed.get().getRequest().getHeaders().getFirst(HttpHeaders.AUTHORIZATION))
                .isEqualTo("Bearer abc.def");
    }

    @Test
    @DisplayName("/actuator, /fallback은 토큰 없이 통과")
    void skipPaths() {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/actuator/health"));

        StepVerifier.create(run(filter(true), exchange)).verifyComplete();

        assertThat(passed.get()).isNotNull();
    }

    @Test
    @DisplayName("기본 설정(require-bearer=false)에서는 토큰 없이도 통과")
    void notRequired() {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/orders"));

        StepVerifier.create(run(filter(false), exchange)).verifyComplete();

        assertThat(passed.get()).isNotNull();
    }
}
