package com.shopflow.gateway.aggregation;

import com.shopflow.common.exception.BusinessException;
import com.shopflow.common.exception.DependencyUnavailableException;
import com.shopflow.common.exception.ErrorCode;
import com.shopflow.gateway.registry.ServiceRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.cloud.client.circuitbreaker.ReactiveCircuitBreaker;
import org.springframework.cloud.client.circuitbreaker.ReactiveCircuitBreakerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class OrderSummaryServiceTest {

    private static final String ORDER_JSON = """
            {"success":true,"data":{"id":1,"status":"PAID","amount":10.00,"items":[{"sku":"X","quantity":1}]}}
            """;
    private static final String CHARGES_JSON = """
            {"success":true,"data":[{"orderId":1,"amount":10.00,"status":"APPROVED","referenceId":"ch_1","idempotencyKey":"charge-s1"}]}
            """;

    @Mock
    private ServiceRegistry serviceRegistry;

    @Mock
    private ReactiveCircuitBreakerFactory<?, ?> circuitBreakerFactory;

    @Mock
    private ReactiveCircuitBreaker circuitBreaker;

    private final List<ClientRequest> requests = new ArrayList<>();
    private HttpStatus orderStatus = HttpStatus.OK;
    private HttpStatus billingStatus = HttpStatus.OK;

    private OrderSummaryService service;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        given(serviceRegistry.resolve("order-service")).willReturn(Mono.just(URI.create("http://localhost:8081")));
        given(serviceRegistry.resolve("billing-service")).willReturn(Mono.just(URI.create("http://localhost:8082")));
        given(circuitBreakerFactory.create(anyString())).willReturn(circuitBreaker);
        // 브레이커는 닫힌 상태로 가정: 실패하면 fallback 함수로 넘긴다
        given(circuitBreaker.run(any(Mono.class), any(Function.class))).willAnswer(invocation -> {
            Mono<Object> toRun = invocation.getArgument(0);
            Function<Throwable, Mono<Object>> fallback = invocation.getArgument(1);
            return toRun.onErrorResume(fallback);
        });

        WebClient.Builder webClient = WebClient.builder().exchangeFunction(request -> {
            requests.add(request);
            boolean billing = request.url().getPort() == 8082;
            HttpStatus status = billing ? billingStatus : orderStatus;
            ClientResponse.Builder response = ClientResponse.create(status)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
            if (status.is2xxSuccessful()) {
                response.body(billing ? CHARGES_JSON : ORDER_JSON);
            }
            return Mono.just(response.build());
        });
        service = new OrderSummaryService(serviceRegistry, circuitBreakerFactory, webClient);
    }

    @Test
    @DisplayName("주문과 결제 내역을 합쳐 반환, Authorization / X-Request-Id 전달")
    void summarize_BothAvailable() {
        StepVerifier.create(service.summarize(1L, "Bearer token-1", "req-1"))
                .assertNext(summary -> {
                    assertThat(summary.order().get("status").asText()).isEqualTo("PAID");
                    assertThat(summary.charges()).hasSize(1);
                    assertThat(summary.charges().get(0).referenceId()).isEqualTo("ch_1");
                    assertThat(summary.billingAvailable()).isTrue();
                })
                .verifyComplete();

        assertThat(requests).extracting(r -> r.url().toString())
                .containsExactlyInAnyOrder("http://localhost:8081/orders/1",
                        "http://localhost:8082/billing/charges?orderId=1");
        assertThat(requests).allSatisfy(r -> {
            assertThat(r.headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer token-1");
            assertThat(r.headers().getFirst("X-Request-Id")).isEqualTo("req-1");
        });
    }

    @Test
    @DisplayName("billing 장애 → 빈 결제 목록 + billingAvailable=false, 요약은 성공")
    void summarize_BillingDegraded() {
        billingStatus = HttpStatus.SERVICE_UNAVAILABLE;

        StepVerifier.create(service.summarize(1L, null, null))
                .assertNext(summary -> {
                    assertThat(summary.order().get("id").asLong()).isEqualTo(1L);
                    assertThat(summary.charges()).isEmpty();
                    assertThat(summary.billingAvailable()).isFalse();
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("주문이 없으면 ORDER_NOT_FOUND")
    void summarize_OrderNotFound() {
        orderStatus = HttpStatus.NOT_FOUND;

        StepVerifier.create(service.summarize(99L, null, null))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(BusinessException.class);
                    assertThat(((BusinessException) e).getErrorCode()).isEqualTo(ErrorCode.ORDER_NOT_FOUND);
                })
                .verify();
    }

    @Test
    @DisplayName("order 장애 → DependencyUnavailableException(order-service)")
    void summarize_OrderUnavailable() {
        orderStatus = HttpStatus.BAD_GATEWAY;

        StepVerifier.create(service.summarize(1L, null, null))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(DependencyUnavailableException.class);
                    assertThat(((DependencyUnavailableException) e).getTarget()).isEqualTo("order-service");
                })
                .verify();
    }
}
