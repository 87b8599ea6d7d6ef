package com.shopflow.gateway.aggregation;

import com.fasterxml.jackson.databind.JsonNode;
import com.shopflow.common.contract.ChargeResponse;
import com.shopflow.common.dto.ApiResponse;
import com.shopflow.common.exception.BusinessException;
import com.shopflow.common.exception.DependencyUnavailableException;
import com.shopflow.common.exception.ErrorCode;
import com.shopflow.gateway.filter.RequestIdFilter;
import com.shopflow.gateway.registry.ServiceRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cloud.client.circuitbreaker.ReactiveCircuitBreakerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.List;

/**
 * 주문 요약 집계 - Order Service와 Billing Service를 동시에 호출해 한 응답으로 합친다.
 *
 * <h3>장애 처리</h3>
 * <pre>
 * order 조회   → 브레이커 "order-service"
 *   ├─ 404                 → 404 not-found (주문 없음)
 *   └─ 장애 / OPEN         → 503 unavailable (요약 전체 실패)
 * billing 조회 → 브레이커 "billing-service"
 *   └─ 어떤 실패든          → charges = [], billingAvailable = false (요약은 성공)
 * </pre>
 */
@Slf4j
@Service
public class OrderSummaryService {

    static final String ORDER_SERVICE = "order-service";
    static final String BILLING_SERVICE = "billing-service";

    private static final ParameterizedTypeReference<ApiResponse<JsonNode>> ORDER_TYPE =
            new ParameterizedTypeReference<>() {
            };
    private static final ParameterizedTypeReference<ApiResponse<List<ChargeResponse>>> CHARGES_TYPE =
            new ParameterizedTypeReference<>() {
            };

    private final ServiceRegistry serviceRegistry;
    private final ReactiveCircuitBreakerFactory<?, ?> circuitBreakerFactory;
    private final WebClient webClient;

    public OrderSummaryService(ServiceRegistry serviceRegistry,
                               ReactiveCircuitBreakerFactory<?, ?> circuitBreakerFactory,
                               WebClient.Builder webClientBuilder) {
        this.serviceRegistry = serviceRegistry;
        this.circuitBreakerFactory = circuitBreakerFactory;
        this.webClient = webClientBuilder.build();
    }

    public Mono<OrderSummary> summarize(Long orderId, String authorization, String requestId) {
        return Mono.zip(fetchOrder(orderId, authorization, requestId),
                        fetchCharges(orderId, authorization, requestId))
                .map(tuple -> new OrderSummary(tuple.getT1(), tuple.getT2().charges(), tuple.getT2().available()));
    }

    private Mono<JsonNode> fetchOrder(Long orderId, String authorization, String requestId) {
        Mono<JsonNode> call = resolve(ORDER_SERVICE)
                .flatMap(base -> webClient.get()
                        .uri(uri(base, "/orders/{id}", orderId))
                        .headers(headers -> propagate(headers, authorization, requestId))
                        .retrieve()
                        .bodyToMono(ORDER_TYPE))
                .flatMap(response -> Mono.justOrEmpty(response.data()))
                .switchIfEmpty(Mono.error(() -> new IllegalStateException("Empty order response")))
                .onErrorMap(WebClientResponseException.NotFound.class,
                        e -> new BusinessException(ErrorCode.ORDER_NOT_FOUND, "Order not found: " + orderId));

        return circuitBreakerFactory.create(ORDER_SERVICE).run(call, e -> {
            if (e instanceof BusinessException) {
                return Mono.error(e);
            }
            return Mono.error(new DependencyUnavailableException(ORDER_SERVICE, "order lookup failed", e));
        });
    }

    private Mono<ChargesLeg> fetchCharges(Long orderId, String authorization, String requestId) {
        Mono<ChargesLeg> call = resolve(BILLING_SERVICE)
                .flatMap(base -> webClient.get()
                        .uri(UriComponentsBuilder.fromUri(base)
                                .path("/billing/charges")
                                .queryParam("orderId", orderId)
                                .build()
                                .toUri())
                        .headers(headers -> propagate(headers, authorization, requestId))
                        .retrieve()
                        .bodyToMono(CHARGES_TYPE))
                .map(response -> new ChargesLeg(response.data() != null ? response.data() : List.of(), true));

        return circuitBreakerFactory.create(BILLING_SERVICE).run(call, e -> {
            log.warn("Billing leg degraded: orderId={}, error={}", orderId, e.toString());
            return Mono.just(new ChargesLeg(List.of(), false));
        });
    }

    private Mono<URI> resolve(String serviceName) {
        return serviceRegistry.resolve(serviceName)
                .switchIfEmpty(Mono.error(() ->
                        new DependencyUnavailableException(serviceName, "no registered address", null)));
    }

    private static URI uri(URI base, String path, Object... variables) {
        return UriComponentsBuilder.fromUri(base).path(path).buildAndExpand(variables).toUri();
    }

    private static void propagate(HttpHeaders headers, String authorization, String requestId) {
        if (authorization != null) {
            headers.set(HttpHeaders.AUTHORIZATION, authorization);
        }
        if (requestId != null) {
            headers.set(RequestIdFilter.HEADER, requestId);
        }
    }

    private record ChargesLeg(List<ChargeResponse> charges, boolean available) {
    }
}
