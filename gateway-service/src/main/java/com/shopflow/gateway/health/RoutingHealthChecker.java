package com.shopflow.gateway.health;

import com.shopflow.gateway.config.GatewayRoutingProperties;
import com.shopflow.gateway.registry.ServiceRegistry;
import com.shopflow.gateway.routing.HealthStatus;
import com.shopflow.gateway.routing.RoutingEntry;
import com.shopflow.gateway.routing.RoutingTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;

/**
 * 라우팅 엔트리 헬스 체커 - 라우팅 테이블의 유일한 쓰기 주체
 *
 * <h3>동작</h3>
 * <pre>
 * 주기마다 (gateway.routing.health-interval-ms, 기본 10초):
 *   서비스마다 GET {address}/actuator/health (probeTimeout 안에 2xx면 성공)
 *   ├─ 성공 → UP, 연속 실패 0
 *   └─ 실패 → 연속 실패 +1, failureThreshold 도달 시 DOWN
 * </pre>
 *
 * 주소 해석 실패(인스턴스 없음)도 프로브 실패로 센다.
 * fixedDelay + block으로 한 주기가 끝나야 다음 주기가 시작된다 (쓰기 주체가 항상 하나).
 */
@Slf4j
@Component
public class RoutingHealthChecker {

    static final String HEALTH_PATH = "/actuator/health";

    private final RoutingTable routingTable;
    private final ServiceRegistry serviceRegistry;
    private final WebClient webClient;
    private final Duration probeTimeout;

    public RoutingHealthChecker(RoutingTable routingTable,
                                ServiceRegistry serviceRegistry,
                                WebClient.Builder webClientBuilder,
                                GatewayRoutingProperties properties) {
        this.routingTable = routingTable;
        this.serviceRegistry = serviceRegistry;
        this.webClient = webClientBuilder.build();
        this.probeTimeout = properties.probeTimeout();
    }

    @Scheduled(fixedDelayString = "${gateway.routing.health-interval-ms:10000}",
            initialDelayString = "${gateway.routing.health-initial-delay-ms:0}")
    public void checkAll() {
        // 개별 프로브 실패는 probe() 안에서 false로 바뀌므로 여기까지 오지 않는다
        probeAll().block(probeTimeout.multipliedBy(routingTable.entries().size() + 1L));
    }

    /** 모든 엔트리를 동시에 프로브하고 결과를 테이블에 반영 */
    public Mono<Void> probeAll() {
        return Flux.fromIterable(routingTable.entries())
                .flatMap(entry -> probe(entry.serviceName())
                        .doOnNext(healthy -> apply(entry, healthy)))
                .then();
    }

    Mono<Boolean> probe(String serviceName) {
        return serviceRegistry.resolve(serviceName)
                .flatMap(base -> webClient.get()
                        .uri(healthUri(base))
                        .retrieve()
                        .toBodilessEntity()
                        .map(response -> response.getStatusCode().is2xxSuccessful()))
                .timeout(probeTimeout)
                .defaultIfEmpty(false)
                .onErrorResume(e -> {
                    log.debug("Health probe failed: service={}, error={}", serviceName, e.toString());
                    return Mono.just(false);
                });
    }

    private void apply(RoutingEntry before, boolean healthy) {
        RoutingEntry after = routingTable.recordProbe(before.serviceName(), healthy);
        if (after.healthStatus() != before.healthStatus()) {
            if (after.healthStatus() == HealthStatus.DOWN) {
                log.warn("Service marked DOWN: service={}, consecutiveFailures={}",
                        after.serviceName(), after.consecutiveFailures());
            } else {
                log.info("Service health changed: service={}, {} -> {}",
                        after.serviceName(), before.healthStatus(), after.healthStatus());
            }
        }
    }

    private static URI healthUri(URI base) {
        return UriComponentsBuilder.fromUri(base).path(HEALTH_PATH).build().toUri();
    }
}
