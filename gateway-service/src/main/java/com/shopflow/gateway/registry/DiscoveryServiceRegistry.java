package com.shopflow.gateway.registry;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cloud.client.ServiceInstance;
import org.springframework.cloud.client.discovery.ReactiveDiscoveryClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * DiscoveryClient 기반 레지스트리 - 등록된 인스턴스 중 하나를 무작위로 고른다.
 * 인스턴스가 없으면 빈 Mono (Gateway는 503으로 응답).
 */
@Slf4j
@RequiredArgsConstructor
public class DiscoveryServiceRegistry implements ServiceRegistry {

    private final ReactiveDiscoveryClient discoveryClient;

    @Override
    public Mono<URI> resolve(String serviceName) {
        return discoveryClient.getInstances(serviceName)
                .collectList()
                .flatMap(instances -> {
                    if (instances.isEmpty()) {
                        log.warn("No registered instance: service={}", serviceName);
                        return Mono.empty();
                    }
                    return Mono.just(pick(instances).getUri());
                });
    }

    private static ServiceInstance pick(List<ServiceInstance> instances) {
        return instances.get(ThreadLocalRandom.current().nextInt(instances.size()));
    }
}
