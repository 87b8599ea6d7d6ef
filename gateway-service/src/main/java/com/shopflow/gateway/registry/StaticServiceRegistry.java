package com.shopflow.gateway.registry;

import com.shopflow.gateway.routing.RoutingTable;
import lombok.RequiredArgsConstructor;
import reactor.core.publisher.Mono;

import java.net.URI;

/**
 * 정적 설정 레지스트리 - 라우팅 테이블의 baseAddress를 그대로 사용한다.
 */
@RequiredArgsConstructor
public class StaticServiceRegistry implements ServiceRegistry {

    private final RoutingTable routingTable;

    @Override
    public Mono<URI> resolve(String serviceName) {
        return Mono.justOrEmpty(routingTable.find(serviceName))
                .flatMap(entry -> Mono.justOrEmpty(entry.baseAddress()))
                .filter(address -> !address.isBlank())
                .map(URI::create);
    }
}
