package com.shopflow.gateway.registry;

import reactor.core.publisher.Mono;

import java.net.URI;

/**
 * 서비스 레지스트리 - 논리 서비스 이름을 네트워크 주소로 해석한다.
 *
 * <p>호출하는 쪽은 주소를 하드코딩하지 않고 항상 이 인터페이스를 거친다.
 * 기본 구현은 정적 설정({@link StaticServiceRegistry}),
 * {@code gateway.registry.mode=discovery}면 Spring Cloud DiscoveryClient 기반({@link DiscoveryServiceRegistry}).</p>
 */
public interface ServiceRegistry {

    /**
     * @return 서비스의 기본 주소 (scheme://host:port). 해석할 수 없으면 빈 Mono
     */
    Mono<URI> resolve(String serviceName);
}
