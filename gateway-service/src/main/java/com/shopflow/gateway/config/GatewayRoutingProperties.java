package com.shopflow.gateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

/**
 * 라우팅 테이블 설정 ({@code gateway.routing.*}).
 *
 * <pre>
 * gateway:
 *   routing:
 *     failure-threshold: 3
 *     probe-timeout: 2s
 *     services:
 *       - name: order-service
 *         path-prefix: /orders
 *         base-address: http://localhost:8081
 * </pre>
 *
 * 환경 변수로 덮어쓸 수 있다 (예: {@code GATEWAY_ROUTING_SERVICES_0_BASE_ADDRESS}).
 *
 * @param services         서비스별 라우팅 엔트리 정의
 * @param failureThreshold 연속 프로브 실패가 이 횟수에 도달하면 DOWN
 * @param probeTimeout     헬스 프로브 한 번의 제한 시간
 */
@ConfigurationProperties(prefix = "gateway.routing")
public record GatewayRoutingProperties(
        List<Service> services,
        int failureThreshold,
        Duration probeTimeout
) {

    public GatewayRoutingProperties {
        if (services == null) {
            services = List.of();
        }
        if (failureThreshold <= 0) {
            failureThreshold = 3;
        }
        if (probeTimeout == null) {
            probeTimeout = Duration.ofSeconds(2);
        }
    }

    public record Service(String name, String pathPrefix, String baseAddress) {
    }
}
