package com.shopflow.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * ShopFlow Gateway Service - API Gateway 진입점 (Spring Cloud Gateway)
 *
 * <h3>역할</h3>
 * 모든 클라이언트 요청의 단일 진입점으로, 경로 접두사(/orders, /billing, /inventory)로
 * 대상 서비스를 찾아 요청을 그대로 전달하고 응답을 그대로 돌려준다.
 *
 * <h3>구성</h3>
 * <ul>
 *   <li>RoutingTable - 서비스별 라우팅 엔트리 (불변 스냅샷, 헬스 상태 포함)</li>
 *   <li>ServiceRegistry - 서비스 이름 → 주소 (정적 설정 / DiscoveryClient)</li>
 *   <li>RoutingHealthChecker - 주기적 /actuator/health 프로브</li>
 *   <li>Redis Rate Limiting, Circuit Breaker + Fallback, GET 한정 재시도</li>
 *   <li>X-Request-Id 상관관계 헤더, Authorization 헤더 패스스루</li>
 *   <li>/order-summaries/{orderId} 집계 (주문 + 결제 내역)</li>
 * </ul>
 *
 * <h3>포트</h3>
 * Gateway: 8080 (모든 외부 요청은 여기로 진입)
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling
public class GatewayServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(GatewayServiceApplication.class, args);
    }
}
