package com.shopflow.order;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.cloud.openfeign.EnableFeignClients;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * ShopFlow Order Service - 주문 마이크로서비스 + Saga 코디네이터 진입점
 *
 * <h3>역할</h3>
 * 주문(Order)과 주문별 Saga 로그(SagaState)를 소유하고,
 * 재고 예약 → 결제 → (실패 시) 예약 해제 흐름을 동기적으로 진행한다.
 * Inventory / Billing 호출은 모두 ResilientCaller(타임아웃 + 재시도 + 서킷 브레이커)를 거친다.
 *
 * <h3>scanBasePackages 구성</h3>
 * <ul>
 *   <li>{@code com.shopflow.order} - 주문 서비스 자체 컴포넌트</li>
 *   <li>{@code com.shopflow.common.exception} - 공통 예외 처리</li>
 *   <li>{@code com.shopflow.common.outbox} - 주문 상태 변경 이벤트 (Transactional Outbox)</li>
 *   <li>{@code com.shopflow.common.resilience} - ResilientCaller + Resilience4j 메트릭</li>
 * </ul>
 *
 * <h3>포트</h3>
 * Order Service: 8081
 */
@SpringBootApplication(scanBasePackages = {
        "com.shopflow.order",
        "com.shopflow.common.exception",
        "com.shopflow.common.outbox",
        "com.shopflow.common.resilience"
})
@EnableFeignClients            // OpenFeign: Inventory / Billing 서비스 HTTP 클라이언트
@ConfigurationPropertiesScan
@EnableScheduling              // Outbox Relay + Saga 복구 스케줄러
public class OrderServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(OrderServiceApplication.class, args);
    }
}
