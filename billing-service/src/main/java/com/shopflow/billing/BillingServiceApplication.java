package com.shopflow.billing;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * ShopFlow Billing Service - 결제 원장 마이크로서비스 진입점
 *
 * <h3>scanBasePackages 구성</h3>
 * <ul>
 *   <li>{@code com.shopflow.billing} - 결제 서비스 자체 컴포넌트</li>
 *   <li>{@code com.shopflow.common.exception} - 공통 예외 처리 (GlobalExceptionHandler)</li>
 *   <li>{@code com.shopflow.common.outbox} - ChargeRecorded 이벤트를 원장 기록과 같은 트랜잭션에 저장</li>
 *   <li>{@code com.shopflow.common.resilience} - Resilience4j 메트릭 등록</li>
 * </ul>
 *
 * <h3>포트</h3>
 * Billing Service: 8082
 */
@SpringBootApplication(scanBasePackages = {
        "com.shopflow.billing",
        "com.shopflow.common.exception",
        "com.shopflow.common.outbox",
        "com.shopflow.common.resilience"
})
@ConfigurationPropertiesScan
@EnableScheduling  // Outbox Relay 폴링
public class BillingServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(BillingServiceApplication.class, args);
    }
}
