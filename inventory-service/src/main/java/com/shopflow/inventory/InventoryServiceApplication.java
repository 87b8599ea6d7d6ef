package com.shopflow.inventory;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * ShopFlow Inventory Service - 재고 마이크로서비스 진입점
 *
 * <h3>역할</h3>
 * SKU별 재고(StockItem)와 주문별 재고 예약(InventoryReservation)을 소유한다.
 * 예약은 주문 단위로 전부 성공하거나 전부 실패하며(all-or-nothing), 해제는 몇 번을 호출해도 결과가 같다.
 *
 * <h3>포트</h3>
 * Inventory Service: 8083
 */
@SpringBootApplication(scanBasePackages = {
        "com.shopflow.inventory",
        "com.shopflow.common.exception",
        "com.shopflow.common.outbox",
        "com.shopflow.common.resilience"
})
@ConfigurationPropertiesScan
@EnableScheduling  // Outbox Relay 폴링
public class InventoryServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(InventoryServiceApplication.class, args);
    }
}
