package com.shopflow.inventory.config;

import com.shopflow.inventory.entity.StockItem;
import com.shopflow.inventory.repository.StockItemRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;

/**
 * Stock Seed Runner - 서비스 시작 시 설정된 초기 재고를 적재한다.
 *
 * <pre>
 * 1. ApplicationRunner.run() (트래픽 수신 전)
 * 2. inventory.seed.stock 항목마다 SKU 존재 여부 확인
 * 3. 없는 SKU만 생성 - 이미 있는 재고 수량은 덮어쓰지 않는다 (재시작 안전)
 * </pre>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StockSeedRunner implements ApplicationRunner {

    private final InventorySeedProperties seedProperties;
    private final StockItemRepository stockItemRepository;

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        if (!seedProperties.enabled() || seedProperties.stock().isEmpty()) {
            log.info("Stock seeding skipped");
            return;
        }

        int created = 0;
        for (Map.Entry<String, Integer> entry : seedProperties.stock().entrySet()) {
            if (stockItemRepository.existsBySku(entry.getKey())) {
                continue;
            }
            stockItemRepository.save(StockItem.builder()
                    .sku(entry.getKey())
                    .available(entry.getValue())
                    .build());
            created++;
        }

        log.info("Stock seeding completed: created={}, configured={}", created, seedProperties.stock().size());
    }
}
