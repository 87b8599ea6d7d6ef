package com.shopflow.inventory.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.Map;

/**
 * 시작 시 적재할 초기 재고.
 *
 * <pre>
 * inventory:
 *   seed:
 *     enabled: true
 *     stock:
 *       SKU-APPLE: 100
 * </pre>
 */
@ConfigurationProperties(prefix = "inventory.seed")
public record InventorySeedProperties(boolean enabled, Map<String, Integer> stock) {

    public InventorySeedProperties {
        stock = stock == null ? Map.of() : Map.copyOf(stock);
    }
}
