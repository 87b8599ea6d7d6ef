package com.shopflow.common.contract;

/** SKU 재고 조회 결과 */
public record StockResponse(String sku, int available) {
}
