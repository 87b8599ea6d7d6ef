package com.shopflow.common.contract;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

/**
 * 주문 항목 한 줄 (SKU + 수량).
 * Order 요청, Inventory 예약 요청/응답이 같은 형태를 공유한다.
 */
public record LineItem(
        @NotBlank String sku,
        @Positive int quantity
) {
}
