package com.shopflow.common.contract;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * 재고 예약 요청 - Order Service → Inventory Service.
 *
 * <p>orderId 단위로 멱등: 같은 orderId로 다시 요청하면 기존 예약 결과가 반환된다.</p>
 */
public record ReserveInventoryRequest(
        @NotNull Long orderId,
        @NotEmpty List<@Valid LineItem> items
) {
}
