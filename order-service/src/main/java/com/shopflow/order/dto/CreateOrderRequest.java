package com.shopflow.order.dto;

import com.shopflow.common.contract.LineItem;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.math.BigDecimal;
import java.util.List;

/** 주문 생성 요청 */
public record CreateOrderRequest(
        @NotEmpty List<@Valid @NotNull LineItem> items,
        @NotNull @Positive BigDecimal amount
) {
}
