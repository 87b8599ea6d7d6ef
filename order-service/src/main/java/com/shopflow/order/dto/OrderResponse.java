package com.shopflow.order.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.shopflow.common.contract.LineItem;
import com.shopflow.order.entity.Order;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 주문 응답. 엔티티를 그대로 노출하지 않는다 (지연 로딩 프록시, version 등).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OrderResponse(
        Long id,
        String status,
        BigDecimal amount,
        List<LineItem> items,
        String failureReason,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
    public static OrderResponse from(Order order) {
        return new OrderResponse(
                order.getId(),
                order.getStatus().name(),
                order.getAmount(),
                order.getItems().stream()
                        .map(item -> new LineItem(item.getSku(), item.getQuantity()))
                        .toList(),
                order.getFailureReason(),
                order.getCreatedAt(),
                order.getUpdatedAt());
    }
}
