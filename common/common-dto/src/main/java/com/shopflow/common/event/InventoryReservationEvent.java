package com.shopflow.common.event;

import com.shopflow.common.contract.LineItem;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 재고 예약/해제 이벤트 (Outbox → inventoryEvents).
 * eventType "StockReserved" 또는 "ReservationReleased"로 저장된다.
 */
public record InventoryReservationEvent(
        Long orderId,
        String state,
        List<LineItem> items,
        LocalDateTime occurredAt
) {
}
