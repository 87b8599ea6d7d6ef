package com.shopflow.common.event;

import java.time.LocalDateTime;

/**
 * 주문 상태 변경 이벤트 (Outbox → orderEvents).
 * Saga의 모든 상태 전이마다 하나씩 기록된다.
 */
public record OrderStatusChangedEvent(
        Long orderId,
        String sagaId,
        String fromStatus,
        String toStatus,
        String reason,
        LocalDateTime occurredAt
) {
}
