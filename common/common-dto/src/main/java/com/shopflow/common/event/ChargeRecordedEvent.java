package com.shopflow.common.event;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/** 결제 기록 이벤트 (Outbox → billingEvents) */
public record ChargeRecordedEvent(
        Long orderId,
        BigDecimal amount,
        String status,
        String referenceId,
        LocalDateTime recordedAt
) {
}
