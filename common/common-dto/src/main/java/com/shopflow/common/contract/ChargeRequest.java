package com.shopflow.common.contract;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.math.BigDecimal;

/**
 * 결제 요청 - Order Service → Billing Service.
 *
 * <p>idempotencyKey가 같은 요청은 몇 번을 보내도 하나의 ChargeRecord만 만든다.
 * Saga는 sagaId에서 파생한 고정 키를 사용하므로 재시도가 중복 결제로 이어지지 않는다.</p>
 */
public record ChargeRequest(
        @NotNull Long orderId,
        @NotNull @Positive BigDecimal amount,
        String idempotencyKey
) {
}
