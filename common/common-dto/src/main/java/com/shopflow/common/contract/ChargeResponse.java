package com.shopflow.common.contract;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 결제 결과. DECLINED는 에러가 아닌 정상 응답(200)으로 전달된다.
 *
 * @param status      APPROVED / DECLINED
 * @param referenceId Billing이 발급한 결제 참조 ID
 */
public record ChargeResponse(
        Long orderId,
        BigDecimal amount,
        String status,
        String referenceId,
        String idempotencyKey,
        LocalDateTime createdAt
) {
    public static final String APPROVED = "APPROVED";
    public static final String DECLINED = "DECLINED";

    @JsonIgnore
    public boolean isApproved() {
        return APPROVED.equals(status);
    }
}
