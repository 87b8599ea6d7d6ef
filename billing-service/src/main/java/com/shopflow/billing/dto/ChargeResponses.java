package com.shopflow.billing.dto;

import com.shopflow.billing.entity.ChargeRecord;
import com.shopflow.common.contract.ChargeResponse;

/** ChargeRecord → ChargeResponse (Order Service와 공유하는 계약) */
public final class ChargeResponses {

    private ChargeResponses() {
    }

    public static ChargeResponse from(ChargeRecord record) {
        return new ChargeResponse(
                record.getOrderId(),
                record.getAmount(),
                record.getStatus().name(),
                record.getReferenceId(),
                record.getIdempotencyKey(),
                record.getCreatedAt());
    }
}
