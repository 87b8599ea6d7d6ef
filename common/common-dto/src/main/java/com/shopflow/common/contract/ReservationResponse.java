package com.shopflow.common.contract;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * 재고 예약 결과.
 *
 * @param orderId 예약을 소유한 주문 ID
 * @param state   RESERVED / RELEASED / NONE (예약이 없는 주문의 release 결과)
 * @param items   예약된 SKU별 수량 (SKU 오름차순)
 */
public record ReservationResponse(
        Long orderId,
        String state,
        List<LineItem> items
) {
    public static final String RESERVED = "RESERVED";
    public static final String RELEASED = "RELEASED";
    public static final String NONE = "NONE";

    @JsonIgnore
    public boolean isReserved() {
        return RESERVED.equals(state);
    }
}
