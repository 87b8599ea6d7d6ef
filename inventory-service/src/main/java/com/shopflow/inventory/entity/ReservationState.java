package com.shopflow.inventory.entity;

/**
 * 재고 예약 상태.
 * <pre>
 * RESERVED → RELEASED (보상 또는 주문 실패 시, 되돌릴 수 없음)
 * </pre>
 */
public enum ReservationState {
    RESERVED,
    RELEASED
}
