package com.shopflow.order.entity;

import java.util.Set;

/**
 * 주문 상태 - Saga 진행에 따른 상태 전이
 *
 * <h3>상태 전이 다이어그램</h3>
 * <pre>
 * NEW → RESERVING → RESERVED → CHARGING → PAID → SHIPPED   (정상 흐름)
 *  │        │           │          │
 *  │        └───────────┴──────────┴──→ FAILED             (거절 / 보상 완료)
 *  └──→ CANCELED                                           (고객 취소, NEW에서만)
 * </pre>
 *
 * 종료 상태: SHIPPED, CANCELED, FAILED
 */
public enum OrderStatus {

    NEW(Set.of("RESERVING", "CANCELED")),
    RESERVING(Set.of("RESERVED", "FAILED")),
    RESERVED(Set.of("CHARGING", "FAILED")),
    CHARGING(Set.of("PAID", "FAILED")),
    PAID(Set.of("SHIPPED")),
    SHIPPED(Set.of()),
    CANCELED(Set.of()),
    FAILED(Set.of());

    private final Set<String> validTransitions;

    OrderStatus(Set<String> validTransitions) {
        this.validTransitions = validTransitions;
    }

    public boolean canTransitionTo(OrderStatus target) {
        return validTransitions.contains(target.name());
    }

    public boolean isTerminal() {
        return validTransitions.isEmpty();
    }
}
