package com.shopflow.order.entity;

/**
 * Saga 상태
 *
 * <pre>
 * 정상 흐름:   STARTED → COMPLETED                (결제 승인, 주문 PAID)
 * 거절:       STARTED → FAILED                   (재고 부족 등 - 되돌릴 것이 없음)
 * 보상 흐름:   STARTED → COMPENSATING → FAILED    (예약 해제 후 주문 FAILED)
 * </pre>
 *
 * COMPENSATING에서 멈춘 Saga는 예약 해제가 아직 전달되지 않은 것이다. 복구 스케줄러가 다시 시도한다.
 */
public enum SagaStatus {
    STARTED,        // 진행 중
    COMPENSATING,   // 예약 해제 진행 중 (해제 성공 전까지 주문은 FAILED가 아니다)
    COMPLETED,      // 주문 PAID
    FAILED          // 종료 (거절 또는 보상 완료)
}
