package com.shopflow.common.exception;

/**
 * 서비스 간 정합성 위반 (Invariant Violation)
 *
 * <p>예: 승인된 결제 응답의 주문 ID나 금액이 요청과 다르거나,
 * 재고 예약이 확인되지 않은 주문에 결제 승인이 도착한 경우.
 * 재시도하지 않으며, 발생 즉시 운영 알림 대상으로 로깅된다.</p>
 */
public class InvariantViolationException extends RuntimeException {

    public InvariantViolationException(String message) {
        super(message);
    }
}
