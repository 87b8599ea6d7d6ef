package com.shopflow.billing.service;

import com.shopflow.billing.entity.ChargeStatus;

import java.math.BigDecimal;

/**
 * 결제 승인 여부 판정 (외부 PG 연동 지점).
 *
 * <p>구현체는 부수효과 없이 결과만 돌려준다. 기록은 {@link ChargeLedger}가 담당한다.</p>
 */
public interface ChargeDecisionPolicy {

    ChargeStatus decide(Long orderId, BigDecimal amount);
}
