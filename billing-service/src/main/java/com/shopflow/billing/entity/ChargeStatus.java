package com.shopflow.billing.entity;

/**
 * 결제 판정 결과. 기록된 뒤에는 바뀌지 않는다.
 */
public enum ChargeStatus {
    APPROVED,
    DECLINED
}
