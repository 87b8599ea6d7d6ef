package com.shopflow.billing.service;

import com.shopflow.billing.config.BillingProperties;
import com.shopflow.billing.entity.ChargeStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * 승인 한도 기반 판정 - amount ≤ billing.approval-limit 이면 APPROVED, 초과하면 DECLINED.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LimitChargeDecisionPolicy implements ChargeDecisionPolicy {

    private final BillingProperties billingProperties;

    @Override
    public ChargeStatus decide(Long orderId, BigDecimal amount) {
        if (amount.compareTo(billingProperties.approvalLimit()) <= 0) {
            return ChargeStatus.APPROVED;
        }
        log.info("Charge over approval limit: orderId={}, amount={}, limit={}",
                orderId, amount, billingProperties.approvalLimit());
        return ChargeStatus.DECLINED;
    }
}
