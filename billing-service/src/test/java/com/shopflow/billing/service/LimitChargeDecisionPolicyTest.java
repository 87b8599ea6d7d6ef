package com.shopflow.billing.service;

import com.shopflow.billing.config.BillingProperties;
import com.shopflow.billing.entity.ChargeStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class LimitChargeDecisionPolicyTest {

    private final LimitChargeDecisionPolicy policy =
            new LimitChargeDecisionPolicy(new BillingProperties(new BigDecimal("100.00")));

    @Test
    @DisplayName("한도 이하(경계 포함)는 승인, 초과는 거절")
    void decide() {
        assertThat(policy.decide(1L, new BigDecimal("100"))).isEqualTo(ChargeStatus.APPROVED);
        assertThat(policy.decide(1L, new BigDecimal("0.01"))).isEqualTo(ChargeStatus.APPROVED);
        assertThat(policy.decide(1L, new BigDecimal("100.01"))).isEqualTo(ChargeStatus.DECLINED);
    }

    @Test
    @DisplayName("한도 미설정 시 기본값 10000 적용")
    void defaultLimit() {
        assertThat(new BillingProperties(null).approvalLimit()).isEqualByComparingTo("10000");
    }
}
