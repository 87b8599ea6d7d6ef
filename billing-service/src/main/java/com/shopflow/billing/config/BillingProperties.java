package com.shopflow.billing.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

/**
 * 결제 판정 설정.
 *
 * @param approvalLimit 이 금액 이하만 승인 (초과분은 DECLINED). 미설정 시 10,000
 */
@ConfigurationProperties(prefix = "billing")
public record BillingProperties(BigDecimal approvalLimit) {

    private static final BigDecimal DEFAULT_APPROVAL_LIMIT = new BigDecimal("10000");

    public BillingProperties {
        if (approvalLimit == null) {
            approvalLimit = DEFAULT_APPROVAL_LIMIT;
        }
    }
}
