package com.shopflow.gateway.aggregation;

import com.fasterxml.jackson.databind.JsonNode;
import com.shopflow.common.contract.ChargeResponse;

import java.util.List;

/**
 * 주문 + 결제 내역 집계 응답.
 *
 * @param order            Order Service의 주문 응답 (data 부분 그대로)
 * @param charges          Billing Service의 결제 기록 (billing 실패 시 빈 목록)
 * @param billingAvailable billing 조회 성공 여부
 */
public record OrderSummary(
        JsonNode order,
        List<ChargeResponse> charges,
        boolean billingAvailable
) {
}
