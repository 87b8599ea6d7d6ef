package com.shopflow.order.client;

import com.shopflow.common.contract.ChargeRequest;
import com.shopflow.common.contract.ChargeResponse;
import com.shopflow.common.dto.ApiResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;

/**
 * Billing 서비스 Feign 클라이언트. 멱등성 키는 요청 본문에 실어 보낸다.
 */
@FeignClient(name = "billing-service", url = "${billing-service.url:http://localhost:8082}")
public interface BillingServiceClient {

    @PostMapping("/billing/charge")
    ApiResponse<ChargeResponse> charge(@RequestBody ChargeRequest request);
}
