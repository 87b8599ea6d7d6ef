package com.shopflow.billing.controller;

import com.shopflow.billing.dto.ChargeResponses;
import com.shopflow.billing.service.BillingService;
import com.shopflow.common.contract.ChargeRequest;
import com.shopflow.common.contract.ChargeResponse;
import com.shopflow.common.dto.ApiResponse;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 결제 API 컨트롤러.
 *
 * <p>DECLINED 결제도 200 응답이다 (status 필드로 구분). 4xx는 요청 자체가 잘못된 경우에만 나간다.</p>
 *
 * <h3>멱등성 키 전달</h3>
 * 본문의 {@code idempotencyKey}가 우선이고, 없으면 {@code Idempotency-Key} 헤더를 사용한다.
 * 둘 다 없으면 요청마다 새 결제가 기록된다.
 */
@RestController
@RequestMapping("/billing")
@RequiredArgsConstructor
public class BillingController {

    private final BillingService billingService;

    @PostMapping("/charge")
    public ApiResponse<ChargeResponse> charge(
            @Valid @RequestBody ChargeRequest request,
            @RequestHeader(value = "Idempotency-Key", required = false) String idempotencyKeyHeader) {
        String key = request.idempotencyKey() != null ? request.idempotencyKey() : idempotencyKeyHeader;
        return ApiResponse.ok(ChargeResponses.from(
                billingService.charge(request.orderId(), request.amount(), key)));
    }

    @GetMapping("/charges")
    @RateLimiter(name = "billingApi")
    public ApiResponse<List<ChargeResponse>> listCharges(@RequestParam Long orderId) {
        return ApiResponse.ok(billingService.listCharges(orderId).stream()
                .map(ChargeResponses::from)
                .toList());
    }
}
