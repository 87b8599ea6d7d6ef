package com.shopflow.gateway.controller;

import com.shopflow.common.dto.ApiResponse;
import com.shopflow.gateway.aggregation.OrderSummary;
import com.shopflow.gateway.aggregation.OrderSummaryService;
import com.shopflow.gateway.filter.RequestIdFilter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * 주문 요약 API (Gateway 집계 엔드포인트)
 *
 * <pre>
 * GET /order-summaries/{orderId}
 *   → { order: {...}, charges: [...], billingAvailable: true|false }
 * </pre>
 */
@RestController
@RequiredArgsConstructor
public class OrderSummaryController {

    private final OrderSummaryService orderSummaryService;

    @GetMapping("/order-summaries/{orderId}")
    public Mono<ApiResponse<OrderSummary>> getSummary(
            @PathVariable Long orderId,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestHeader(value = RequestIdFilter.HEADER, required = false) String requestId) {
        return orderSummaryService.summarize(orderId, authorization, requestId)
                .map(ApiResponse::ok);
    }
}
