package com.shopflow.order.controller;

import com.shopflow.common.dto.ApiResponse;
import com.shopflow.order.dto.CreateOrderRequest;
import com.shopflow.order.dto.OrderResponse;
import com.shopflow.order.service.OrderService;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 주문 API 컨트롤러
 *
 * <p>POST /orders는 Saga가 끝난 뒤(PAID 또는 FAILED) 응답한다. 실패한 주문도 생성된 주문이므로 201이며,
 * 사유는 {@code failureReason}으로 전달된다.</p>
 *
 * <h3>적용된 트래픽 패턴</h3>
 * <ul>
 *   <li><b>@RateLimiter("orderApi")</b> - Gateway의 Redis Rate Limiting과 별개의 서비스 레벨 제한 (이중 방어)</li>
 *   <li><b>Idempotency-Key</b> - 같은 키의 재요청은 첫 요청이 만든 주문을 그대로 돌려받는다</li>
 * </ul>
 */
@RestController
@RequestMapping("/orders")
@RequiredArgsConstructor
public class OrderController {

    private final OrderService orderService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    @RateLimiter(name = "orderApi")
    public ApiResponse<OrderResponse> placeOrder(
            @RequestHeader(value = "Idempotency-Key", required = false) String idempotencyKey,
            @Valid @RequestBody CreateOrderRequest request) {
        return ApiResponse.ok(orderService.placeOrder(request.items(), request.amount(), idempotencyKey));
    }

    @GetMapping
    @RateLimiter(name = "orderApi")
    public ApiResponse<List<OrderResponse>> listOrders(
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size) {
        return ApiResponse.ok(orderService.listOrders(page, size));
    }

    @GetMapping("/{id}")
    public ApiResponse<OrderResponse> getOrder(@PathVariable Long id) {
        return ApiResponse.ok(orderService.getOrder(id));
    }

    /** 출고 (PAID → SHIPPED) */
    @PostMapping("/{id}/ship")
    public ApiResponse<OrderResponse> shipOrder(@PathVariable Long id) {
        return ApiResponse.ok(orderService.shipOrder(id));
    }

    /** 취소 (NEW에서만 가능) */
    @PostMapping("/{id}/cancel")
    public ApiResponse<OrderResponse> cancelOrder(@PathVariable Long id) {
        return ApiResponse.ok(orderService.cancelOrder(id));
    }
}
