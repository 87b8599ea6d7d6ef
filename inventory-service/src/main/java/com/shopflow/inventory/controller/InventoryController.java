package com.shopflow.inventory.controller;

import com.shopflow.common.contract.ReservationResponse;
import com.shopflow.common.contract.ReserveInventoryRequest;
import com.shopflow.common.contract.StockResponse;
import com.shopflow.common.dto.ApiResponse;
import com.shopflow.inventory.dto.InventoryResponses;
import com.shopflow.inventory.dto.RestockRequest;
import com.shopflow.inventory.service.InventoryService;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

/**
 * 재고 API 컨트롤러.
 *
 * <p>예약 / 해제는 Order Service의 Saga 코디네이터가 Resilience Wrapper를 거쳐 호출한다.
 * 두 API 모두 orderId 기준 멱등이므로 타임아웃 후 재시도해도 재고가 두 번 움직이지 않는다.</p>
 *
 * <h3>적용된 트래픽 패턴</h3>
 * <ul>
 *   <li><b>@RateLimiter("inventoryApi")</b> - 조회/입고 API 호출 빈도 제한.
 *       Saga 경로(예약/해제)는 제한하지 않는다 - 거절되면 보상이 늘어날 뿐이다.</li>
 * </ul>
 */
@RestController
@RequestMapping("/inventory")
@RequiredArgsConstructor
public class InventoryController {

    private final InventoryService inventoryService;

    @GetMapping("/{sku}")
    @RateLimiter(name = "inventoryApi")
    public ApiResponse<StockResponse> check(@PathVariable String sku) {
        return ApiResponse.ok(InventoryResponses.stock(inventoryService.check(sku)));
    }

    /** 주문 단위 재고 예약 (all-or-nothing, 재요청 시 기존 예약 반환) */
    @PostMapping("/reservations")
    public ApiResponse<ReservationResponse> reserve(@Valid @RequestBody ReserveInventoryRequest request) {
        return ApiResponse.ok(InventoryResponses.reservation(request.orderId(),
                inventoryService.reserve(request.orderId(), request.items())));
    }

    /** 예약 해제 - 이미 해제됐거나 예약이 없어도 성공 */
    @PostMapping("/reservations/{orderId}/release")
    public ApiResponse<ReservationResponse> release(@PathVariable Long orderId) {
        return ApiResponse.ok(InventoryResponses.reservation(orderId, inventoryService.release(orderId)));
    }

    @GetMapping("/reservations/{orderId}")
    @RateLimiter(name = "inventoryApi")
    public ApiResponse<ReservationResponse> getReservations(@PathVariable Long orderId) {
        return ApiResponse.ok(InventoryResponses.reservation(orderId, inventoryService.getReservations(orderId)));
    }

    @PostMapping("/{sku}/restock")
    @RateLimiter(name = "inventoryApi")
    public ApiResponse<StockResponse> restock(@PathVariable String sku,
                                              @Valid @RequestBody RestockRequest request) {
        return ApiResponse.ok(InventoryResponses.stock(inventoryService.restock(sku, request.quantity())));
    }
}
