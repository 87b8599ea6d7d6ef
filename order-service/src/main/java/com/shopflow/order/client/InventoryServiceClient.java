package com.shopflow.order.client;

import com.shopflow.common.contract.ReservationResponse;
import com.shopflow.common.contract.ReserveInventoryRequest;
import com.shopflow.common.dto.ApiResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;

/**
 * Inventory 서비스 Feign 클라이언트
 *
 * <p>두 호출 모두 orderId 기준 멱등이므로 ResilientCaller가 재시도해도 재고가 두 번 움직이지 않는다.
 * 4xx 응답은 {@link ServiceErrorDecoder}가 BusinessException(거절)으로 바꾼다.</p>
 *
 * @see com.shopflow.order.config.FeignConfig 타임아웃 설정
 */
@FeignClient(name = "inventory-service", url = "${inventory-service.url:http://localhost:8083}")
public interface InventoryServiceClient {

    @PostMapping("/inventory/reservations")
    ApiResponse<ReservationResponse> reserve(@RequestBody ReserveInventoryRequest request);

    @PostMapping("/inventory/reservations/{orderId}/release")
    ApiResponse<ReservationResponse> release(@PathVariable("orderId") Long orderId);
}
