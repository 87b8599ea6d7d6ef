package com.shopflow.inventory.dto;

import com.shopflow.common.contract.LineItem;
import com.shopflow.common.contract.ReservationResponse;
import com.shopflow.common.contract.StockResponse;
import com.shopflow.inventory.entity.InventoryReservation;
import com.shopflow.inventory.entity.StockItem;

import java.util.List;

/**
 * 엔티티 → 서비스 간 계약(common-dto) 변환.
 * 엔티티를 그대로 노출하지 않고 Order Service와 공유하는 record로만 응답한다.
 */
public final class InventoryResponses {

    private InventoryResponses() {
    }

    public static StockResponse stock(StockItem item) {
        return new StockResponse(item.getSku(), item.getAvailable());
    }

    /**
     * 예약 목록 → 주문 단위 예약 결과.
     * <ul>
     *   <li>예약 없음 → NONE</li>
     *   <li>모두 RESERVED → RESERVED</li>
     *   <li>그 외 (해제 완료) → RELEASED</li>
     * </ul>
     */
    public static ReservationResponse reservation(Long orderId, List<InventoryReservation> reservations) {
        if (reservations.isEmpty()) {
            return new ReservationResponse(orderId, ReservationResponse.NONE, List.of());
        }
        boolean allReserved = reservations.stream().allMatch(InventoryReservation::isReserved);
        List<LineItem> items = reservations.stream()
                .map(r -> new LineItem(r.getSku(), r.getQuantity()))
                .toList();
        return new ReservationResponse(orderId,
                allReserved ? ReservationResponse.RESERVED : ReservationResponse.RELEASED,
                items);
    }
}
