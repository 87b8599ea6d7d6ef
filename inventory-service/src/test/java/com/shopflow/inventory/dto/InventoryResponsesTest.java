package com.shopflow.inventory.dto;

import com.shopflow.common.contract.ReservationResponse;
import com.shopflow.inventory.entity.InventoryReservation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InventoryResponsesTest {

    @Test
    @DisplayName("예약이 없는 주문은 NONE")
    void reservation_None() {
        ReservationResponse response = InventoryResponses.reservation(1L, List.of());

        assertThat(response.state()).isEqualTo(ReservationResponse.NONE);
        assertThat(response.items()).isEmpty();
    }

    @Test
    @DisplayName("해제된 예약이 섞여 있으면 RELEASED")
    void reservation_Released() {
        InventoryReservation apple = InventoryReservation.builder().orderId(1L).sku("SKU-APPLE").quantity(1).build();
        InventoryReservation banana = InventoryReservation.builder().orderId(1L).sku("SKU-BANANA").quantity(2).build();
        apple.release();
        banana.release();

        ReservationResponse response = InventoryResponses.reservation(1L, List.of(apple, banana));

        assertThat(response.state()).isEqualTo(ReservationResponse.RELEASED);
        assertThat(response.isReserved()).isFalse();
        assertThat(response.items()).hasSize(2);
    }
}
