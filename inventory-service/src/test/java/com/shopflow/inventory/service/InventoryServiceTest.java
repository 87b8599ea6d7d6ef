package com.shopflow.inventory.service;

import com.shopflow.common.contract.LineItem;
import com.shopflow.common.exception.BusinessException;
import com.shopflow.common.exception.ErrorCode;
import com.shopflow.common.outbox.OutboxService;
import com.shopflow.inventory.entity.InventoryReservation;
import com.shopflow.inventory.entity.OrderReservation;
import com.shopflow.inventory.entity.ReservationState;
import com.shopflow.inventory.entity.StockItem;
import com.shopflow.inventory.repository.InventoryReservationRepository;
import com.shopflow.inventory.repository.OrderReservationRepository;
import com.shopflow.inventory.repository.StockItemRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class InventoryServiceTest {

    @Mock
    private StockItemRepository stockItemRepository;

    @Mock
    private InventoryReservationRepository reservationRepository;

    @Mock
    private OrderReservationRepository orderReservationRepository;

    @Mock
    private OutboxService outboxService;

    @InjectMocks
    private InventoryService inventoryService;

    @Test
    @DisplayName("예약 성공 - SKU 오름차순으로 잠그고, 중복 SKU는 합산해 차감")
    void reserve_Success() {
        // Given
        StockItem banana = StockItem.builder().sku("SKU-BANANA").available(10).build();
        StockItem apple = StockItem.builder().sku("SKU-APPLE").available(10).build();
        given(stockItemRepository.findBySkuForUpdate("SKU-APPLE")).willReturn(Optional.of(apple));
        given(stockItemRepository.findBySkuForUpdate("SKU-BANANA")).willReturn(Optional.of(banana));
        given(orderReservationRepository.findByOrderIdForUpdate(1L)).willReturn(Optional.empty());
        given(reservationRepository.saveAll(anyList())).willAnswer(invocation -> invocation.getArgument(0));

        // When
        List<InventoryReservation> result = inventoryService.reserve(1L, List.of(
                new LineItem("SKU-BANANA", 2),
                new LineItem("SKU-APPLE", 3),
                new LineItem("SKU-BANANA", 1)));

        // Then
        InOrder lockOrder = inOrder(orderReservationRepository, stockItemRepository);
        lockOrder.verify(orderReservationRepository).findByOrderIdForUpdate(1L);
        lockOrder.verify(orderReservationRepository).saveAndFlush(argThat((OrderReservation header) -> !header.isReleased()));
        lockOrder.verify(stockItemRepository).findBySkuForUpdate("SKU-APPLE");
        lockOrder.verify(stockItemRepository).findBySkuForUpdate("SKU-BANANA");

        assertThat(result).extracting(InventoryReservation::getSku, InventoryReservation::getQuantity)
                .containsExactly(
                        tuple("SKU-APPLE", 3),
                        tuple("SKU-BANANA", 3));
        assertThat(result).allMatch(InventoryReservation::isReserved);
        assertThat(apple.getAvailable()).isEqualTo(7);
        assertThat(banana.getAvailable()).isEqualTo(7);
        verify(outboxService).saveEvent(eq("InventoryReservation"), eq("1"), eq("StockReserved"), any());
    }

    @Test
    @DisplayName("한 SKU라도 부족하면 아무 재고도 차감하지 않고 거절 (all-or-nothing)")
    void reserve_InsufficientStock_NothingWritten() {
        // Given
        StockItem apple = StockItem.builder().sku("SKU-APPLE").available(10).build();
        StockItem cherry = StockItem.builder().sku("SKU-CHERRY").available(1).build();
        given(stockItemRepository.findBySkuForUpdate("SKU-APPLE")).willReturn(Optional.of(apple));
        given(stockItemRepository.findBySkuForUpdate("SKU-CHERRY")).willReturn(Optional.of(cherry));
        given(orderReservationRepository.findByOrderIdForUpdate(2L)).willReturn(Optional.empty());

        // When & Then
        assertThatThrownBy(() -> inventoryService.reserve(2L, List.of(
                new LineItem("SKU-APPLE", 5),
                new LineItem("SKU-CHERRY", 2))))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.INSUFFICIENT_STOCK))
                .hasMessageContaining("SKU-CHERRY");

        assertThat(apple.getAvailable()).isEqualTo(10);
        assertThat(cherry.getAvailable()).isEqualTo(1);
        verify(reservationRepository, never()).saveAll(anyList());
        verifyNoInteractions(outboxService);
    }

    @Test
    @DisplayName("존재하지 않는 SKU 예약 요청은 UNKNOWN_SKU로 거절")
    void reserve_UnknownSku() {
        // Given
        given(stockItemRepository.findBySkuForUpdate("SKU-NOPE")).willReturn(Optional.empty());

        // When & Then
        assertThatThrownBy(() -> inventoryService.reserve(3L, List.of(new LineItem("SKU-NOPE", 1))))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.UNKNOWN_SKU));
        verify(reservationRepository, never()).saveAll(anyList());
    }

    @Test
    @DisplayName("같은 주문의 재요청은 기존 예약을 그대로 반환하고 재고를 다시 차감하지 않음")
    void reserve_Replay_ReturnsExisting() {
        // Given
        InventoryReservation existing = InventoryReservation.builder().orderId(4L).sku("SKU-APPLE").quantity(3).build();
        given(orderReservationRepository.findByOrderIdForUpdate(4L))
                .willReturn(Optional.of(OrderReservation.reserved(4L)));
        given(reservationRepository.findByOrderIdOrderBySkuAsc(4L)).willReturn(List.of(existing));

        // When
        List<InventoryReservation> result = inventoryService.reserve(4L, List.of(new LineItem("SKU-APPLE", 3)));

        // Then
        assertThat(result).containsExactly(existing);
        verifyNoInteractions(stockItemRepository);
        verify(orderReservationRepository, never()).saveAndFlush(any());
        verify(reservationRepository, never()).saveAll(anyList());
        verifyNoInteractions(outboxService);
    }

    @Test
    @DisplayName("이미 해제된 주문에 대한 예약 요청은 거절")
    void reserve_AfterRelease_Rejected() {
        // Given
        OrderReservation header = OrderReservation.reserved(5L);
        header.release();
        given(orderReservationRepository.findByOrderIdForUpdate(5L)).willReturn(Optional.of(header));

        // When & Then
        assertThatThrownBy(() -> inventoryService.reserve(5L, List.of(new LineItem("SKU-APPLE", 3))))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.RESERVATION_RELEASED));
        verifyNoInteractions(stockItemRepository, reservationRepository, outboxService);
    }

    @Test
    @DisplayName("수량이 0 이하인 항목은 DB를 건드리기 전에 INVALID_INPUT")
    void reserve_InvalidQuantity() {
        assertThatThrownBy(() -> inventoryService.reserve(6L, List.of(new LineItem("SKU-APPLE", 0))))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.INVALID_INPUT));
        verifyNoInteractions(stockItemRepository, reservationRepository, orderReservationRepository, outboxService);
    }

    @Test
    @DisplayName("해제 - RESERVED 예약을 RELEASED로 바꾸고 재고 복원")
    void release_RestoresStock() {
        // Given
        StockItem apple = StockItem.builder().sku("SKU-APPLE").available(7).build();
        InventoryReservation reservation = InventoryReservation.builder().orderId(7L).sku("SKU-APPLE").quantity(3).build();
        OrderReservation header = OrderReservation.reserved(7L);
        given(orderReservationRepository.findByOrderIdForUpdate(7L)).willReturn(Optional.of(header));
        given(reservationRepository.findByOrderIdForUpdate(7L)).willReturn(List.of(reservation));
        given(stockItemRepository.findBySkuForUpdate("SKU-APPLE")).willReturn(Optional.of(apple));

        // When
        inventoryService.release(7L);

        // Then
        assertThat(reservation.getState()).isEqualTo(ReservationState.RELEASED);
        assertThat(header.isReleased()).isTrue();
        assertThat(apple.getAvailable()).isEqualTo(10);
        verify(outboxService).saveEvent(eq("InventoryReservation"), eq("7"), eq("ReservationReleased"), any());
    }

    @Test
    @DisplayName("해제 재요청은 재고를 다시 복원하지 않는 no-op")
    void release_Twice_IsIdempotent() {
        // Given
        InventoryReservation reservation = InventoryReservation.builder().orderId(8L).sku("SKU-APPLE").quantity(3).build();
        reservation.release();
        OrderReservation header = OrderReservation.reserved(8L);
        header.release();
        given(orderReservationRepository.findByOrderIdForUpdate(8L)).willReturn(Optional.of(header));
        given(reservationRepository.findByOrderIdForUpdate(8L)).willReturn(List.of(reservation));

        // When
        List<InventoryReservation> result = inventoryService.release(8L);

        // Then
        assertThat(result).containsExactly(reservation);
        verify(stockItemRepository, never()).findBySkuForUpdate(anyString());
        verifyNoInteractions(outboxService);
    }

    @Test
    @DisplayName("예약이 없는 주문의 해제도 성공하고, 해제 표식(RELEASED 헤더)을 남김")
    void release_UnknownOrder_RecordsTombstone() {
        given(orderReservationRepository.findByOrderIdForUpdate(9L)).willReturn(Optional.empty());

        assertThat(inventoryService.release(9L)).isEmpty();

        verify(orderReservationRepository).saveAndFlush(argThat((OrderReservation header) ->
                header.getOrderId().equals(9L) && header.isReleased()));
        verifyNoInteractions(stockItemRepository, reservationRepository, outboxService);
    }

    @Test
    @DisplayName("해제가 먼저 도착한 주문에 뒤늦은 예약이 오면 재고를 건드리지 않고 거절")
    void release_ThenLateReserve_Rejected() {
        // Given - 헤더 저장소를 실제 테이블처럼 동작시킨다
        Map<Long, OrderReservation> headers = new HashMap<>();
        given(orderReservationRepository.findByOrderIdForUpdate(anyLong()))
                .willAnswer(invocation -> Optional.ofNullable(headers.get(invocation.<Long>getArgument(0))));
        given(orderReservationRepository.saveAndFlush(any(OrderReservation.class)))
                .willAnswer(invocation -> {
                    OrderReservation header = invocation.getArgument(0);
                    headers.put(header.getOrderId(), header);
                    return header;
                });

        // When
        inventoryService.release(7L);

        // Then
        assertThatThrownBy(() -> inventoryService.reserve(7L, List.of(new LineItem("SKU-APPLE", 1))))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.RESERVATION_RELEASED));
        verifyNoInteractions(stockItemRepository, outboxService);
        verify(reservationRepository, never()).saveAll(anyList());
    }

    @Test
    @DisplayName("예약 조회 - 예약이 없으면 RESERVATION_NOT_FOUND")
    void getReservations_NotFound() {
        given(reservationRepository.findByOrderIdOrderBySkuAsc(10L)).willReturn(List.of());

        assertThatThrownBy(() -> inventoryService.getReservations(10L))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.RESERVATION_NOT_FOUND));
    }

    @Test
    @DisplayName("입고 - 기존 SKU는 수량을 더하고, 없는 SKU는 새로 생성")
    void restock() {
        // Given
        StockItem apple = StockItem.builder().sku("SKU-APPLE").available(1).build();
        given(stockItemRepository.findBySkuForUpdate("SKU-APPLE")).willReturn(Optional.of(apple));
        given(stockItemRepository.findBySkuForUpdate("SKU-DURIAN")).willReturn(Optional.empty());
        given(stockItemRepository.save(any(StockItem.class))).willAnswer(invocation -> invocation.getArgument(0));

        // When
        StockItem restocked = inventoryService.restock("SKU-APPLE", 4);
        StockItem created = inventoryService.restock("SKU-DURIAN", 12);

        // Then
        assertThat(restocked.getAvailable()).isEqualTo(5);
        assertThat(created.getSku()).isEqualTo("SKU-DURIAN");
        assertThat(created.getAvailable()).isEqualTo(12);
    }

    @Test
    @DisplayName("재고 조회 - 없는 SKU는 SKU_NOT_FOUND")
    void check_NotFound() {
        given(stockItemRepository.findBySku("SKU-NOPE")).willReturn(Optional.empty());

        assertThatThrownBy(() -> inventoryService.check("SKU-NOPE"))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.SKU_NOT_FOUND));
    }
}
