package com.shopflow.order.service;

import com.shopflow.common.contract.LineItem;
import com.shopflow.common.event.OrderStatusChangedEvent;
import com.shopflow.common.exception.BusinessException;
import com.shopflow.common.exception.ErrorCode;
import com.shopflow.common.exception.InvariantViolationException;
import com.shopflow.common.outbox.OutboxService;
import com.shopflow.order.entity.Order;
import com.shopflow.order.entity.OrderStatus;
import com.shopflow.order.entity.SagaState;
import com.shopflow.order.entity.SagaStatus;
import com.shopflow.order.repository.OrderRepository;
import com.shopflow.order.repository.SagaStateRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class OrderTransitionServiceTest {

    @Mock
    private OrderRepository orderRepository;

    @Mock
    private SagaStateRepository sagaStateRepository;

    @Mock
    private OutboxService outboxService;

    @InjectMocks
    private OrderTransitionService transitions;

    private Order persistedOrder(Long id) {
        Order order = Order.builder().amount(new BigDecimal("10.00")).build();
        ReflectionTestUtils.setField(order, "id", id);
        given(orderRepository.findWithItemsById(id)).willReturn(Optional.of(order));
        return order;
    }

    private SagaState persistedSaga(Long orderId) {
        SagaState saga = SagaState.builder().sagaId("saga-" + orderId).orderId(orderId).build();
        given(sagaStateRepository.findByOrderId(orderId)).willReturn(Optional.of(saga));
        return saga;
    }

    @Test
    @DisplayName("주문 생성 - NEW 주문 + STARTED Saga + 생성 이벤트를 함께 저장")
    void open_PersistsOrderSagaAndEvent() {
        // Given
        given(orderRepository.saveAndFlush(any(Order.class))).willAnswer(invocation -> {
            Order order = invocation.getArgument(0);
            ReflectionTestUtils.setField(order, "id", 1L);
            return order;
        });

        // When
        Order order = transitions.open(List.of(new LineItem("X", 2)), new BigDecimal("10.00"), "key-1");

        // Then
        assertThat(order.getStatus()).isEqualTo(OrderStatus.NEW);
        assertThat(order.getItems()).hasSize(1);
        ArgumentCaptor<SagaState> saga = ArgumentCaptor.forClass(SagaState.class);
        verify(sagaStateRepository).save(saga.capture());
        assertThat(saga.getValue().getStatus()).isEqualTo(SagaStatus.STARTED);
        assertThat(saga.getValue().getChargeIdempotencyKey()).isEqualTo("charge-" + saga.getValue().getSagaId());

        ArgumentCaptor<Object> event = ArgumentCaptor.forClass(Object.class);
        verify(outboxService).saveEvent(eq("Order"), eq("1"), eq("OrderStatusChanged"), event.capture());
        assertThat(((OrderStatusChangedEvent) event.getValue()).toStatus()).isEqualTo("NEW");
    }

    @Test
    @DisplayName("예약이 확인되지 않은 주문에 결제 승인이 오면 InvariantViolationException")
    void markPaid_WithoutReservation() {
        // Given
        Order order = persistedOrder(2L);
        persistedSaga(2L);
        order.transitionTo(OrderStatus.RESERVING);
        order.transitionTo(OrderStatus.RESERVED);
        order.transitionTo(OrderStatus.CHARGING);

        // When & Then
        assertThatThrownBy(() -> transitions.markPaid(2L, "ch_1"))
                .isInstanceOf(InvariantViolationException.class);
        assertThat(order.getStatus()).isEqualTo(OrderStatus.CHARGING);
    }

    @Test
    @DisplayName("이미 FAILED인 주문의 실패 확정은 그대로 반환 (중복 보상 완료 허용)")
    void markFailed_Twice() {
        // Given
        Order order = persistedOrder(3L);
        persistedSaga(3L);
        order.transitionTo(OrderStatus.RESERVING);

        // When
        transitions.markFailed(3L, "Inventory unavailable");
        Order again = transitions.markFailed(3L, "Inventory unavailable");

        // Then
        assertThat(again.getStatus()).isEqualTo(OrderStatus.FAILED);
        assertThat(again.getFailureReason()).isEqualTo("Inventory unavailable");
    }

    @Test
    @DisplayName("PAID가 아닌 주문의 출고는 INVALID_ORDER_STATUS")
    void ship_NotPaid() {
        persistedOrder(4L);

        assertThatThrownBy(() -> transitions.ship(4L))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.INVALID_ORDER_STATUS));
    }

    @Test
    @DisplayName("NEW 주문 취소 - CANCELED + Saga 종료")
    void cancel_New() {
        // Given
        persistedOrder(5L);
        SagaState saga = persistedSaga(5L);

        // When
        Order order = transitions.cancel(5L);

        // Then
        assertThat(order.getStatus()).isEqualTo(OrderStatus.CANCELED);
        assertThat(saga.getStatus()).isEqualTo(SagaStatus.FAILED);
    }
}
