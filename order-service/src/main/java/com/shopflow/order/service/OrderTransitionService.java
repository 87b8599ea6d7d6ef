package com.shopflow.order.service;

import com.shopflow.common.contract.LineItem;
import com.shopflow.common.event.OrderStatusChangedEvent;
import com.shopflow.common.exception.BusinessException;
import com.shopflow.common.exception.ErrorCode;
import com.shopflow.common.exception.InvariantViolationException;
import com.shopflow.common.outbox.OutboxService;
import com.shopflow.order.entity.Order;
import com.shopflow.order.entity.OrderItem;
import com.shopflow.order.entity.OrderStatus;
import com.shopflow.order.entity.SagaState;
import com.shopflow.order.entity.SagaStatus;
import com.shopflow.order.repository.OrderRepository;
import com.shopflow.order.repository.SagaStateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * 주문 상태 전이 - Saga 한 단계마다 하나의 로컬 트랜잭션
 *
 * <p>각 메서드는 [주문 상태 변경 + SagaState 갱신 + OrderStatusChanged Outbox 이벤트]를 한 트랜잭션에 묶는다.
 * 네트워크 호출은 여기서 하지 않는다. 호출은 트랜잭션 밖의 {@code OrderSagaOrchestrator}가 담당하므로
 * 하위 서비스가 느려도 DB 커넥션을 붙잡지 않는다.</p>
 *
 * <p>반환되는 Order는 항목까지 로딩된 상태(Fetch Join)라 트랜잭션 밖에서 읽어도 된다.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional
public class OrderTransitionService {

    private static final String AGGREGATE_TYPE = "Order";

    private final OrderRepository orderRepository;
    private final SagaStateRepository sagaStateRepository;
    private final OutboxService outboxService;

    /** 주문(NEW) + SagaState(STARTED) + 생성 이벤트 */
    public Order open(List<LineItem> items, BigDecimal amount, String requestKey) {
        Order order = Order.builder()
                .amount(amount)
                .requestKey(requestKey)
                .build();
        for (LineItem item : items) {
            order.addItem(OrderItem.builder()
                    .sku(item.sku())
                    .quantity(item.quantity())
                    .build());
        }
        order = orderRepository.saveAndFlush(order);

        String sagaId = UUID.randomUUID().toString();
        sagaStateRepository.save(SagaState.builder()
                .sagaId(sagaId)
                .orderId(order.getId())
                .build());

        publish(order, sagaId, null, null);
        log.info("Saga started: sagaId={}, orderId={}, amount={}", sagaId, order.getId(), amount);
        return order;
    }

    @Transactional(readOnly = true)
    public Order loadOrder(Long orderId) {
        return orderRepository.findWithItemsById(orderId)
                .orElseThrow(() -> new BusinessException(ErrorCode.ORDER_NOT_FOUND, "Order not found: " + orderId));
    }

    @Transactional(readOnly = true)
    public SagaState loadSaga(Long orderId) {
        return sagaStateRepository.findByOrderId(orderId)
                .orElseThrow(() -> new IllegalStateException("Saga not found for order " + orderId));
    }

    /**
     * 다음 단계 진입 (NEW → RESERVING, RESERVED → CHARGING).
     * 이미 목표 상태면 그대로 둔다 - 복구 시 같은 단계를 다시 시작하는 경우.
     */
    public Order advance(Long orderId, OrderStatus target) {
        Order order = loadOrder(orderId);
        if (order.getStatus() == target) {
            return order;
        }
        SagaState saga = loadSaga(orderId);
        OrderStatus from = order.transitionTo(target);
        saga.advanceStep(target.name());
        publish(order, saga.getSagaId(), from, null);
        return order;
    }

    /** Inventory가 RESERVED를 확인해 줌 */
    public Order markReserved(Long orderId) {
        Order order = loadOrder(orderId);
        SagaState saga = loadSaga(orderId);
        OrderStatus from = order.transitionTo(OrderStatus.RESERVED);
        saga.confirmReservation();
        publish(order, saga.getSagaId(), from, null);
        log.info("Inventory reserved: sagaId={}, orderId={}", saga.getSagaId(), orderId);
        return order;
    }

    /**
     * 결제 승인 → PAID. 예약이 확인되지 않은 주문이면 InvariantViolationException (트랜잭션 롤백).
     */
    public Order markPaid(Long orderId, String referenceId) {
        Order order = loadOrder(orderId);
        SagaState saga = loadSaga(orderId);
        if (!saga.isReservationConfirmed()) {
            throw new InvariantViolationException(
                    "Approved charge " + referenceId + " for order " + orderId + " without a confirmed reservation");
        }
        OrderStatus from = order.transitionTo(OrderStatus.PAID);
        saga.complete();
        publish(order, saga.getSagaId(), from, null);
        log.info("Saga completed: sagaId={}, orderId={}, referenceId={}", saga.getSagaId(), orderId, referenceId);
        return order;
    }

    /** 보상 시작 - 주문 상태는 예약 해제가 확인될 때까지 그대로 둔다 */
    public void beginCompensation(Long orderId, String reason) {
        SagaState saga = loadSaga(orderId);
        if (saga.getStatus() != SagaStatus.COMPENSATING) {
            saga.startCompensation(reason);
            log.warn("Saga compensating: sagaId={}, orderId={}, reason={}", saga.getSagaId(), orderId, reason);
        }
    }

    /** 주문 FAILED 확정 + Saga 종료. 이미 FAILED면 그대로 반환 */
    public Order markFailed(Long orderId, String reason) {
        Order order = loadOrder(orderId);
        SagaState saga = loadSaga(orderId);
        if (order.getStatus() == OrderStatus.FAILED) {
            return order;
        }
        OrderStatus from = order.fail(reason);
        saga.fail(reason);
        publish(order, saga.getSagaId(), from, reason);
        log.warn("Saga failed: sagaId={}, orderId={}, reason={}", saga.getSagaId(), orderId, reason);
        return order;
    }

    /** 외부 이벤트: 출고 (PAID → SHIPPED) */
    public Order ship(Long orderId) {
        Order order = loadOrder(orderId);
        OrderStatus from = order.transitionTo(OrderStatus.SHIPPED);
        publish(order, loadSaga(orderId).getSagaId(), from, null);
        log.info("Order shipped: orderId={}", orderId);
        return order;
    }

    /** 고객 취소 (NEW → CANCELED). 진행 중인 Saga도 종료시킨다 */
    public Order cancel(Long orderId) {
        Order order = loadOrder(orderId);
        SagaState saga = loadSaga(orderId);
        OrderStatus from = order.transitionTo(OrderStatus.CANCELED);
        saga.fail("Canceled by customer");
        publish(order, saga.getSagaId(), from, "Canceled by customer");
        log.info("Order canceled: sagaId={}, orderId={}", saga.getSagaId(), orderId);
        return order;
    }

    private void publish(Order order, String sagaId, OrderStatus from, String reason) {
        outboxService.saveEvent(AGGREGATE_TYPE, order.getId().toString(), "OrderStatusChanged",
                new OrderStatusChangedEvent(order.getId(), sagaId,
                        from != null ? from.name() : null,
                        order.getStatus().name(),
                        reason,
                        LocalDateTime.now()));
    }
}
