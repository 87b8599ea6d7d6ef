package com.shopflow.order.service;

import com.shopflow.common.contract.LineItem;
import com.shopflow.common.exception.BusinessException;
import com.shopflow.common.exception.ErrorCode;
import com.shopflow.order.dto.OrderResponse;
import com.shopflow.order.entity.Order;
import com.shopflow.order.repository.OrderRepository;
import com.shopflow.order.saga.OrderSagaOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * 주문 서비스 - 주문 접수 / 조회 / 출고 / 취소
 *
 * <h3>placeOrder 실행 흐름</h3>
 * <pre>
 * 1. 입력 검증 (항목 1개 이상, SKU 공백 불가, 수량 > 0, 금액 > 0) - 실패 시 어떤 부수효과도 없음
 * 2. Idempotency-Key가 이미 사용된 키면 첫 요청의 주문을 반환
 * 3. [트랜잭션] Order(NEW) + SagaState(STARTED) + Outbox 이벤트 저장
 * 4. [트랜잭션 밖] Saga 진행: 재고 예약 → 결제 → (실패 시 보상)
 * 5. 최종 주문 상태 반환 (PAID / FAILED, 보상 미완료 시 진행 중 상태)
 * </pre>
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class OrderService {

    private static final int MAX_AMOUNT_SCALE = 2;

    private final OrderRepository orderRepository;
    private final OrderTransitionService transitions;
    private final OrderSagaOrchestrator orchestrator;

    // Saga 단계마다 별도 트랜잭션으로 커밋 - 클래스 기본값(readOnly)에 합류하지 않는다
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    public OrderResponse placeOrder(List<LineItem> items, BigDecimal amount, String idempotencyKey) {
        validate(items, amount);

        if (idempotencyKey != null) {
            Optional<Order> previous = orderRepository.findByRequestKey(idempotencyKey);
            if (previous.isPresent()) {
                log.info("Duplicate order request, returning first order: key={}, orderId={}",
                        idempotencyKey, previous.get().getId());
                return OrderResponse.from(transitions.loadOrder(previous.get().getId()));
            }
        }

        Order order;
        try {
            order = transitions.open(items, amount, idempotencyKey);
        } catch (DataIntegrityViolationException e) {
            // 같은 키의 동시 요청에서 패배 → 승자의 주문
            Order winner = orderRepository.findByRequestKey(idempotencyKey).orElseThrow(() -> e);
            return OrderResponse.from(transitions.loadOrder(winner.getId()));
        }

        return OrderResponse.from(orchestrator.execute(order.getId()));
    }

    public OrderResponse getOrder(Long orderId) {
        return orderRepository.findWithItemsById(orderId)
                .map(OrderResponse::from)
                .orElseThrow(() -> new BusinessException(ErrorCode.ORDER_NOT_FOUND, "Order not found: " + orderId));
    }

    /** 최신순 목록 (항목은 배치 로딩) */
    public List<OrderResponse> listOrders(int page, int size) {
        if (page < 0 || size <= 0 || size > 100) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "page must be >= 0 and size between 1 and 100");
        }
        return orderRepository.findAllByOrderByIdDesc(PageRequest.of(page, size)).stream()
                .map(OrderResponse::from)
                .toList();
    }

    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    public OrderResponse shipOrder(Long orderId) {
        return OrderResponse.from(transitions.ship(orderId));
    }

    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    public OrderResponse cancelOrder(Long orderId) {
        return OrderResponse.from(transitions.cancel(orderId));
    }

    private void validate(List<LineItem> items, BigDecimal amount) {
        if (items == null || items.isEmpty()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "at least one item is required");
        }
        for (LineItem item : items) {
            if (item == null || item.sku() == null || item.sku().isBlank()) {
                throw new BusinessException(ErrorCode.INVALID_INPUT, "sku must not be blank");
            }
            if (item.quantity() <= 0) {
                throw new BusinessException(ErrorCode.INVALID_INPUT, "quantity must be positive: sku=" + item.sku());
            }
        }
        if (amount == null || amount.signum() <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "amount must be greater than 0");
        }
        if (amount.stripTrailingZeros().scale() > MAX_AMOUNT_SCALE) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    "amount must have at most " + MAX_AMOUNT_SCALE + " fraction digits");
        }
    }
}
