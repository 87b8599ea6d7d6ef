package com.shopflow.order.saga;

import com.shopflow.common.contract.ChargeRequest;
import com.shopflow.common.contract.ChargeResponse;
import com.shopflow.common.contract.LineItem;
import com.shopflow.common.contract.ReservationResponse;
import com.shopflow.common.contract.ReserveInventoryRequest;
import com.shopflow.common.dto.ApiResponse;
import com.shopflow.common.exception.BusinessException;
import com.shopflow.common.exception.DependencyUnavailableException;
import com.shopflow.common.exception.InvariantViolationException;
import com.shopflow.common.resilience.OutboundCall;
import com.shopflow.common.resilience.ResilientCaller;
import com.shopflow.order.client.BillingServiceClient;
import com.shopflow.order.client.InventoryServiceClient;
import com.shopflow.order.entity.Order;
import com.shopflow.order.entity.OrderStatus;
import com.shopflow.order.entity.SagaState;
import com.shopflow.order.entity.SagaStatus;
import com.shopflow.order.service.OrderTransitionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Order Saga Orchestrator - 주문 한 건의 재고 예약 → 결제 → (보상) 흐름을 진행하는 상태 머신
 *
 * <h3>Saga 흐름</h3>
 * <pre>
 *   execute(orderId)
 *     NEW → RESERVING ── reserve(orderId, items) ──→ Inventory
 *        성공          → RESERVED
 *        거절 (409)    → FAILED                     (아무것도 잡히지 않았으므로 보상 없음, 결제 미호출)
 *        호출 불가      → 보상 → FAILED               (예약 여부를 알 수 없으므로 해제)
 *
 *     RESERVED → CHARGING ── charge(orderId, amount, key) ──→ Billing
 *        APPROVED      → 응답 검증 → PAID
 *        DECLINED      → 보상 → FAILED
 *        거절 / 호출 불가 → 보상 → FAILED
 *        검증 실패      → CONSISTENCY ALERT 로그 → 보상 → FAILED (재시도 없음)
 *
 *   보상(compensate)
 *     Saga COMPENSATING → release(orderId) ──→ Inventory (멱등)
 *        성공          → 주문 FAILED, Saga FAILED
 *        호출 불가      → COMPENSATING 유지 (복구 스케줄러가 재시도, 주문은 아직 FAILED가 아님)
 *        버전 충돌      → 다시 읽어 이미 종료된 주문이면 그대로 반환
 * </pre>
 *
 * <h3>재개 지점</h3>
 * execute()는 저장된 주문 상태에서 이어간다. 요청 스레드와 {@code SagaRecoveryScheduler}가 같은 메서드를 쓴다.
 * <ul>
 *   <li>NEW / RESERVING → 예약 재요청 (orderId 기준 멱등)</li>
 *   <li>RESERVED / CHARGING → 결제 재요청 (Saga에 고정된 멱등성 키)</li>
 *   <li>Saga COMPENSATING → 예약 해제 재시도</li>
 * </ul>
 *
 * <p>이 클래스는 트랜잭션을 열지 않는다. 상태 저장은 단계마다 {@link OrderTransitionService}가 커밋한다.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderSagaOrchestrator {

    static final String INVENTORY = "inventory-service";
    static final String BILLING = "billing-service";

    private final OrderTransitionService transitions;
    private final ResilientCaller resilientCaller;
    private final InventoryServiceClient inventoryServiceClient;
    private final BillingServiceClient billingServiceClient;

    public Order execute(Long orderId) {
        SagaState saga = transitions.loadSaga(orderId);
        Order order = transitions.loadOrder(orderId);

        if (saga.getStatus() == SagaStatus.COMPENSATING) {
            return compensate(orderId, saga.getFailureReason());
        }
        if (saga.isFinished() || order.getStatus().isTerminal()) {
            return order;
        }

        return switch (order.getStatus()) {
            case NEW, RESERVING -> reserve(order, saga);
            case RESERVED, CHARGING -> charge(order, saga);
            default -> order;
        };
    }

    private Order reserve(Order order, SagaState saga) {
        Long orderId = order.getId();
        transitions.advance(orderId, OrderStatus.RESERVING);

        List<LineItem> items = order.getItems().stream()
                .map(item -> new LineItem(item.getSku(), item.getQuantity()))
                .toList();
        ReservationResponse reservation;
        try {
            reservation = resilientCaller.call(OutboundCall.idempotent(INVENTORY, "reserve",
                    () -> body(INVENTORY, inventoryServiceClient.reserve(new ReserveInventoryRequest(orderId, items)))));
        } catch (BusinessException e) {
            log.warn("Inventory rejected reservation: sagaId={}, orderId={}, reason={}",
                    saga.getSagaId(), orderId, e.getMessage());
            return fail(orderId, "Inventory rejected: " + e.getMessage());
        } catch (DependencyUnavailableException e) {
            log.warn("Inventory unavailable during reserve: sagaId={}, orderId={}", saga.getSagaId(), orderId);
            return compensate(orderId, "Inventory unavailable: " + e.getMessage());
        }

        if (!reservation.isReserved() || !orderId.equals(reservation.orderId())) {
            return compensate(orderId, "Unexpected reservation state " + reservation.state()
                    + " for order " + reservation.orderId());
        }

        Order reserved = transitions.markReserved(orderId);
        return charge(reserved, saga);
    }

    private Order charge(Order order, SagaState saga) {
        Long orderId = order.getId();
        transitions.advance(orderId, OrderStatus.CHARGING);

        String key = saga.getChargeIdempotencyKey();
        ChargeResponse charge;
        try {
            charge = resilientCaller.call(OutboundCall.withIdempotencyKey(BILLING, "charge", key,
                    () -> body(BILLING, billingServiceClient.charge(new ChargeRequest(orderId, order.getAmount(), key)))));
        } catch (BusinessException e) {
            log.warn("Billing rejected charge: sagaId={}, orderId={}, reason={}",
                    saga.getSagaId(), orderId, e.getMessage());
            return compensate(orderId, "Billing rejected: " + e.getMessage());
        } catch (DependencyUnavailableException e) {
            log.warn("Billing unavailable during charge: sagaId={}, orderId={}", saga.getSagaId(), orderId);
            return compensate(orderId, "Billing unavailable: " + e.getMessage());
        }

        if (!charge.isApproved()) {
            log.info("Charge declined: sagaId={}, orderId={}, referenceId={}",
                    saga.getSagaId(), orderId, charge.referenceId());
            return compensate(orderId, "Charge declined: referenceId=" + charge.referenceId());
        }

        try {
            verifyEcho(order, charge);
            return transitions.markPaid(orderId, charge.referenceId());
        } catch (InvariantViolationException e) {
            log.error("CONSISTENCY ALERT: sagaId={}, orderId={}, {}", saga.getSagaId(), orderId, e.getMessage(), e);
            return compensate(orderId, "Consistency check failed: " + e.getMessage());
        }
    }

    /**
     * 보상 - 예약 해제 후 주문 FAILED. 해제가 전달되지 않으면 COMPENSATING으로 남겨 둔다.
     */
    Order compensate(Long orderId, String reason) {
        transitions.beginCompensation(orderId, reason);
        try {
            resilientCaller.call(OutboundCall.idempotent(INVENTORY, "release",
                    () -> body(INVENTORY, inventoryServiceClient.release(orderId))));
        } catch (DependencyUnavailableException | BusinessException e) {
            log.error("Compensation pending, inventory release failed: orderId={}, reason={}",
                    orderId, reason, e);
            return transitions.loadOrder(orderId);
        }
        return fail(orderId, reason);
    }

    /**
     * 주문 FAILED 확정. 다른 실행(요청 스레드 / 복구 스케줄러)이 먼저 끝내 버전 충돌이 나면
     * 다시 읽어 이미 종료된 주문은 그대로 돌려준다.
     */
    private Order fail(Long orderId, String reason) {
        try {
            return transitions.markFailed(orderId, reason);
        } catch (OptimisticLockingFailureException e) {
            Order current = transitions.loadOrder(orderId);
            if (!current.getStatus().isTerminal()) {
                throw e;
            }
            log.info("Order already finished by a concurrent saga run: orderId={}, status={}",
                    orderId, current.getStatus());
            return current;
        }
    }

    /** 승인된 결제가 요청한 주문 / 금액과 같은지 확인 */
    private void verifyEcho(Order order, ChargeResponse charge) {
        if (!order.getId().equals(charge.orderId())) {
            throw new InvariantViolationException("Charge echo orderId " + charge.orderId()
                    + " does not match order " + order.getId());
        }
        if (charge.amount() == null || order.getAmount().compareTo(charge.amount()) != 0) {
            throw new InvariantViolationException("Charge echo amount " + charge.amount()
                    + " does not match order amount " + order.getAmount());
        }
    }

    /** ApiResponse 래퍼 해제 - 본문이 비어 있으면 장애로 취급한다 */
    private static <T> T body(String target, ApiResponse<T> response) {
        if (response == null || !response.success() || response.data() == null) {
            throw new IllegalStateException(target + " returned an empty response");
        }
        return response.data();
    }
}
