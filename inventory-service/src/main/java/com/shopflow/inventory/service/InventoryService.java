package com.shopflow.inventory.service;

import com.shopflow.common.contract.LineItem;
import com.shopflow.common.event.InventoryReservationEvent;
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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 재고 서비스 - 예약 / 해제 / 조회 / 입고
 *
 * <h3>reserve: all-or-nothing</h3>
 * <pre>
 * 1. 요청 검증 (항목 1개 이상, SKU 공백 불가, 수량 > 0) - 같은 SKU는 수량 합산
 * 2. 주문 헤더(OrderReservation) 잠금
 *    - RESERVED 헤더 존재 → 재요청(replay): 기존 결과 그대로 반환
 *    - RELEASED 헤더 존재 → 이미 보상된 주문 (해제가 먼저 도착한 경우 포함): 거절
 *    - 헤더 없음 → RESERVED 헤더를 즉시 INSERT (동시 해제와 직렬화)
 * 3. SKU 오름차순으로 StockItem 행 잠금 (SELECT ... FOR UPDATE)
 * 4. 모든 SKU 수량 검사 → 하나라도 부족하면 롤백 (헤더 포함 아무것도 남지 않음)
 * 5. 차감 + RESERVED 예약 생성 + Outbox(StockReserved)
 * </pre>
 *
 * <h3>release: 멱등</h3>
 * RESERVED 예약만 RELEASED로 바꾸고 재고를 복원한다.
 * 예약이 없는 주문은 RELEASED 헤더(tombstone)만 남기고 성공한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class InventoryService {

    private static final String AGGREGATE_TYPE = "InventoryReservation";

    private final StockItemRepository stockItemRepository;
    private final InventoryReservationRepository reservationRepository;
    private final OrderReservationRepository orderReservationRepository;
    private final OutboxService outboxService;

    /** 단일 SKU 가용 수량 조회 */
    public StockItem check(String sku) {
        return stockItemRepository.findBySku(sku)
                .orElseThrow(() -> new BusinessException(ErrorCode.SKU_NOT_FOUND, "SKU not found: " + sku));
    }

    @Transactional
    public List<InventoryReservation> reserve(Long orderId, List<LineItem> items) {
        Map<String, Integer> requested = validateAndMerge(orderId, items);

        // 1단계: 주문 헤더 잠금 (해제와 같은 행을 두고 직렬화)
        Optional<OrderReservation> header = orderReservationRepository.findByOrderIdForUpdate(orderId);
        if (header.isPresent()) {
            if (header.get().isReleased()) {
                log.warn("Reserve rejected, order already released: orderId={}", orderId);
                throw new BusinessException(ErrorCode.RESERVATION_RELEASED,
                        "Reservation for order " + orderId + " was already released");
            }
            log.info("Reserve replayed, returning existing reservation: orderId={}", orderId);
            return reservationRepository.findByOrderIdOrderBySkuAsc(orderId);
        }
        orderReservationRepository.saveAndFlush(OrderReservation.reserved(orderId));

        // 2단계: SKU 오름차순으로 재고 행 잠금 (TreeMap 순회 순서)
        Map<String, StockItem> locked = new TreeMap<>();
        for (String sku : requested.keySet()) {
            StockItem stock = stockItemRepository.findBySkuForUpdate(sku)
                    .orElseThrow(() -> new BusinessException(ErrorCode.UNKNOWN_SKU, "Unknown SKU: " + sku));
            locked.put(sku, stock);
        }

        // 3단계: 전체 검사 후에만 차감
        List<String> shortages = new ArrayList<>();
        requested.forEach((sku, quantity) -> {
            StockItem stock = locked.get(sku);
            if (!stock.canReserve(quantity)) {
                shortages.add(sku + "(requested=" + quantity + ", available=" + stock.getAvailable() + ")");
            }
        });
        if (!shortages.isEmpty()) {
            log.warn("Reserve rejected, insufficient stock: orderId={}, shortages={}", orderId, shortages);
            throw new BusinessException(ErrorCode.INSUFFICIENT_STOCK, "Insufficient stock: " + String.join(", ", shortages));
        }

        // 4단계: 차감 + 예약 생성
        List<InventoryReservation> reservations = new ArrayList<>();
        requested.forEach((sku, quantity) -> {
            locked.get(sku).decrease(quantity);
            reservations.add(InventoryReservation.builder()
                    .orderId(orderId)
                    .sku(sku)
                    .quantity(quantity)
                    .build());
        });
        List<InventoryReservation> saved = reservationRepository.saveAll(reservations);

        outboxService.saveEvent(AGGREGATE_TYPE, orderId.toString(), "StockReserved",
                toEvent(orderId, ReservationState.RESERVED, saved));
        log.info("Stock reserved: orderId={}, items={}", orderId, requested);
        return saved;
    }

    @Transactional
    public List<InventoryReservation> release(Long orderId) {
        if (orderId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "orderId is required");
        }
        Optional<OrderReservation> header = orderReservationRepository.findByOrderIdForUpdate(orderId);
        if (header.isEmpty()) {
            // 예약보다 해제가 먼저 도착: 뒤늦은 reserve가 재고를 잡지 못하도록 표식을 남긴다
            orderReservationRepository.saveAndFlush(OrderReservation.tombstone(orderId));
            log.info("Release before any reservation, tombstone recorded: orderId={}", orderId);
            return List.of();
        }
        header.get().release();

        List<InventoryReservation> reservations = reservationRepository.findByOrderIdForUpdate(orderId);
        List<InventoryReservation> released = new ArrayList<>();
        for (InventoryReservation reservation : reservations) {
            if (!reservation.isReserved()) {
                continue;
            }
            StockItem stock = stockItemRepository.findBySkuForUpdate(reservation.getSku())
                    .orElseThrow(() -> new IllegalStateException(
                            "Stock row missing for reserved sku: " + reservation.getSku()));
            stock.increase(reservation.getQuantity());
            reservation.release();
            released.add(reservation);
        }

        if (released.isEmpty()) {
            log.info("Release replayed, already released: orderId={}", orderId);
        } else {
            outboxService.saveEvent(AGGREGATE_TYPE, orderId.toString(), "ReservationReleased",
                    toEvent(orderId, ReservationState.RELEASED, released));
            log.info("Reservation released: orderId={}, skus={}", orderId, released.size());
        }
        return reservations;
    }

    public List<InventoryReservation> getReservations(Long orderId) {
        List<InventoryReservation> reservations = reservationRepository.findByOrderIdOrderBySkuAsc(orderId);
        if (reservations.isEmpty()) {
            throw new BusinessException(ErrorCode.RESERVATION_NOT_FOUND, "No reservation for order " + orderId);
        }
        return reservations;
    }

    /** 입고 - 없는 SKU는 새로 만든다 */
    @Transactional
    public StockItem restock(String sku, int quantity) {
        if (sku == null || sku.isBlank() || quantity <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "sku must be non-blank and quantity > 0");
        }
        return stockItemRepository.findBySkuForUpdate(sku)
                .map(stock -> {
                    stock.increase(quantity);
                    log.info("Restocked: sku={}, added={}, available={}", sku, quantity, stock.getAvailable());
                    return stock;
                })
                .orElseGet(() -> {
                    log.info("New SKU stocked: sku={}, available={}", sku, quantity);
                    return stockItemRepository.save(StockItem.builder().sku(sku).available(quantity).build());
                });
    }

    private Map<String, Integer> validateAndMerge(Long orderId, List<LineItem> items) {
        if (orderId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "orderId is required");
        }
        if (items == null || items.isEmpty()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "at least one item is required");
        }
        Map<String, Integer> merged = new TreeMap<>();
        for (LineItem item : items) {
            if (item == null || item.sku() == null || item.sku().isBlank()) {
                throw new BusinessException(ErrorCode.INVALID_INPUT, "sku must not be blank");
            }
            if (item.quantity() <= 0) {
                throw new BusinessException(ErrorCode.INVALID_INPUT,
                        "quantity must be positive: sku=" + item.sku());
            }
            merged.merge(item.sku(), item.quantity(), Integer::sum);
        }
        return merged;
    }

    private InventoryReservationEvent toEvent(Long orderId, ReservationState state,
                                              List<InventoryReservation> reservations) {
        List<LineItem> lines = reservations.stream()
                .map(r -> new LineItem(r.getSku(), r.getQuantity()))
                .toList();
        return new InventoryReservationEvent(orderId, state.name(), lines, LocalDateTime.now());
    }
}
