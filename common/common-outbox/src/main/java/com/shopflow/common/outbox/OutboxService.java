package com.shopflow.common.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Outbox 이벤트 저장 서비스 (Transactional Outbox - Event Save Helper)
 *
 * <p>호출자의 @Transactional 범위 안에서 이벤트를 outbox 테이블에 저장한다.
 * 트랜잭션 없이 호출되면 예외가 발생한다 ({@link Propagation#MANDATORY}):
 * 상태 변경과 이벤트 기록이 따로 커밋되는 일을 막기 위함.</p>
 *
 * <pre>
 *   &#64;Transactional
 *   public Order markReserved(Long orderId) {
 *       order.transitionTo(OrderStatus.RESERVED);                  // 1. 상태 변경
 *       outboxService.saveEvent("Order", orderId.toString(),       // 2. 같은 트랜잭션에 이벤트 저장
 *                               "OrderStatusChanged", event);
 *       return order;                                              // 커밋 시 둘 다, 롤백 시 둘 다 취소
 *   }
 * </pre>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OutboxService {

    private final OutboxEventRepository outboxEventRepository;
    private final ObjectMapper objectMapper;

    /**
     * @param aggregateType 집합체 유형 (예: "Order")
     * @param aggregateId   집합체 ID - 메시지 키로 사용
     * @param eventType     이벤트 유형 - Relay가 바인딩명을 결정하는 데 사용
     * @param event         JSON으로 직렬화될 이벤트 객체
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void saveEvent(String aggregateType, String aggregateId,
                          String eventType, Object event) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            // 직렬화 실패 → 호출자 트랜잭션 롤백
            log.error("Failed to serialize outbox event: type={}, aggregateId={}", eventType, aggregateId, e);
            throw new IllegalStateException("Failed to serialize outbox event " + eventType, e);
        }
        outboxEventRepository.save(OutboxEvent.builder()
                .aggregateType(aggregateType)
                .aggregateId(aggregateId)
                .eventType(eventType)
                .payload(payload)
                .build());
        log.debug("Outbox event saved: type={}, aggregateId={}", eventType, aggregateId);
    }

    /** 집합체의 이벤트 이력 (감사/디버깅용) */
    @Transactional(readOnly = true)
    public List<OutboxEvent> history(String aggregateType, String aggregateId) {
        return outboxEventRepository.findByAggregateTypeAndAggregateIdOrderByIdAsc(aggregateType, aggregateId);
    }
}
