package com.shopflow.common.outbox;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

/**
 * Outbox 이벤트 리포지토리.
 */
public interface OutboxEventRepository extends JpaRepository<OutboxEvent, Long> {

    /**
     * 미발행 이벤트를 생성 순서(FIFO)로 조회. 한 번의 릴레이 실행에서 처리할 양은 Pageable로 제한한다.
     */
    List<OutboxEvent> findByPublishedFalseOrderByCreatedAtAscIdAsc(Pageable pageable);

    /** 집합체(예: 주문 하나)의 이벤트 이력 - 발생 순서대로 */
    List<OutboxEvent> findByAggregateTypeAndAggregateIdOrderByIdAsc(String aggregateType, String aggregateId);
}
