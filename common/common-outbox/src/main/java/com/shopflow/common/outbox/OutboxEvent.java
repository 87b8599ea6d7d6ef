package com.shopflow.common.outbox;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Outbox 이벤트 엔티티 (Transactional Outbox Pattern)
 *
 * <p>브로커로 발행할 이벤트를 비즈니스 데이터와 <b>같은 로컬 트랜잭션</b>에서 outbox_events 테이블에 저장한다.
 * Order Service에서는 이 테이블이 곧 Saga 상태 전이 로그(주문별 이벤트 이력) 역할도 한다.</p>
 *
 * <pre>
 *   outbox_events (
 *     id             BIGINT    -- PK (시퀀스, allocationSize=50)
 *     aggregate_type VARCHAR   -- "Order", "ChargeRecord", "InventoryReservation"
 *     aggregate_id   VARCHAR   -- 주문 ID (메시지 키 → 같은 주문의 이벤트는 같은 파티션)
 *     event_type     VARCHAR   -- "OrderStatusChanged", "ChargeRecorded", "StockReserved" ...
 *     payload        TEXT      -- JSON 직렬화된 이벤트
 *     published      BOOLEAN
 *     created_at     TIMESTAMP
 *     published_at   TIMESTAMP
 *   )
 * </pre>
 *
 * ★ At-least-once delivery: consumers deduplicate by (aggregateId, eventType, payload).
 */
@Entity
@Table(name = "outbox_events", indexes = {
        // 미발행 이벤트를 생성 순서대로 조회 (Relay)
        @Index(name = "idx_outbox_published", columnList = "published, createdAt"),
        // 주문별 이벤트 이력 조회
        @Index(name = "idx_outbox_aggregate", columnList = "aggregateType, aggregateId")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OutboxEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "outbox_event_seq")
    @SequenceGenerator(name = "outbox_event_seq", sequenceName = "outbox_event_seq", allocationSize = 50)
    private Long id;

    @Column(nullable = false)
    private String aggregateType;

    @Column(nullable = false)
    private String aggregateId;

    @Column(nullable = false)
    private String eventType;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String payload;

    @Column(nullable = false)
    private boolean published;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    private LocalDateTime publishedAt;

    @Builder
    public OutboxEvent(String aggregateType, String aggregateId,
                       String eventType, String payload) {
        this.aggregateType = aggregateType;
        this.aggregateId = aggregateId;
        this.eventType = eventType;
        this.payload = payload;
        this.published = false;
        this.createdAt = LocalDateTime.now();
    }

    /** 브로커 전송 성공 후 OutboxRelay가 호출 */
    public void markPublished() {
        this.published = true;
        this.publishedAt = LocalDateTime.now();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OutboxEvent that)) return false;
        return id != null && id.equals(that.getId());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
