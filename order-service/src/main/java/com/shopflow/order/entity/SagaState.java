package com.shopflow.order.entity;

import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.LocalDateTime;

/**
 * Saga 로그 엔티티 - 주문 하나의 분산 트랜잭션 진행 상태를 DB에 기록
 *
 * <h3>Saga 흐름과 기록</h3>
 * <pre>
 * 1. 주문 생성        → SagaState(STARTED, step=ORDER_CREATED), chargeIdempotencyKey 고정
 * 2. 예약 성공        → reservationConfirmed = true, step=INVENTORY_RESERVED
 * 3. 결제 승인        → complete() → COMPLETED
 *
 * 실패 시:
 * 2-1. 예약 거절      → fail(reason) → FAILED (해제할 예약 없음)
 * 3-1. 결제 거절/불가  → startCompensation(reason) → 예약 해제 → fail(reason)
 * </pre>
 *
 * <h3>재시작 후 복구</h3>
 * 코디네이터가 중간에 죽어도 이 행과 주문 상태만으로 어디서부터 이어갈지 결정할 수 있다.
 * chargeIdempotencyKey가 Saga 생성 시 고정되므로, 결제를 다시 요청해도 Billing은 같은 기록을 돌려준다.
 */
@Entity
@Table(name = "saga_states", indexes = {
        @Index(name = "idx_saga_order_id", columnList = "orderId"),
        @Index(name = "idx_saga_status_updated", columnList = "status, updatedAt")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EntityListeners(AuditingEntityListener.class)
public class SagaState {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "saga_state_seq")
    @SequenceGenerator(name = "saga_state_seq", sequenceName = "saga_state_seq", allocationSize = 50)
    private Long id;

    @Version
    private Long version;

    @Column(nullable = false, unique = true, length = 36)
    private String sagaId;

    @Column(nullable = false, unique = true)
    private Long orderId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private SagaStatus status;

    @Column(nullable = false, length = 32)
    private String currentStep;

    // Billing 중복 제거 키 - Saga 수명 동안 바뀌지 않는다
    @Column(nullable = false, length = 64)
    private String chargeIdempotencyKey;

    // Inventory가 RESERVED를 확인해 준 뒤에만 true. PAID 전이의 전제 조건
    private boolean reservationConfirmed;

    @Column(length = 512)
    private String failureReason;

    @CreatedDate
    private LocalDateTime createdAt;

    @LastModifiedDate
    private LocalDateTime updatedAt;

    @Builder
    public SagaState(String sagaId, Long orderId) {
        this.sagaId = sagaId;
        this.orderId = orderId;
        this.status = SagaStatus.STARTED;
        this.currentStep = "ORDER_CREATED";
        this.chargeIdempotencyKey = "charge-" + sagaId;
    }

    public void advanceStep(String step) {
        this.currentStep = step;
    }

    public void confirmReservation() {
        this.reservationConfirmed = true;
        this.currentStep = "INVENTORY_RESERVED";
    }

    public void complete() {
        this.status = SagaStatus.COMPLETED;
        this.currentStep = "COMPLETED";
    }

    public void startCompensation(String reason) {
        this.status = SagaStatus.COMPENSATING;
        this.currentStep = "RELEASING_INVENTORY";
        this.failureReason = reason;
    }

    public void fail(String reason) {
        this.status = SagaStatus.FAILED;
        this.currentStep = "FAILED";
        this.failureReason = reason;
    }

    public boolean isFinished() {
        return status == SagaStatus.COMPLETED || status == SagaStatus.FAILED;
    }
}
