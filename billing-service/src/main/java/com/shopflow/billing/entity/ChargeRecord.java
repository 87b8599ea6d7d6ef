package com.shopflow.billing.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 결제 기록(ChargeRecord) 엔티티 - append-only 원장
 *
 * <h3>설계 포인트</h3>
 * <ul>
 *   <li>setter / 상태 변경 메서드 없음: 한 번 기록된 결제는 수정되지 않는다 (환불은 범위 밖)</li>
 *   <li>(orderId, idempotencyKey) 유니크: 같은 키의 동시 요청 중 하나만 기록되고, 나머지는 승자의 기록을 다시 읽는다</li>
 *   <li>referenceId 유니크: 외부에 노출되는 결제 참조 ID</li>
 * </ul>
 */
@Entity
@Table(name = "charge_records",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_charge_order_idempotency_key", columnNames = {"orderId", "idempotencyKey"}),
                @UniqueConstraint(name = "uk_charge_reference_id", columnNames = "referenceId")
        },
        indexes = @Index(name = "idx_charge_order_id", columnList = "orderId"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EntityListeners(AuditingEntityListener.class)
public class ChargeRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "charge_record_seq")
    @SequenceGenerator(name = "charge_record_seq", sequenceName = "charge_record_seq", allocationSize = 50)
    private Long id;

    @Column(nullable = false, updatable = false)
    private Long orderId;

    @Column(nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private ChargeStatus status;

    @Column(nullable = false, updatable = false, length = 64)
    private String referenceId;

    @Column(nullable = false, updatable = false, length = 128)
    private String idempotencyKey;

    @CreatedDate
    @Column(updatable = false)
    private LocalDateTime createdAt;

    @Builder
    public ChargeRecord(Long orderId, BigDecimal amount, ChargeStatus status,
                        String referenceId, String idempotencyKey) {
        this.orderId = orderId;
        this.amount = amount;
        this.status = status;
        this.referenceId = referenceId;
        this.idempotencyKey = idempotencyKey;
    }

    public boolean isApproved() {
        return status == ChargeStatus.APPROVED;
    }
}
