package com.shopflow.inventory.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.LocalDateTime;

/**
 * 재고 예약(InventoryReservation) 엔티티 - 주문 하나가 SKU 하나에 대해 잡아둔 수량
 *
 * <h3>설계 포인트</h3>
 * <ul>
 *   <li>orderId만 저장 (FK 없음): Order Service의 주문을 참조하지만 DB는 분리되어 있다</li>
 *   <li>(orderId, sku) 유니크: 같은 주문의 재요청이 예약을 두 번 만들지 못하게 한다</li>
 *   <li>해제 후에도 행은 남겨 둔다 (RELEASED) - 재요청 판별과 감사 용도</li>
 * </ul>
 */
@Entity
@Table(name = "inventory_reservations",
        uniqueConstraints = @UniqueConstraint(name = "uk_reservation_order_sku", columnNames = {"orderId", "sku"}),
        indexes = @Index(name = "idx_reservation_order_id", columnList = "orderId"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EntityListeners(AuditingEntityListener.class)
public class InventoryReservation {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "inventory_reservation_seq")
    @SequenceGenerator(name = "inventory_reservation_seq", sequenceName = "inventory_reservation_seq", allocationSize = 50)
    private Long id;

    @Column(nullable = false)
    private Long orderId;

    @Column(nullable = false, length = 64)
    private String sku;

    @Column(nullable = false)
    private int quantity;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ReservationState state;

    @CreatedDate
    private LocalDateTime createdAt;

    private LocalDateTime releasedAt;

    @Builder
    public InventoryReservation(Long orderId, String sku, int quantity) {
        this.orderId = orderId;
        this.sku = sku;
        this.quantity = quantity;
        this.state = ReservationState.RESERVED;
    }

    public boolean isReserved() {
        return state == ReservationState.RESERVED;
    }

    /** RESERVED → RELEASED. 이미 해제된 예약이면 false (호출자는 재고를 복원하지 않는다) */
    public boolean release() {
        if (state == ReservationState.RELEASED) {
            return false;
        }
        this.state = ReservationState.RELEASED;
        this.releasedAt = LocalDateTime.now();
        return true;
    }
}
