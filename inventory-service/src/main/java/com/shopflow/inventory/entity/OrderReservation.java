package com.shopflow.inventory.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.LocalDateTime;

/**
 * 주문 단위 예약 헤더 - 주문 하나당 한 행
 *
 * <h3>역할</h3>
 * <pre>
 * reserve / release 모두 이 행을 먼저 잠그거나(FOR UPDATE) 새로 넣는다.
 * → 같은 주문의 예약과 해제는 항상 직렬화된다
 *
 * 예약 없이 해제가 먼저 도착한 경우 RELEASED 헤더만 남긴다 (tombstone).
 * → 뒤늦게 도착한 reserve는 재고를 건드리지 않고 거절된다
 * </pre>
 *
 * <p>orderId 유니크 제약: 동시에 헤더를 만들려는 두 트랜잭션 중 하나는 반드시 실패한다.
 */
@Entity
@Table(name = "order_reservations", uniqueConstraints = {
        @UniqueConstraint(name = "uk_order_reservation_order_id", columnNames = "orderId")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EntityListeners(AuditingEntityListener.class)
public class OrderReservation {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "order_reservation_seq")
    @SequenceGenerator(name = "order_reservation_seq", sequenceName = "order_reservation_seq", allocationSize = 50)
    private Long id;

    @Column(nullable = false)
    private Long orderId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ReservationState state;

    @CreatedDate
    private LocalDateTime createdAt;

    private LocalDateTime releasedAt;

    private OrderReservation(Long orderId, ReservationState state) {
        this.orderId = orderId;
        this.state = state;
        if (state == ReservationState.RELEASED) {
            this.releasedAt = LocalDateTime.now();
        }
    }

    public static OrderReservation reserved(Long orderId) {
        return new OrderReservation(orderId, ReservationState.RESERVED);
    }

    /** 예약 없이 해제가 먼저 온 주문의 표식 */
    public static OrderReservation tombstone(Long orderId) {
        return new OrderReservation(orderId, ReservationState.RELEASED);
    }

    public boolean isReleased() {
        return state == ReservationState.RELEASED;
    }

    public void release() {
        if (state == ReservationState.RELEASED) {
            return;
        }
        this.state = ReservationState.RELEASED;
        this.releasedAt = LocalDateTime.now();
    }
}
