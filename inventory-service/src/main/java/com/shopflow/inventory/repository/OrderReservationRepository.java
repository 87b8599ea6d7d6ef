package com.shopflow.inventory.repository;

import com.shopflow.inventory.entity.OrderReservation;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface OrderReservationRepository extends JpaRepository<OrderReservation, Long> {

    /** 주문 헤더 잠금 - 재고 행보다 먼저 잠근다 (락 순서: 헤더 → SKU 오름차순) */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT o FROM OrderReservation o WHERE o.orderId = :orderId")
    Optional<OrderReservation> findByOrderIdForUpdate(@Param("orderId") Long orderId);
}
