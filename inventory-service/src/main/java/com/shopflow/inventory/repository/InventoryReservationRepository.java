package com.shopflow.inventory.repository;

import com.shopflow.inventory.entity.InventoryReservation;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface InventoryReservationRepository extends JpaRepository<InventoryReservation, Long> {

    /** 주문의 예약 목록 (SKU 오름차순 - 해제 시 락 순서와 동일) */
    List<InventoryReservation> findByOrderIdOrderBySkuAsc(Long orderId);

    /** 해제용 - 같은 주문의 동시 해제가 재고를 두 번 복원하지 않도록 예약 행을 잠근다 */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM InventoryReservation r WHERE r.orderId = :orderId ORDER BY r.sku")
    List<InventoryReservation> findByOrderIdForUpdate(@Param("orderId") Long orderId);
}
