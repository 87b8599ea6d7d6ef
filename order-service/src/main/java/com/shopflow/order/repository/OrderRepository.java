package com.shopflow.order.repository;

import com.shopflow.order.entity.Order;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Slice;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface OrderRepository extends JpaRepository<Order, Long> {

    /**
     * 주문 + 주문항목을 Fetch Join으로 한 번에 조회.
     * 반환된 엔티티는 트랜잭션 밖(Saga 코디네이터)에서도 항목을 읽을 수 있다.
     */
    @Query("SELECT o FROM Order o LEFT JOIN FETCH o.items WHERE o.id = :id")
    Optional<Order> findWithItemsById(@Param("id") Long id);

    /** Idempotency-Key로 이전 주문 조회 */
    Optional<Order> findByRequestKey(String requestKey);

    /** 최신순 목록 - 항목은 지연 로딩 (default_batch_fetch_size로 묶어서 조회) */
    Slice<Order> findAllByOrderByIdDesc(Pageable pageable);
}
