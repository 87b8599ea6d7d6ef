package com.shopflow.billing.repository;

import com.shopflow.billing.entity.ChargeRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface ChargeRecordRepository extends JpaRepository<ChargeRecord, Long> {

    /** 멱등성 조회 - 같은 (주문, 키)로 이미 기록된 결제 */
    Optional<ChargeRecord> findByOrderIdAndIdempotencyKey(Long orderId, String idempotencyKey);

    /** 주문별 원장 (기록 순) */
    List<ChargeRecord> findByOrderIdOrderByIdAsc(Long orderId);
}
