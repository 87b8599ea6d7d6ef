package com.shopflow.order.repository;

import com.shopflow.order.entity.SagaState;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

public interface SagaStateRepository extends JpaRepository<SagaState, Long> {

    Optional<SagaState> findByOrderId(Long orderId);

    /**
     * 복구 대상: staleBefore 이후 갱신이 없는 COMPENSATING / STARTED.
     * 요청 스레드가 아직 진행 중인 Saga는 건드리지 않는다. 오래된 것부터 처리한다.
     */
    @Query("SELECT s FROM SagaState s " +
            "WHERE s.status IN (com.shopflow.order.entity.SagaStatus.COMPENSATING, " +
            "                   com.shopflow.order.entity.SagaStatus.STARTED) " +
            "  AND s.updatedAt < :staleBefore " +
            "ORDER BY s.updatedAt ASC")
    List<SagaState> findRecoverable(@Param("staleBefore") LocalDateTime staleBefore, Pageable pageable);
}
