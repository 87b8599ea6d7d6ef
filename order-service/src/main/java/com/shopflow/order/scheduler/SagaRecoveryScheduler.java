package com.shopflow.order.scheduler;

import com.shopflow.order.config.SagaRecoveryProperties;
import com.shopflow.order.entity.Order;
import com.shopflow.order.entity.SagaState;
import com.shopflow.order.repository.SagaStateRepository;
import com.shopflow.order.saga.OrderSagaOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Saga 복구 스케줄러 - 멈춘 Saga를 저장된 상태에서 재개한다.
 *
 * <h3>대상</h3>
 * <ul>
 *   <li>COMPENSATING + staleAfter 이상 갱신 없음: 예약 해제가 아직 전달되지 않은 Saga</li>
 *   <li>STARTED + staleAfter 이상 갱신 없음: 코디네이터가 중간에 죽었거나 요청 스레드가 끊긴 Saga</li>
 * </ul>
 *
 * <p>한 Saga의 실패가 나머지 복구를 막지 않도록 건별로 예외를 기록하고 다음으로 넘어간다.
 * 실패한 Saga는 다음 주기에 다시 대상이 된다. 다중 인스턴스에서는 ShedLock으로 한 곳에서만 실행된다.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SagaRecoveryScheduler {

    private final SagaStateRepository sagaStateRepository;
    private final OrderSagaOrchestrator orchestrator;
    private final SagaRecoveryProperties properties;

    @Scheduled(fixedDelayString = "${saga.recovery.interval-ms:30000}",
            initialDelayString = "${saga.recovery.initial-delay-ms:30000}")
    @SchedulerLock(name = "SagaRecoveryScheduler_resumeStuckSagas",
            lockAtMostFor = "5m", lockAtLeastFor = "5s")
    public void resumeStuckSagas() {
        LocalDateTime staleBefore = LocalDateTime.now().minus(properties.staleAfter());
        List<SagaState> candidates = sagaStateRepository.findRecoverable(
                staleBefore, PageRequest.of(0, properties.batchSize()));
        if (candidates.isEmpty()) {
            return;
        }

        log.info("Saga recovery started: candidates={}", candidates.size());
        int resumed = 0;
        for (SagaState saga : candidates) {
            try {
                Order order = orchestrator.execute(saga.getOrderId());
                log.info("Saga resumed: sagaId={}, orderId={}, status={}",
                        saga.getSagaId(), saga.getOrderId(), order.getStatus());
                resumed++;
            } catch (RuntimeException e) {
                log.error("Saga recovery failed: sagaId={}, orderId={}", saga.getSagaId(), saga.getOrderId(), e);
            }
        }
        log.info("Saga recovery finished: resumed={}, failed={}", resumed, candidates.size() - resumed);
    }
}
