package com.shopflow.order.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Saga 복구 스케줄러 설정.
 *
 * @param staleAfter STARTED 상태로 이 시간 이상 갱신이 없으면 멈춘 것으로 본다 (기본 1분)
 * @param batchSize  한 번에 재개할 최대 Saga 수 (기본 50)
 */
@ConfigurationProperties(prefix = "saga.recovery")
public record SagaRecoveryProperties(Duration staleAfter, int batchSize) {

    public SagaRecoveryProperties {
        if (staleAfter == null) {
            staleAfter = Duration.ofMinutes(1);
        }
        if (batchSize <= 0) {
            batchSize = 50;
        }
    }
}
