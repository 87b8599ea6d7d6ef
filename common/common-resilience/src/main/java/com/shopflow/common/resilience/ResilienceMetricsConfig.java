package com.shopflow.common.resilience;

import io.github.resilience4j.bulkhead.BulkheadRegistry;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.micrometer.tagged.TaggedBulkheadMetrics;
import io.github.resilience4j.micrometer.tagged.TaggedCircuitBreakerMetrics;
import io.github.resilience4j.micrometer.tagged.TaggedRateLimiterMetrics;
import io.github.resilience4j.micrometer.tagged.TaggedRetryMetrics;
import io.github.resilience4j.micrometer.tagged.TaggedTimeLimiterMetrics;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Configuration;

/**
 * Resilience4j 메트릭 설정 (Prometheus Metrics Registration)
 *
 * <p>ResilientCaller가 대상별로 만드는 Circuit Breaker, Retry, Bulkhead, TimeLimiter 인스턴스와
 * 컨트롤러의 @RateLimiter 인스턴스 메트릭을 Micrometer에 등록한다.
 * /actuator/prometheus에서 대상(name 태그)별로 조회 가능.</p>
 *
 * <pre>
 *   resilience4j_circuitbreaker_state{name="billing-service",state="open"} 1
 *   resilience4j_retry_calls_total{name="inventory-service",kind="successful_with_retry"} 3
 *   resilience4j_timelimiter_calls_total{name="billing-service",kind="timeout"} 2
 * </pre>
 */
@Configuration
public class ResilienceMetricsConfig {

    public ResilienceMetricsConfig(
            MeterRegistry meterRegistry,
            CircuitBreakerRegistry circuitBreakerRegistry,
            RetryRegistry retryRegistry,
            @SuppressWarnings("SpringJavaInjectionPointsAutowiringInspection")
            RateLimiterRegistry rateLimiterRegistry,
            BulkheadRegistry bulkheadRegistry,
            TimeLimiterRegistry timeLimiterRegistry) {

        // 상태 전이(CLOSED → OPEN → HALF_OPEN), 실패율, 호출 수
        TaggedCircuitBreakerMetrics.ofCircuitBreakerRegistry(circuitBreakerRegistry)
                .bindTo(meterRegistry);
        TaggedRetryMetrics.ofRetryRegistry(retryRegistry)
                .bindTo(meterRegistry);
        TaggedRateLimiterMetrics.ofRateLimiterRegistry(rateLimiterRegistry)
                .bindTo(meterRegistry);
        TaggedBulkheadMetrics.ofBulkheadRegistry(bulkheadRegistry)
                .bindTo(meterRegistry);
        // 타임아웃 발생 건수
        TaggedTimeLimiterMetrics.ofTimeLimiterRegistry(timeLimiterRegistry)
                .bindTo(meterRegistry);
    }
}
