package com.shopflow.common.resilience;

import io.github.resilience4j.bulkhead.BulkheadRegistry;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * ResilientCaller 빈 구성.
 *
 * <p>Registry 4종은 resilience4j-spring-boot3 자동 구성이 application.yml로부터 만든다.
 * 호출 실행용 스레드 풀은 애플리케이션 종료 시 함께 정리된다.</p>
 *
 * <h3>스레드 풀 크기</h3>
 * <pre>
 * 최대 스레드 = 대상별 Bulkhead max-concurrent-calls 합계
 * 대기 큐     = 같은 크기 (타임아웃으로 취소된 호출이 스레드를 늦게 돌려주는 동안만 사용)
 * 둘 다 차면 제출이 거절되고 ResilientCaller가 DependencyUnavailableException으로 바꾼다
 * </pre>
 */
@Configuration
public class ResilienceConfig {

    private static final long IDLE_KEEP_ALIVE_SECONDS = 60;

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService outboundCallExecutor(BulkheadRegistry bulkheadRegistry) {
        int poolSize = outboundPoolSize(bulkheadRegistry);
        ThreadPoolExecutor executor = new ThreadPoolExecutor(poolSize, poolSize,
                IDLE_KEEP_ALIVE_SECONDS, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(poolSize),
                new CustomizableThreadFactory("outbound-"));
        executor.allowCoreThreadTimeOut(true);
        return executor;
    }

    /** 등록된 Bulkhead 한도 합계. 인스턴스가 없으면 기본 설정 한도 */
    static int outboundPoolSize(BulkheadRegistry bulkheadRegistry) {
        int total = bulkheadRegistry.getAllBulkheads().stream()
                .mapToInt(bulkhead -> bulkhead.getBulkheadConfig().getMaxConcurrentCalls())
                .sum();
        return Math.max(total, bulkheadRegistry.getDefaultConfig().getMaxConcurrentCalls());
    }

    @Bean
    public ResilientCaller resilientCaller(CircuitBreakerRegistry circuitBreakerRegistry,
                                           RetryRegistry retryRegistry,
                                           BulkheadRegistry bulkheadRegistry,
                                           TimeLimiterRegistry timeLimiterRegistry,
                                           ExecutorService outboundCallExecutor) {
        return new ResilientCaller(circuitBreakerRegistry, retryRegistry,
                bulkheadRegistry, timeLimiterRegistry, outboundCallExecutor);
    }
}
