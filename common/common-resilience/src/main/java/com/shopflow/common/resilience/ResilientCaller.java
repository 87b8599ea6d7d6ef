package com.shopflow.common.resilience;

import com.shopflow.common.exception.BusinessException;
import com.shopflow.common.exception.DependencyUnavailableException;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadFullException;
import io.github.resilience4j.bulkhead.BulkheadRegistry;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;

/**
 * Resilience Wrapper - 모든 아웃바운드 호출을 감싸는 타임아웃 / 재시도 / 서킷 브레이커
 *
 * <h3>데코레이터 순서 (바깥 → 안쪽)</h3>
 * <pre>
 * Retry            (재시도 가능한 호출만, 지수 백오프 + jitter)
 *   └─ CircuitBreaker  (대상별 실패율 감시, OPEN이면 즉시 실패)
 *       └─ Bulkhead        (대상별 동시 호출 수 제한)
 *           └─ TimeLimiter     (호출마다 데드라인, 초과 시 Future 취소)
 *               └─ 실제 호출 (executor 스레드에서 실행)
 * </pre>
 *
 * <h3>정책 조회</h3>
 * 정책은 호출 대상 이름(target)으로 각 Registry에서 조회한다.
 * application.yml의 {@code resilience4j.*.instances.<target>}에 정의가 없으면 {@code configs.default}가 적용된다.
 *
 * <h3>결과 분류</h3>
 * <ul>
 *   <li>성공 → 결과 반환</li>
 *   <li>BusinessException (하위 서비스의 4xx 거절) → 재시도 없이 그대로 전파, 브레이커 실패로 집계하지 않음</li>
 *   <li>타임아웃 / 연결 실패 / 5xx → 재시도 후에도 실패하면 DependencyUnavailableException</li>
 *   <li>브레이커 OPEN, Bulkhead 포화 → 즉시 DependencyUnavailableException</li>
 * </ul>
 *
 * ★ Single choke point for outbound calls. Errors are classified, never swallowed.
 */
@Slf4j
@RequiredArgsConstructor
public class ResilientCaller {

    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final RetryRegistry retryRegistry;
    private final BulkheadRegistry bulkheadRegistry;
    private final TimeLimiterRegistry timeLimiterRegistry;
    private final ExecutorService executor;     // 호출을 실행하는 스레드 풀 (타임아웃 시 인터럽트)

    public <T> T call(OutboundCall<T> call) {
        String target = call.target();
        CircuitBreaker circuitBreaker = circuitBreakerRegistry.circuitBreaker(target);
        Bulkhead bulkhead = bulkheadRegistry.bulkhead(target);
        TimeLimiter timeLimiter = timeLimiterRegistry.timeLimiter(target);

        Callable<T> task = call.action()::get;
        Callable<T> timed = TimeLimiter.decorateFutureSupplier(timeLimiter, () -> executor.submit(task));
        Callable<T> guarded = CircuitBreaker.decorateCallable(circuitBreaker,
                Bulkhead.decorateCallable(bulkhead, timed));
        if (call.retryable()) {
            guarded = Retry.decorateCallable(retryRegistry.retry(target), guarded);
        }

        try {
            return guarded.call();
        } catch (BusinessException e) {
            log.warn("Outbound call rejected: target={}, operation={}, code={}",
                    target, call.operation(), e.getErrorCode());
            throw e;
        } catch (CallNotPermittedException e) {
            log.warn("Circuit breaker open, failing fast: target={}, operation={}", target, call.operation());
            throw new DependencyUnavailableException(target, "circuit breaker open", e);
        } catch (BulkheadFullException e) {
            log.warn("Bulkhead full: target={}, operation={}", target, call.operation());
            throw new DependencyUnavailableException(target, "too many concurrent calls", e);
        } catch (TimeoutException e) {
            log.warn("Outbound call timed out: target={}, operation={}", target, call.operation());
            throw new DependencyUnavailableException(target, "timeout", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DependencyUnavailableException(target, "interrupted", e);
        } catch (Exception e) {
            Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
            if (cause instanceof BusinessException businessException) {
                throw businessException;
            }
            log.warn("Outbound call failed: target={}, operation={}, error={}",
                    target, call.operation(), cause.toString());
            throw new DependencyUnavailableException(target, cause.getClass().getSimpleName(), cause);
        }
    }
}
