package com.shopflow.common.resilience;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Resilience Wrapper를 통과하는 아웃바운드 호출 한 건.
 *
 * <p>재시도 가능 여부는 호출 자체의 성질로 결정된다:
 * 멱등 호출(idempotent)이거나 멱등성 키(idempotencyKey)를 가진 호출만 재시도한다.
 * 그 외 호출은 한 번만 시도하고, 실패하면 바로 DependencyUnavailable로 끝난다.</p>
 *
 * @param target         호출 대상 이름 - Resilience4j 인스턴스 이름으로도 사용 (예: "billing-service")
 * @param operation      로그용 연산 이름 (예: "charge")
 * @param action         실제 네트워크 호출
 * @param idempotent     같은 요청을 반복해도 결과가 같은지 여부
 * @param idempotencyKey 하위 서비스가 중복 제거에 사용하는 키 (없으면 null)
 */
public record OutboundCall<T>(
        String target,
        String operation,
        Supplier<T> action,
        boolean idempotent,
        String idempotencyKey
) {
    public OutboundCall {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(action, "action");
    }

    /** 멱등 호출 (예: orderId 기준 reserve/release) */
    public static <T> OutboundCall<T> idempotent(String target, String operation, Supplier<T> action) {
        return new OutboundCall<>(target, operation, action, true, null);
    }

    /** 멱등성 키로 중복 제거되는 호출 (예: charge) */
    public static <T> OutboundCall<T> withIdempotencyKey(String target, String operation,
                                                         String idempotencyKey, Supplier<T> action) {
        Objects.requireNonNull(idempotencyKey, "idempotencyKey");
        return new OutboundCall<>(target, operation, action, false, idempotencyKey);
    }

    /** 재시도하면 안 되는 호출 */
    public static <T> OutboundCall<T> once(String target, String operation, Supplier<T> action) {
        return new OutboundCall<>(target, operation, action, false, null);
    }

    public boolean retryable() {
        return idempotent || idempotencyKey != null;
    }
}
