package com.shopflow.common.exception;

import lombok.Getter;

/**
 * 하위 서비스 호출 불가 예외 (Dependency Unavailable)
 *
 * <p>재시도 소진, 타임아웃, 서킷 브레이커 OPEN, Bulkhead 포화로 호출이 끝내 실패했을 때
 * ResilientCaller가 던진다. 호출 대상(target)과 원인을 함께 보존한다.</p>
 *
 * ★ Terminal outcome of an outbound call once the resilience policy is exhausted.
 */
@Getter
public class DependencyUnavailableException extends RuntimeException {

    private final String target;       // 호출 대상 서비스 이름 (예: "inventory-service")

    public DependencyUnavailableException(String target, String reason, Throwable cause) {
        super(target + " unavailable: " + reason, cause);
        this.target = target;
    }
}
