package com.shopflow.gateway.routing;

/**
 * 라우팅 엔트리의 헬스 상태.
 * 기동 시 UNKNOWN, 프로브 성공 시 UP, 연속 실패가 임계치에 도달하면 DOWN.
 */
public enum HealthStatus {
    UP,
    DOWN,
    UNKNOWN
}
