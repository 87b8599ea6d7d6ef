package com.shopflow.gateway.routing;

/**
 * 라우팅 엔트리 - 서비스 하나의 경로 접두사, 기본 주소, 헬스 상태.
 *
 * <p>불변 값이다. 헬스 체크 결과는 {@link #afterProbe}로 새 엔트리를 만들어
 * {@link RoutingTable}의 스냅샷을 통째로 교체하는 방식으로 반영된다.</p>
 *
 * @param serviceName         논리 서비스 이름 (예: "order-service")
 * @param pathPrefix          담당 경로 접두사 (예: "/orders"), 끝의 '/'는 제거된 형태
 * @param baseAddress         정적 기본 주소 (예: "http://localhost:8081")
 * @param healthStatus        현재 헬스 상태
 * @param consecutiveFailures 마지막 성공 이후 연속 프로브 실패 횟수
 */
public record RoutingEntry(
        String serviceName,
        String pathPrefix,
        String baseAddress,
        HealthStatus healthStatus,
        int consecutiveFailures
) {

    public static RoutingEntry initial(String serviceName, String pathPrefix, String baseAddress) {
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be blank");
        }
        if (pathPrefix == null || !pathPrefix.startsWith("/")) {
            throw new IllegalArgumentException("pathPrefix must start with '/': service=" + serviceName);
        }
        return new RoutingEntry(serviceName, normalize(pathPrefix), baseAddress, HealthStatus.UNKNOWN, 0);
    }

    /**
     * 경로가 이 엔트리의 접두사에 세그먼트 단위로 일치하는지.
     * "/orders"는 "/orders", "/orders/1"과 일치하고 "/orders-archive"와는 일치하지 않는다.
     */
    public boolean matches(String path) {
        if (pathPrefix.isEmpty()) {
            return true;
        }
        if (!path.startsWith(pathPrefix)) {
            return false;
        }
        return path.length() == pathPrefix.length() || path.charAt(pathPrefix.length()) == '/';
    }

    /** DOWN이 아니면 요청을 보낸다 (UNKNOWN 포함) */
    public boolean isAvailable() {
        return healthStatus != HealthStatus.DOWN;
    }

    /**
     * 프로브 결과 반영.
     * 성공 → UP, 실패 → 연속 실패 수 증가, 임계치 도달 시 DOWN (미도달이면 상태 유지).
     */
    public RoutingEntry afterProbe(boolean success, int failureThreshold) {
        if (success) {
            return new RoutingEntry(serviceName, pathPrefix, baseAddress, HealthStatus.UP, 0);
        }
        int failures = consecutiveFailures + 1;
        HealthStatus status = failures >= failureThreshold ? HealthStatus.DOWN : healthStatus;
        return new RoutingEntry(serviceName, pathPrefix, baseAddress, status, failures);
    }

    private static String normalize(String prefix) {
        String normalized = prefix;
        while (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized;
    }
}
