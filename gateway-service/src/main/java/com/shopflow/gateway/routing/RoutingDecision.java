package com.shopflow.gateway.routing;

/**
 * 요청 하나에 대한 라우팅 결정.
 *
 * @param method      HTTP 메서드
 * @param path        요청 경로
 * @param serviceName 선택된 서비스 (NOT_FOUND면 null)
 * @param outcome     결정 결과
 */
public record RoutingDecision(String method, String path, String serviceName, Outcome outcome) {

    public enum Outcome {
        ROUTED,        // 백엔드로 전달
        NOT_FOUND,     // 일치하는 접두사 없음 → 404
        SERVICE_DOWN,  // 헬스 상태 DOWN → 503, 백엔드 호출 없음
        NO_INSTANCE    // 레지스트리에서 주소를 찾지 못함 → 503
    }
}
