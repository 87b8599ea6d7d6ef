package com.shopflow.gateway.routing;

/**
 * 라우팅 결정 관찰 지점. 로그, 메트릭 등 관측 파이프라인이 여기에 붙는다.
 * 구현체는 요청 경로에서 호출되므로 블로킹하지 않아야 한다.
 */
public interface RoutingDecisionListener {

    void onDecision(RoutingDecision decision);
}
