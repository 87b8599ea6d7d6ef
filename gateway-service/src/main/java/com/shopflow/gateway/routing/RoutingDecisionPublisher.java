package com.shopflow.gateway.routing;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 등록된 모든 {@link RoutingDecisionListener}에 결정을 전달한다.
 * 리스너 하나의 실패가 요청 처리나 다른 리스너에 영향을 주지 않는다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RoutingDecisionPublisher {

    private final List<RoutingDecisionListener> listeners;

    public void publish(RoutingDecision decision) {
        for (RoutingDecisionListener listener : listeners) {
            try {
                listener.onDecision(decision);
            } catch (RuntimeException e) {
                log.warn("Routing decision listener failed: listener={}, error={}",
                        listener.getClass().getSimpleName(), e.toString());
            }
        }
    }
}
