package com.shopflow.gateway.routing;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 라우팅 결정 카운터: {@code gateway_routing_decisions_total{service, outcome}} (Prometheus)
 */
@Component
@RequiredArgsConstructor
public class MicrometerRoutingDecisionListener implements RoutingDecisionListener {

    static final String METRIC_NAME = "gateway.routing.decisions";

    private final MeterRegistry meterRegistry;

    @Override
    public void onDecision(RoutingDecision decision) {
        Counter.builder(METRIC_NAME)
                .description("Gateway routing decisions by target service and outcome")
                .tag("service", decision.serviceName() != null ? decision.serviceName() : "none")
                .tag("outcome", decision.outcome().name())
                .register(meterRegistry)
                .increment();
    }
}
