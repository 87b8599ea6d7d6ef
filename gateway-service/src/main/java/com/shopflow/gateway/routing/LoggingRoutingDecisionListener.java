package com.shopflow.gateway.routing;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class LoggingRoutingDecisionListener implements RoutingDecisionListener {

    @Override
    public void onDecision(RoutingDecision decision) {
        if (decision.outcome() == RoutingDecision.Outcome.ROUTED) {
            log.debug("Routing decision: method={}, path={}, service={}, outcome={}",
                    decision.method(), decision.path(), decision.serviceName(), decision.outcome());
        } else {
            log.warn("Routing decision: method={}, path={}, service={}, outcome={}",
                    decision.method(), decision.path(), decision.serviceName(), decision.outcome());
        }
    }
}
