package com.shardrouter.application.port.out;

import com.shardrouter.domain.model.RoutingDecision;

/**
 * Port for recording routing metrics.
 * Abstracts the metrics infrastructure from the decision engine.
 */
public interface RoutingMetricsPort {

    void recordDecision(RoutingDecision decision);

    void recordFailure(String errorCode);
}
