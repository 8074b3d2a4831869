package com.shardrouter.infrastructure.metrics;

import com.shardrouter.application.port.out.RoutingMetricsPort;
import com.shardrouter.domain.model.RoutingDecision;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class RoutingMetrics implements RoutingMetricsPort {

    static final String DECISIONS = "routing_decisions_total";
    static final String FAILURES = "routing_failures_total";

    private final MeterRegistry registry;

    public RoutingMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void recordDecision(RoutingDecision decision) {
        // The registry caches meters per name and tag set
        Counter.builder(DECISIONS)
            .description("Routing decisions by connection role and deciding rule")
            .tag("role", decision.role().label())
            .tag("reason", decision.reason().label())
            .register(registry)
            .increment();
    }

    @Override
    public void recordFailure(String errorCode) {
        Counter.builder(FAILURES)
            .description("Routing decisions that failed to resolve a connection")
            .tag("error", errorCode)
            .register(registry)
            .increment();
    }
}
