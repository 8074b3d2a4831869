package com.shardrouter.infrastructure.context;

import com.shardrouter.domain.model.RoutingDecision;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

/**
 * The routing decision the current thread is executing under.
 * Read by the routing DataSource when it hands out a connection, and mirrored into the MDC.
 */
@Component
public class ConnectionBinding {

    private static final String SHARD_KEY = "dbShard";
    private static final String ROLE_KEY = "dbRole";

    private final ThreadLocal<RoutingDecision> current = new ThreadLocal<>();

    /**
     * Binds a decision until the returned binding is closed, which re-binds whatever was bound before.
     */
    public Binding bind(RoutingDecision decision) {
        RoutingDecision previous = current.get();
        apply(decision);
        return () -> apply(previous);
    }

    public RoutingDecision get() {
        return current.get();
    }

    public void clear() {
        apply(null);
    }

    private void apply(RoutingDecision decision) {
        if (decision == null) {
            current.remove();
            MDC.remove(SHARD_KEY);
            MDC.remove(ROLE_KEY);
        } else {
            current.set(decision);
            MDC.put(SHARD_KEY, decision.shardKey().value());
            MDC.put(ROLE_KEY, decision.role().label());
        }
    }

    public interface Binding extends AutoCloseable {
        @Override
        void close();
    }
}
