package com.shardrouter.infrastructure.context;

import com.shardrouter.application.port.in.RoutingScopeUseCase;
import com.shardrouter.domain.model.ForcedTarget;
import com.shardrouter.domain.model.RoutingSnapshot;
import com.shardrouter.domain.model.ShardKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Thread-confined routing state: transaction, migration, forced block and selected shard.
 * Each scope remembers the snapshot it replaced and puts it back on close, so nesting
 * unwinds exactly, including when the enclosed code throws.
 */
@Component
public class RoutingContext implements RoutingScopeUseCase {

    private static final Logger log = LoggerFactory.getLogger(RoutingContext.class);

    private final ThreadLocal<RoutingSnapshot> state = ThreadLocal.withInitial(() -> RoutingSnapshot.EMPTY);

    @Override
    public RoutingScope enterTransaction() {
        return push("transaction", RoutingSnapshot::withTransaction);
    }

    @Override
    public RoutingScope enterMigration() {
        return push("migration", RoutingSnapshot::withMigration);
    }

    @Override
    public RoutingScope enterForced(ForcedTarget target) {
        Objects.requireNonNull(target, "target");
        return push("forced:" + target, snapshot -> snapshot.withForcedTarget(target));
    }

    @Override
    public RoutingScope enterShard(ShardKey shardKey) {
        Objects.requireNonNull(shardKey, "shardKey");
        return push("shard:" + shardKey, snapshot -> snapshot.withSelectedShard(shardKey));
    }

    @Override
    public RoutingSnapshot current() {
        return state.get();
    }

    /**
     * Drops all state of the current thread. Called when a pooled thread finishes a request.
     */
    public void clear() {
        state.remove();
    }

    private RoutingScope push(String name, UnaryOperator<RoutingSnapshot> change) {
        RoutingSnapshot previous = state.get();
        RoutingSnapshot applied = change.apply(previous);
        state.set(applied);
        log.trace("Entered {} scope: {}", name, applied);
        return new Scope(name, previous, applied, Thread.currentThread());
    }

    private final class Scope implements RoutingScope {

        private final String name;
        private final RoutingSnapshot previous;
        private final RoutingSnapshot applied;
        private final Thread owner;
        private boolean closed;

        private Scope(String name, RoutingSnapshot previous, RoutingSnapshot applied, Thread owner) {
            this.name = name;
            this.previous = previous;
            this.applied = applied;
            this.owner = owner;
        }

        @Override
        public void close() {
            if (Thread.currentThread() != owner) {
                throw new IllegalStateException(
                    "Routing scope '" + name + "' entered on " + owner.getName()
                        + " cannot be closed on " + Thread.currentThread().getName());
            }
            if (closed) {
                return;
            }
            closed = true;
            if (state.get() != applied) {
                log.warn("Routing scope '{}' closed out of order; restoring {}", name, previous);
            }
            state.set(previous);
            log.trace("Left {} scope: {}", name, previous);
        }
    }
}
