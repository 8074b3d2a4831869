package com.shardrouter.application.port.in;

import com.shardrouter.domain.model.ForcedTarget;
import com.shardrouter.domain.model.RoutingSnapshot;
import com.shardrouter.domain.model.ShardKey;

/**
 * Scoped overrides of routing for the current thread.
 * Every {@code enter*} call returns a scope that must be closed, normally with try-with-resources.
 */
public interface RoutingScopeUseCase {

    RoutingScope enterTransaction();

    /**
     * Migration mode routes everything to primary, overriding transactions and forced blocks.
     */
    RoutingScope enterMigration();

    RoutingScope enterForced(ForcedTarget target);

    /**
     * Selects the shard used by sharded models that do not derive it from the record.
     */
    RoutingScope enterShard(ShardKey shardKey);

    RoutingSnapshot current();

    /**
     * Restores the state that was current before this scope was entered.
     */
    interface RoutingScope extends AutoCloseable {
        @Override
        void close();
    }
}
