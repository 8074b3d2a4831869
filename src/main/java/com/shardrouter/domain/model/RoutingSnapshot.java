package com.shardrouter.domain.model;

import java.util.Objects;

/**
 * Immutable view of the routing state of the current thread.
 */
public record RoutingSnapshot(
    boolean inTransaction,
    boolean inMigration,
    ForcedTarget forcedTarget,
    ShardKey selectedShard
) {
    public static final RoutingSnapshot EMPTY = new RoutingSnapshot(false, false, ForcedTarget.NONE, null);

    public RoutingSnapshot {
        Objects.requireNonNull(forcedTarget, "forcedTarget");
    }

    public RoutingSnapshot withTransaction() {
        return new RoutingSnapshot(true, inMigration, forcedTarget, selectedShard);
    }

    public RoutingSnapshot withMigration() {
        return new RoutingSnapshot(inTransaction, true, forcedTarget, selectedShard);
    }

    public RoutingSnapshot withForcedTarget(ForcedTarget target) {
        return new RoutingSnapshot(inTransaction, inMigration, target, selectedShard);
    }

    public RoutingSnapshot withSelectedShard(ShardKey shardKey) {
        return new RoutingSnapshot(inTransaction, inMigration, forcedTarget, shardKey);
    }
}
