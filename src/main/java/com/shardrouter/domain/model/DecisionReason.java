package com.shardrouter.domain.model;

/**
 * The rule that settled a routing decision, in priority order.
 */
public enum DecisionReason {
    MIGRATION,
    EXPLICIT_OVERRIDE,
    TRANSACTION,
    FORCED_BLOCK,
    WRITE,
    REPLICA_DEFAULT,
    PRIMARY_DEFAULT;

    public String label() {
        return name().toLowerCase();
    }
}
