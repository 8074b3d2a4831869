package com.shardrouter.domain.model;

import java.util.Objects;

/**
 * The primary/replica pair serving one shard.
 */
public record ShardConnections(ConnectionHandle primary, ConnectionHandle replica) {

    public ShardConnections {
        Objects.requireNonNull(primary, "primary");
        if (replica == null) {
            // Shards without a replica serve replica reads from the primary
            replica = primary;
        }
    }

    public ConnectionHandle handleFor(Role role) {
        return role == Role.PRIMARY ? primary : replica;
    }

    public boolean hasDedicatedReplica() {
        return !primary.equals(replica);
    }
}
