package com.shardrouter.domain.model;

/**
 * Role of a physical connection within a shard.
 */
public enum Role {
    /** Writable, authoritative connection. */
    PRIMARY,
    /** Read-only, possibly lagging copy. */
    REPLICA;

    public String label() {
        return name().toLowerCase();
    }
}
