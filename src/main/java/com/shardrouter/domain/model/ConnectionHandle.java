package com.shardrouter.domain.model;

import java.util.Objects;

/**
 * Opaque identifier of a physical database connection.
 * Two handles with the same coordinates and credentials are the same connection.
 */
public record ConnectionHandle(
    String host,
    int port,
    String database,
    String username,
    String password
) {
    public ConnectionHandle {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(database, "database");
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("Port out of range: " + port);
        }
    }

    /**
     * Human-readable location without credentials, e.g. {@code db-1:5432/app_replica}.
     */
    public String describe() {
        return host + ":" + port + "/" + database;
    }

    @Override
    public String toString() {
        return "ConnectionHandle[" + (username != null ? username + "@" : "") + describe() + "]";
    }
}
