package com.shardrouter.application.port.out;

import com.shardrouter.domain.model.ConnectionHandle;

import javax.sql.DataSource;

/**
 * Port to the pooled connections behind each handle.
 */
public interface ConnectionPoolPort {

    /**
     * Returns the pool for a handle, creating it on first use. Repeated calls return the same pool.
     */
    DataSource dataSourceFor(ConnectionHandle handle);
}
