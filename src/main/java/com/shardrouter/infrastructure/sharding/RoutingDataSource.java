package com.shardrouter.infrastructure.sharding;

import com.shardrouter.application.port.out.ConnectionPoolPort;
import com.shardrouter.application.service.ShardRegistry;
import com.shardrouter.domain.model.ConnectionHandle;
import com.shardrouter.domain.model.Role;
import com.shardrouter.domain.model.RoutingDecision;
import com.shardrouter.domain.model.ShardKey;
import com.shardrouter.infrastructure.context.ConnectionBinding;
import com.shardrouter.infrastructure.context.RoutingContext;
import org.springframework.jdbc.datasource.ConnectionHolder;
import org.springframework.jdbc.datasource.lookup.AbstractRoutingDataSource;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.WeakHashMap;

/**
 * A DataSource that hands out connections of the handle bound by {@link RoutingTemplate}.
 * Without a binding (plain JdbcTemplate use, transaction begin) it serves the primary of the
 * selected shard, falling back to the default shard.
 *
 * Remembers which handle each open connection came from, so a transaction-bound connection
 * can be checked against later routing decisions.
 */
public class RoutingDataSource extends AbstractRoutingDataSource {

    private final ShardRegistry registry;
    private final ConnectionPoolPort pools;
    private final RoutingContext routingContext;
    private final ConnectionBinding binding;
    private final Map<Connection, ConnectionHandle> handedOut = Collections.synchronizedMap(new WeakHashMap<>());

    public RoutingDataSource(
            ShardRegistry registry,
            ConnectionPoolPort pools,
            RoutingContext routingContext,
            ConnectionBinding binding) {
        this.registry = registry;
        this.pools = pools;
        this.routingContext = routingContext;
        this.binding = binding;
    }

    @Override
    protected Object determineCurrentLookupKey() {
        return currentHandle();
    }

    // The startup target map does not contain shards registered later
    @Override
    protected DataSource determineTargetDataSource() {
        return pools.dataSourceFor(currentHandle());
    }

    @Override
    public Connection getConnection() throws SQLException {
        ConnectionHandle handle = currentHandle();
        return remember(pools.dataSourceFor(handle).getConnection(), handle);
    }

    @Override
    public Connection getConnection(String username, String password) throws SQLException {
        ConnectionHandle handle = currentHandle();
        return remember(pools.dataSourceFor(handle).getConnection(username, password), handle);
    }

    /**
     * The handle an open connection obtained from this DataSource belongs to.
     */
    public Optional<ConnectionHandle> handleOf(Connection connection) {
        return Optional.ofNullable(handedOut.get(connection));
    }

    /**
     * The handle of the connection bound to the current thread's transaction, if one is bound
     * for this DataSource.
     */
    public Optional<ConnectionHandle> transactionHandle() {
        if (TransactionSynchronizationManager.getResource(this) instanceof ConnectionHolder holder) {
            return handleOf(holder.getConnection());
        }
        return Optional.empty();
    }

    private ConnectionHandle currentHandle() {
        RoutingDecision bound = binding.get();
        if (bound != null) {
            return bound.handle();
        }
        ShardKey selected = routingContext.current().selectedShard();
        return registry.connectionFor(selected != null ? selected : registry.defaultShard(), Role.PRIMARY);
    }

    private Connection remember(Connection connection, ConnectionHandle handle) {
        handedOut.put(connection, handle);
        return connection;
    }
}
