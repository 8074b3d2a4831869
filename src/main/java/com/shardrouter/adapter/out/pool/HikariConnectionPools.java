package com.shardrouter.adapter.out.pool;

import com.shardrouter.application.port.out.ConnectionPoolPort;
import com.shardrouter.domain.model.ConnectionHandle;
import com.shardrouter.infrastructure.sharding.ShardingProperties;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One HikariCP pool per connection handle, created on first use.
 * Pools open their physical connections lazily, so building them does not touch the database.
 */
@Component
public class HikariConnectionPools implements ConnectionPoolPort, DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(HikariConnectionPools.class);

    private final ShardingProperties shardingProperties;
    private final Map<ConnectionHandle, HikariDataSource> pools = new ConcurrentHashMap<>();

    public HikariConnectionPools(ShardingProperties shardingProperties) {
        this.shardingProperties = shardingProperties;
    }

    @Override
    public DataSource dataSourceFor(ConnectionHandle handle) {
        return pools.computeIfAbsent(handle, this::createPool);
    }

    String jdbcUrl(ConnectionHandle handle) {
        return "jdbc:" + shardingProperties.getJdbcSubprotocol() + "://"
            + handle.host() + ":" + handle.port() + "/" + handle.database();
    }

    private HikariDataSource createPool(ConnectionHandle handle) {
        ShardingProperties.Pool poolConfig = shardingProperties.getPool();
        HikariDataSource dataSource = new HikariDataSource();
        dataSource.setJdbcUrl(jdbcUrl(handle));
        dataSource.setUsername(handle.username());
        dataSource.setPassword(handle.password());
        dataSource.setMaximumPoolSize(poolConfig.getMaxPoolSize());
        dataSource.setMinimumIdle(poolConfig.getMinIdle());
        dataSource.setPoolName("pool-" + handle.database() + "@" + handle.host() + "-" + handle.port());
        log.info("Configured connection pool {} for {}", dataSource.getPoolName(), handle.describe());
        return dataSource;
    }

    @Override
    public void destroy() {
        pools.values().forEach(HikariDataSource::close);
        log.info("Closed {} connection pools", pools.size());
        pools.clear();
    }
}
