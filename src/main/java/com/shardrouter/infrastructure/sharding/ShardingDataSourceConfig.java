package com.shardrouter.infrastructure.sharding;

import com.shardrouter.application.port.out.ConnectionPoolPort;
import com.shardrouter.application.service.ShardRegistry;
import com.shardrouter.domain.model.ConnectionHandle;
import com.shardrouter.infrastructure.context.ConnectionBinding;
import com.shardrouter.infrastructure.context.RoutingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.util.HashMap;
import java.util.Map;

/**
 * Exposes the routed DataSource as the application's primary DataSource, so JdbcTemplate and
 * the transaction manager go through the routing decisions.
 */
@Configuration
public class ShardingDataSourceConfig {

    private static final Logger log = LoggerFactory.getLogger(ShardingDataSourceConfig.class);

    @Bean
    @Primary
    public RoutingDataSource dataSource(
            ShardRegistry registry,
            ConnectionPoolPort pools,
            RoutingContext routingContext,
            ConnectionBinding binding) {
        RoutingDataSource routingDataSource = new RoutingDataSource(registry, pools, routingContext, binding);

        Map<Object, Object> targetDataSources = new HashMap<>();
        for (ConnectionHandle handle : registry.allHandles()) {
            targetDataSources.put(handle, pools.dataSourceFor(handle));
        }
        routingDataSource.setTargetDataSources(targetDataSources);
        routingDataSource.afterPropertiesSet();

        log.info("Routing DataSource ready with {} connection handles", targetDataSources.size());
        return routingDataSource;
    }
}
