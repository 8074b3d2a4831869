package com.shardrouter.infrastructure.config;

import com.shardrouter.application.service.ShardRegistry;
import com.shardrouter.domain.model.ShardKey;
import com.shardrouter.infrastructure.exception.ConfigurationException;
import com.shardrouter.infrastructure.sharding.ShardingProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TopologyConfig {

    @Bean
    public ShardRegistry shardRegistry(ShardingProperties shardingProperties) {
        ShardKey defaultShard = ShardKey.parse(shardingProperties.getDefaultShard())
            .getOrThrow(error -> new ConfigurationException(error.message()));
        ShardRegistry registry = new ShardRegistry(defaultShard);
        new TopologyBootstrap(shardingProperties).applyTo(registry);
        return registry;
    }
}
