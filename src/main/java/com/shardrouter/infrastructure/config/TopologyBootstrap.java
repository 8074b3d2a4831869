package com.shardrouter.infrastructure.config;

import com.shardrouter.application.port.in.RegisterTopologyUseCase;
import com.shardrouter.domain.model.ConnectionHandle;
import com.shardrouter.domain.model.ModelId;
import com.shardrouter.domain.model.ModelRoutingPolicy;
import com.shardrouter.domain.model.ShardKey;
import com.shardrouter.domain.model.ShardKeyResolver;
import com.shardrouter.infrastructure.exception.ConfigurationException;
import com.shardrouter.infrastructure.sharding.ShardingProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Translates {@link ShardingProperties} into shard and model registrations.
 * Runs once while the application context starts; any inconsistency aborts startup.
 */
public class TopologyBootstrap {

    private static final Logger log = LoggerFactory.getLogger(TopologyBootstrap.class);

    private final ShardingProperties properties;

    public TopologyBootstrap(ShardingProperties properties) {
        this.properties = properties;
    }

    public void applyTo(RegisterTopologyUseCase registry) {
        ShardKey defaultShard = parseShardKey(properties.getDefaultShard());
        if (!properties.getShards().containsKey(defaultShard.value())) {
            throw new ConfigurationException("Default shard '" + defaultShard + "' is not configured under routing.shards");
        }

        List<ShardKey> partitions = new ArrayList<>();
        for (Map.Entry<String, ShardingProperties.Shard> entry : properties.getShards().entrySet()) {
            ShardKey key = parseShardKey(entry.getKey());
            ShardingProperties.Shard shard = entry.getValue();
            if (shard.getPrimary() == null) {
                throw new ConfigurationException("Shard '" + key + "' has no primary");
            }
            registry.registerShard(key, toHandle(shard.getPrimary()),
                shard.getReplica() != null ? toHandle(shard.getReplica()) : null);
            if (!key.equals(defaultShard)) {
                partitions.add(key);
            }
        }
        partitions.sort(null);

        // Join models are registered after the models they inherit from
        List<Map.Entry<String, ShardingProperties.Model>> joinModels = new ArrayList<>();
        for (Map.Entry<String, ShardingProperties.Model> entry : properties.getModels().entrySet()) {
            if (entry.getValue().getInheritFrom() != null) {
                joinModels.add(entry);
                continue;
            }
            registry.registerModelPolicy(toPolicy(parseModelId(entry.getKey()), entry.getValue(), partitions));
        }
        for (Map.Entry<String, ShardingProperties.Model> entry : joinModels) {
            registry.registerJoinModel(parseModelId(entry.getKey()), parseModelId(entry.getValue().getInheritFrom()));
        }

        log.info("Routing topology loaded: default shard {}, {} sharded partitions, {} models",
            defaultShard, partitions.size(), properties.getModels().size());
    }

    private ModelRoutingPolicy toPolicy(ModelId modelId, ShardingProperties.Model model, List<ShardKey> partitions) {
        if (!model.isSharded()) {
            return ModelRoutingPolicy.unsharded(modelId, model.isReplicaByDefault());
        }
        ShardKeyResolver resolver = ShardKeyResolver.selectedShard();
        String attribute = model.getShardAttribute();
        if (attribute != null && !attribute.isBlank()) {
            ShardKeyResolver fromRecord = switch (model.getShardStrategy()) {
                case DIRECT -> ShardKeyResolver.fromAttribute(attribute);
                case HASHED -> {
                    if (partitions.isEmpty()) {
                        throw new ConfigurationException(
                            "Model " + modelId + " uses hashed placement but no sharded partitions are configured");
                    }
                    yield ShardKeyResolver.hashed(attribute, partitions);
                }
            };
            resolver = fromRecord.orElse(resolver);
        }
        return ModelRoutingPolicy.sharded(modelId, model.isReplicaByDefault(), resolver);
    }

    private ConnectionHandle toHandle(ShardingProperties.Endpoint endpoint) {
        return new ConnectionHandle(
            endpoint.getHost(),
            endpoint.getPort(),
            endpoint.getDatabase(),
            endpoint.getUsername(),
            endpoint.getPassword()
        );
    }

    private static ShardKey parseShardKey(String value) {
        return ShardKey.parse(value)
            .getOrThrow(error -> new ConfigurationException(error.message()));
    }

    private static ModelId parseModelId(String value) {
        return ModelId.parse(value)
            .getOrThrow(error -> new ConfigurationException(error.message()));
    }
}
