package com.shardrouter.application.service;

import com.shardrouter.application.port.in.DescribeTopologyUseCase;
import com.shardrouter.application.port.in.RegisterTopologyUseCase;
import com.shardrouter.domain.model.ConnectionHandle;
import com.shardrouter.domain.model.ModelId;
import com.shardrouter.domain.model.ModelRoutingPolicy;
import com.shardrouter.domain.model.RecordContext;
import com.shardrouter.domain.model.Role;
import com.shardrouter.domain.model.ShardConnections;
import com.shardrouter.domain.model.ShardKey;
import com.shardrouter.infrastructure.exception.ConfigurationException;
import com.shardrouter.infrastructure.exception.UnknownShardException;
import com.shardrouter.infrastructure.exception.UnresolvedShardException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Static topology (shard key and role to connection) and per-model routing policies.
 *
 * Lookups are lock-free. Registrations are serialized, so shards or models may also be
 * registered after startup while other threads are routing.
 */
public class ShardRegistry implements RegisterTopologyUseCase, DescribeTopologyUseCase {

    private static final Logger log = LoggerFactory.getLogger(ShardRegistry.class);

    private final ShardKey defaultShard;
    private final Map<ShardKey, ShardConnections> shards = new ConcurrentHashMap<>();
    private final Map<ModelId, ModelRoutingPolicy> policies = new ConcurrentHashMap<>();
    private final Object registrationLock = new Object();

    public ShardRegistry(ShardKey defaultShard) {
        this.defaultShard = Objects.requireNonNull(defaultShard, "defaultShard");
    }

    public ShardRegistry() {
        this(ShardKey.DEFAULT);
    }

    @Override
    public void registerShard(ShardKey key, ConnectionHandle primary, ConnectionHandle replica) {
        Objects.requireNonNull(key, "key");
        ShardConnections connections = new ShardConnections(primary, replica);
        synchronized (registrationLock) {
            ShardConnections existing = shards.get(key);
            if (existing != null) {
                if (!existing.equals(connections)) {
                    throw new ConfigurationException(
                        "Shard " + key + " already registered with " + describe(existing)
                            + ", refusing " + describe(connections));
                }
                return;
            }
            shards.put(key, connections);
        }
        log.info("Registered shard {}: {}", key, describe(connections));
    }

    @Override
    public void registerShard(ShardKey key, ConnectionHandle primary) {
        registerShard(key, primary, null);
    }

    @Override
    public void registerModelPolicy(ModelRoutingPolicy policy) {
        Objects.requireNonNull(policy, "policy");
        synchronized (registrationLock) {
            ModelRoutingPolicy existing = policies.get(policy.modelId());
            if (existing != null) {
                if (!existing.equals(policy)) {
                    throw new ConfigurationException(
                        "Model " + policy.modelId() + " already registered with a different routing policy");
                }
                return;
            }
            policies.put(policy.modelId(), policy);
        }
        log.info("Registered model {}: sharded={}, replicaByDefault={}",
            policy.modelId(), policy.sharded(), policy.onReplicaByDefault());
    }

    @Override
    public void registerJoinModel(ModelId joinModelId, ModelId leftModelId) {
        ModelRoutingPolicy left = policies.get(leftModelId);
        if (left == null) {
            throw new ConfigurationException(
                "Join model " + joinModelId + " refers to unregistered model " + leftModelId);
        }
        registerModelPolicy(ModelRoutingPolicy.joinModelOf(joinModelId, left));
    }

    public Optional<ModelRoutingPolicy> findPolicy(ModelId modelId) {
        return Optional.ofNullable(policies.get(modelId));
    }

    /**
     * @throws UnresolvedShardException if the model was never registered
     */
    public ModelRoutingPolicy policyFor(ModelId modelId) {
        ModelRoutingPolicy policy = policies.get(modelId);
        if (policy == null) {
            throw new UnresolvedShardException(modelId, "model has no registered routing policy");
        }
        return policy;
    }

    /**
     * Resolves the single shard a model's record lives on.
     * Unsharded models always live on the default shard.
     *
     * @throws UnresolvedShardException if the model is unregistered, the key cannot be derived,
     *                                  or the record and the selected shard disagree
     */
    public ShardKey resolveShardKey(ModelId modelId, RecordContext record) {
        ModelRoutingPolicy policy = policyFor(modelId);
        if (!policy.sharded()) {
            return defaultShard;
        }
        RecordContext context = record != null ? record : RecordContext.empty();
        ShardKey resolved = policy.shardKeyResolver().resolve(context)
            .orElseThrow(() -> new UnresolvedShardException(modelId,
                "no shard key derivable from record and no shard selected"));
        if (context.selectedShard() != null && !context.selectedShard().equals(resolved)) {
            throw new UnresolvedShardException(modelId,
                "record belongs to " + resolved + " but shard " + context.selectedShard() + " is selected");
        }
        return resolved;
    }

    /**
     * @throws UnknownShardException if the key was never registered
     */
    public ConnectionHandle connectionFor(ShardKey key, Role role) {
        ShardConnections connections = shards.get(key);
        if (connections == null) {
            throw new UnknownShardException(key);
        }
        return connections.handleFor(role);
    }

    public ShardKey defaultShard() {
        return defaultShard;
    }

    /**
     * Keys of the sharded partitions, sorted, without the default shard.
     */
    public List<ShardKey> shardKeys() {
        return shards.keySet().stream()
            .filter(key -> !key.equals(defaultShard))
            .sorted()
            .toList();
    }

    public Set<ConnectionHandle> allHandles() {
        return shards.values().stream()
            .flatMap(connections -> List.of(connections.primary(), connections.replica()).stream())
            .collect(Collectors.toSet());
    }

    @Override
    public Topology describeTopology() {
        Map<ShardKey, ShardConnections> orderedShards = new LinkedHashMap<>();
        shards.entrySet().stream()
            .sorted(Map.Entry.comparingByKey())
            .forEach(entry -> orderedShards.put(entry.getKey(), entry.getValue()));
        List<ModelRoutingPolicy> models = policies.values().stream()
            .sorted(Comparator.comparing(policy -> policy.modelId().value()))
            .toList();
        return new Topology(defaultShard, orderedShards, models);
    }

    private static String describe(ShardConnections connections) {
        return "primary=" + connections.primary().describe()
            + (connections.hasDedicatedReplica() ? ", replica=" + connections.replica().describe() : ", no replica");
    }
}
