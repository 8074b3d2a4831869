package com.shardrouter.domain.model;

import java.util.Objects;

/**
 * Per-model routing configuration, fixed when the model is registered.
 */
public record ModelRoutingPolicy(
    ModelId modelId,
    boolean sharded,
    boolean onReplicaByDefault,
    ShardKeyResolver shardKeyResolver
) {
    public ModelRoutingPolicy {
        Objects.requireNonNull(modelId, "modelId");
        if (sharded && shardKeyResolver == null) {
            shardKeyResolver = ShardKeyResolver.selectedShard();
        }
        if (!sharded) {
            shardKeyResolver = null;
        }
    }

    public static ModelRoutingPolicy unsharded(ModelId modelId, boolean onReplicaByDefault) {
        return new ModelRoutingPolicy(modelId, false, onReplicaByDefault, null);
    }

    public static ModelRoutingPolicy sharded(ModelId modelId, boolean onReplicaByDefault, ShardKeyResolver resolver) {
        return new ModelRoutingPolicy(modelId, true, onReplicaByDefault, resolver);
    }

    /**
     * Policy of a join model between {@code left} and another model: it reads from the
     * replica when the left-hand model does, and is sharded exactly when the left-hand model is.
     */
    public static ModelRoutingPolicy joinModelOf(ModelId joinModelId, ModelRoutingPolicy left) {
        return new ModelRoutingPolicy(joinModelId, left.sharded(), left.onReplicaByDefault(), left.shardKeyResolver());
    }
}
