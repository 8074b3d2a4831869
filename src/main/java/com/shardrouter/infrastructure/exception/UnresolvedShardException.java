package com.shardrouter.infrastructure.exception;

import com.shardrouter.domain.model.ModelId;

/**
 * No single shard key can be derived for a model: it is unregistered, the record lacks
 * the sharding attribute, or the record and the selected shard disagree.
 */
public class UnresolvedShardException extends RoutingException {

    private final ModelId modelId;

    public UnresolvedShardException(ModelId modelId, String reason) {
        super("SHARD_UNRESOLVED", "Cannot resolve shard for model " + modelId + ": " + reason);
        this.modelId = modelId;
    }

    public ModelId getModelId() {
        return modelId;
    }
}
