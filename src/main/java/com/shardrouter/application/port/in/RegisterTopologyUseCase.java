package com.shardrouter.application.port.in;

import com.shardrouter.domain.model.ConnectionHandle;
import com.shardrouter.domain.model.ModelId;
import com.shardrouter.domain.model.ModelRoutingPolicy;
import com.shardrouter.domain.model.ShardKey;

public interface RegisterTopologyUseCase {

    void registerShard(ShardKey key, ConnectionHandle primary, ConnectionHandle replica);

    void registerShard(ShardKey key, ConnectionHandle primary);

    void registerModelPolicy(ModelRoutingPolicy policy);

    void registerJoinModel(ModelId joinModelId, ModelId leftModelId);
}
