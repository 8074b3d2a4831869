package com.shardrouter.application.port.in;

import com.shardrouter.domain.model.ModelRoutingPolicy;
import com.shardrouter.domain.model.ShardConnections;
import com.shardrouter.domain.model.ShardKey;

import java.util.List;
import java.util.Map;

public interface DescribeTopologyUseCase {

    Topology describeTopology();

    /**
     * Point-in-time copy of the registry, ordered by shard key and model id.
     */
    record Topology(
        ShardKey defaultShard,
        Map<ShardKey, ShardConnections> shards,
        List<ModelRoutingPolicy> models
    ) {}
}
