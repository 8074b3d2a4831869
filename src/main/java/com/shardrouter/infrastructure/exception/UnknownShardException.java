package com.shardrouter.infrastructure.exception;

import com.shardrouter.domain.model.ShardKey;

public class UnknownShardException extends RoutingException {

    private final ShardKey shardKey;

    public UnknownShardException(ShardKey shardKey) {
        super("SHARD_UNKNOWN", "Shard not registered in topology: " + shardKey);
        this.shardKey = shardKey;
    }

    public ShardKey getShardKey() {
        return shardKey;
    }
}
