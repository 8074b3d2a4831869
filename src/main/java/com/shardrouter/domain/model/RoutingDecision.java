package com.shardrouter.domain.model;

/**
 * Outcome of routing one operation: the connection to use and why.
 */
public record RoutingDecision(
    ModelId modelId,
    OperationKind operation,
    Role role,
    ShardKey shardKey,
    ConnectionHandle handle,
    DecisionReason reason
) {}
