package com.shardrouter.application.port.in;

import com.shardrouter.domain.model.ConnectionHandle;
import com.shardrouter.domain.model.ModelId;
import com.shardrouter.domain.model.OperationKind;
import com.shardrouter.domain.model.RecordContext;
import com.shardrouter.domain.model.RoutingDecision;

public interface DecideConnectionUseCase {

    ConnectionHandle decide(ModelId modelId, OperationKind operation);

    ConnectionHandle decide(ModelId modelId, OperationKind operation, RecordContext record);

    /**
     * Same as {@link #decide(ModelId, OperationKind, RecordContext)} but reports the role,
     * shard and the rule that settled the decision.
     */
    RoutingDecision explain(ModelId modelId, OperationKind operation, RecordContext record);
}
