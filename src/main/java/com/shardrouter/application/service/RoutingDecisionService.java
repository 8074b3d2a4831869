package com.shardrouter.application.service;

import com.shardrouter.application.port.in.DecideConnectionUseCase;
import com.shardrouter.application.port.in.RoutingScopeUseCase;
import com.shardrouter.application.port.out.RoutingMetricsPort;
import com.shardrouter.domain.model.ConnectionHandle;
import com.shardrouter.domain.model.DecisionReason;
import com.shardrouter.domain.model.ModelId;
import com.shardrouter.domain.model.ModelRoutingPolicy;
import com.shardrouter.domain.model.OperationKind;
import com.shardrouter.domain.model.RecordContext;
import com.shardrouter.domain.model.Role;
import com.shardrouter.domain.model.RoutingDecision;
import com.shardrouter.domain.model.RoutingSnapshot;
import com.shardrouter.domain.model.ShardKey;
import com.shardrouter.infrastructure.exception.RoutingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Objects;

/**
 * Decides which physical connection serves an operation.
 *
 * Rules, first match wins:
 * <ol>
 *   <li>migration in progress: primary</li>
 *   <li>explicit per-call force: the forced role</li>
 *   <li>transaction in progress: primary</li>
 *   <li>enclosing forced block: its role (reads only, writes never go to a replica)</li>
 *   <li>write: primary</li>
 *   <li>read: replica if the model reads from replica by default, otherwise primary</li>
 * </ol>
 * The shard comes from the model policy. Resolution failures are never replaced by a default.
 */
@Service
public class RoutingDecisionService implements DecideConnectionUseCase {

    private static final Logger log = LoggerFactory.getLogger(RoutingDecisionService.class);

    private final ShardRegistry registry;
    private final RoutingScopeUseCase routingContext;
    private final RoutingMetricsPort metrics;

    public RoutingDecisionService(
            ShardRegistry registry,
            RoutingScopeUseCase routingContext,
            RoutingMetricsPort metrics) {
        this.registry = registry;
        this.routingContext = routingContext;
        this.metrics = metrics;
    }

    @Override
    public ConnectionHandle decide(ModelId modelId, OperationKind operation) {
        return explain(modelId, operation, RecordContext.empty()).handle();
    }

    @Override
    public ConnectionHandle decide(ModelId modelId, OperationKind operation, RecordContext record) {
        return explain(modelId, operation, record).handle();
    }

    @Override
    public RoutingDecision explain(ModelId modelId, OperationKind operation, RecordContext record) {
        Objects.requireNonNull(modelId, "modelId");
        Objects.requireNonNull(operation, "operation");
        RoutingSnapshot context = routingContext.current();
        try {
            ModelRoutingPolicy policy = registry.policyFor(modelId);
            DecisionReason reason = reasonFor(operation, context, policy);
            Role role = roleFor(reason, operation, context);

            RecordContext effectiveRecord = (record != null ? record : RecordContext.empty())
                .withSelectedShardIfAbsent(context.selectedShard());
            ShardKey shardKey = registry.resolveShardKey(modelId, effectiveRecord);
            ConnectionHandle handle = registry.connectionFor(shardKey, role);

            RoutingDecision decision = new RoutingDecision(modelId, operation, role, shardKey, handle, reason);
            log.debug("Routed {} {} to {} of shard {} ({})",
                operation.label(), modelId, role.label(), shardKey, reason.label());
            metrics.recordDecision(decision);
            return decision;
        } catch (RoutingException e) {
            log.warn("Routing failed for {} {}: {}", operation.label(), modelId, e.getMessage());
            metrics.recordFailure(e.getErrorCode());
            throw e;
        }
    }

    private static DecisionReason reasonFor(OperationKind operation, RoutingSnapshot context, ModelRoutingPolicy policy) {
        if (context.inMigration()) {
            return DecisionReason.MIGRATION;
        }
        if (operation.isForced()) {
            return DecisionReason.EXPLICIT_OVERRIDE;
        }
        if (context.inTransaction()) {
            return DecisionReason.TRANSACTION;
        }
        if (operation == OperationKind.WRITE) {
            return DecisionReason.WRITE;
        }
        if (context.forcedTarget().role().isPresent()) {
            return DecisionReason.FORCED_BLOCK;
        }
        return policy.onReplicaByDefault() ? DecisionReason.REPLICA_DEFAULT : DecisionReason.PRIMARY_DEFAULT;
    }

    private static Role roleFor(DecisionReason reason, OperationKind operation, RoutingSnapshot context) {
        return switch (reason) {
            case EXPLICIT_OVERRIDE -> operation.forcedRole();
            case FORCED_BLOCK -> context.forcedTarget().role().orElseThrow();
            case REPLICA_DEFAULT -> Role.REPLICA;
            case MIGRATION, TRANSACTION, WRITE, PRIMARY_DEFAULT -> Role.PRIMARY;
        };
    }
}
