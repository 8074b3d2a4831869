package com.shardrouter.infrastructure.sharding;

import com.shardrouter.application.port.in.DecideConnectionUseCase;
import com.shardrouter.application.port.in.RoutingScopeUseCase.RoutingScope;
import com.shardrouter.application.service.ShardRegistry;
import com.shardrouter.domain.model.ConnectionHandle;
import com.shardrouter.domain.model.ForcedTarget;
import com.shardrouter.domain.model.ModelId;
import com.shardrouter.domain.model.OperationKind;
import com.shardrouter.domain.model.RecordContext;
import com.shardrouter.domain.model.RoutingDecision;
import com.shardrouter.domain.model.ShardKey;
import com.shardrouter.infrastructure.context.ConnectionBinding;
import com.shardrouter.infrastructure.context.ConnectionBinding.Binding;
import com.shardrouter.infrastructure.context.RoutingContext;
import com.shardrouter.infrastructure.exception.TransactionConnectionMismatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Interception points for persistence code.
 *
 * Read and write entry points call {@link #read}, {@link #write} or {@link #execute}; the
 * decided connection is bound to the thread while the callback runs, so anything using the
 * routed DataSource inside it talks to that connection. Transaction, migration and
 * forced-role entry points wrap their work in the matching scope.
 *
 * A Spring transaction keeps the connection it began on for its whole duration. An operation
 * inside it that is routed anywhere else fails instead of running on the transaction's connection.
 */
@Component
public class RoutingTemplate {

    private static final Logger log = LoggerFactory.getLogger(RoutingTemplate.class);

    private final DecideConnectionUseCase decisions;
    private final RoutingContext routingContext;
    private final ConnectionBinding binding;
    private final ShardRegistry registry;
    private final RoutingDataSource dataSource;

    public RoutingTemplate(
            DecideConnectionUseCase decisions,
            RoutingContext routingContext,
            ConnectionBinding binding,
            ShardRegistry registry,
            RoutingDataSource dataSource) {
        this.decisions = decisions;
        this.routingContext = routingContext;
        this.binding = binding;
        this.registry = registry;
        this.dataSource = dataSource;
    }

    public <T> T read(ModelId modelId, RecordContext record, Supplier<T> work) {
        return execute(modelId, OperationKind.READ, record, work);
    }

    public <T> T write(ModelId modelId, RecordContext record, Supplier<T> work) {
        return execute(modelId, OperationKind.WRITE, record, work);
    }

    /**
     * @throws TransactionConnectionMismatchException if a transaction is bound to another connection
     */
    public <T> T execute(ModelId modelId, OperationKind operation, RecordContext record, Supplier<T> work) {
        RoutingDecision decision = decisions.explain(modelId, operation, record);
        Optional<ConnectionHandle> transactionHandle = dataSource.transactionHandle();
        if (transactionHandle.isPresent() && !transactionHandle.get().equals(decision.handle())) {
            log.warn("Refusing {} {} on {}: transaction is bound to {}", operation.label(), modelId,
                decision.handle().describe(), transactionHandle.get().describe());
            throw new TransactionConnectionMismatchException(decision, transactionHandle.get());
        }
        try (Binding ignored = binding.bind(decision)) {
            return work.get();
        }
    }

    public <T> T inTransaction(Supplier<T> work) {
        try (RoutingScope ignored = routingContext.enterTransaction()) {
            return work.get();
        }
    }

    public <T> T inMigration(Supplier<T> work) {
        try (RoutingScope ignored = routingContext.enterMigration()) {
            return work.get();
        }
    }

    public <T> T onReplica(Supplier<T> work) {
        try (RoutingScope ignored = routingContext.enterForced(ForcedTarget.REPLICA)) {
            return work.get();
        }
    }

    public <T> T onPrimary(Supplier<T> work) {
        try (RoutingScope ignored = routingContext.enterForced(ForcedTarget.PRIMARY)) {
            return work.get();
        }
    }

    public <T> T onShard(ShardKey shardKey, Supplier<T> work) {
        try (RoutingScope ignored = routingContext.enterShard(shardKey)) {
            return work.get();
        }
    }

    /**
     * Runs {@code work} once per sharded partition, in shard key order, with that shard selected.
     * Stops at the first failure.
     */
    public <T> List<T> onAllShards(Function<ShardKey, T> work) {
        List<ShardKey> shardKeys = registry.shardKeys();
        List<T> results = new ArrayList<>(shardKeys.size());
        for (ShardKey shardKey : shardKeys) {
            log.debug("Running on shard {}", shardKey);
            results.add(onShard(shardKey, () -> work.apply(shardKey)));
        }
        return results;
    }
}
