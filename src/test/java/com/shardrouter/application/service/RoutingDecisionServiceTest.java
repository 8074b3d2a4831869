package com.shardrouter.application.service;

import com.shardrouter.application.port.in.RoutingScopeUseCase.RoutingScope;
import com.shardrouter.application.port.out.RoutingMetricsPort;
import com.shardrouter.domain.model.ConnectionHandle;
import com.shardrouter.domain.model.DecisionReason;
import com.shardrouter.domain.model.ForcedTarget;
import com.shardrouter.domain.model.ModelId;
import com.shardrouter.domain.model.ModelRoutingPolicy;
import com.shardrouter.domain.model.OperationKind;
import com.shardrouter.domain.model.RecordContext;
import com.shardrouter.domain.model.Role;
import com.shardrouter.domain.model.RoutingDecision;
import com.shardrouter.domain.model.ShardKey;
import com.shardrouter.domain.model.ShardKeyResolver;
import com.shardrouter.infrastructure.context.RoutingContext;
import com.shardrouter.infrastructure.exception.UnknownShardException;
import com.shardrouter.infrastructure.exception.UnresolvedShardException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for RoutingDecisionService.
 * Uses a real RoutingContext and ShardRegistry; only metrics are mocked.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("RoutingDecisionService")
class RoutingDecisionServiceTest {

    private static final ShardKey SHARD_3 = ShardKey.of("shard_3");

    private static final ConnectionHandle P0 = handle("main", "app");
    private static final ConnectionHandle R0 = handle("main-ro", "app_replica");
    private static final ConnectionHandle P3 = handle("s3", "app_shard_3");
    private static final ConnectionHandle R3 = handle("s3-ro", "app_shard_3_replica");

    /** Unsharded, reads from replica by default. */
    private static final ModelId M1 = ModelId.of("accounts");
    /** Sharded, shard comes from the record's shard attribute. */
    private static final ModelId M2 = ModelId.of("tickets");
    /** Unsharded, reads from primary by default. */
    private static final ModelId M3 = ModelId.of("audit_events");

    @Mock
    private RoutingMetricsPort metrics;

    private RoutingContext routingContext;
    private RoutingDecisionService service;

    @BeforeEach
    void setUp() {
        ShardRegistry registry = new ShardRegistry();
        registry.registerShard(ShardKey.DEFAULT, P0, R0);
        registry.registerShard(SHARD_3, P3, R3);
        registry.registerModelPolicy(ModelRoutingPolicy.unsharded(M1, true));
        registry.registerModelPolicy(ModelRoutingPolicy.sharded(M2, true, ShardKeyResolver.fromAttribute("shard")));
        registry.registerModelPolicy(ModelRoutingPolicy.unsharded(M3, false));

        routingContext = new RoutingContext();
        service = new RoutingDecisionService(registry, routingContext, metrics);
    }

    @AfterEach
    void tearDown() {
        routingContext.clear();
    }

    @Nested
    @DisplayName("Default rules")
    class DefaultRuleTests {

        @Test
        @DisplayName("Read of replica-by-default model should go to the default shard replica")
        void readShouldUseReplica() {
            // when
            RoutingDecision decision = service.explain(M1, OperationKind.READ, RecordContext.empty());

            // then
            assertEquals(R0, decision.handle());
            assertEquals(Role.REPLICA, decision.role());
            assertEquals(ShardKey.DEFAULT, decision.shardKey());
            assertEquals(DecisionReason.REPLICA_DEFAULT, decision.reason());
        }

        @Test
        @DisplayName("Read of primary-by-default model should go to primary")
        void readShouldUsePrimaryWhenNotReplicaByDefault() {
            RoutingDecision decision = service.explain(M3, OperationKind.READ, RecordContext.empty());

            assertEquals(P0, decision.handle());
            assertEquals(DecisionReason.PRIMARY_DEFAULT, decision.reason());
        }

        @Test
        @DisplayName("Write of replica-by-default model should go to primary")
        void writeShouldUsePrimary() {
            assertEquals(P0, service.decide(M1, OperationKind.WRITE));
        }

        @Test
        @DisplayName("Sharded write should go to the resolved shard primary")
        void shardedWriteShouldUseResolvedShard() {
            RoutingDecision decision = service.explain(M2, OperationKind.WRITE, RecordContext.of("shard", "shard_3"));

            assertEquals(P3, decision.handle());
            assertEquals(SHARD_3, decision.shardKey());
        }

        @Test
        @DisplayName("Sharded read should go to the resolved shard replica")
        void shardedReadShouldUseResolvedShardReplica() {
            assertEquals(R3, service.decide(M2, OperationKind.READ, RecordContext.of("shard", "shard_3")));
        }
    }

    @Nested
    @DisplayName("Context rules")
    class ContextRuleTests {

        @Test
        @DisplayName("Transaction should route replica-by-default reads to primary")
        void transactionShouldUsePrimary() {
            try (RoutingScope ignored = routingContext.enterTransaction()) {
                RoutingDecision decision = service.explain(M1, OperationKind.READ, RecordContext.empty());

                assertEquals(P0, decision.handle());
                assertEquals(DecisionReason.TRANSACTION, decision.reason());
            }
            assertEquals(R0, service.decide(M1, OperationKind.READ));
        }

        @Test
        @DisplayName("Repeated decisions in one transaction should return the same primary")
        void transactionShouldBeConsistent() {
            try (RoutingScope ignored = routingContext.enterTransaction()) {
                ConnectionHandle first = service.decide(M1, OperationKind.READ);
                ConnectionHandle second = service.decide(M1, OperationKind.WRITE);
                ConnectionHandle third = service.decide(M3, OperationKind.READ);

                assertEquals(P0, first);
                assertSame(first, second);
                assertSame(first, third);
            }
        }

        @Test
        @DisplayName("Forced replica block should route reads to replica")
        void forcedReplicaShouldUseReplica() {
            try (RoutingScope ignored = routingContext.enterForced(ForcedTarget.REPLICA)) {
                RoutingDecision decision = service.explain(M3, OperationKind.READ, RecordContext.empty());

                assertEquals(R0, decision.handle());
                assertEquals(DecisionReason.FORCED_BLOCK, decision.reason());
            }
        }

        @Test
        @DisplayName("Forced primary block should route replica-by-default reads to primary")
        void forcedPrimaryShouldUsePrimary() {
            try (RoutingScope ignored = routingContext.enterForced(ForcedTarget.PRIMARY)) {
                assertEquals(P0, service.decide(M1, OperationKind.READ));
            }
        }

        @Test
        @DisplayName("Forced replica block should never redirect writes")
        void forcedReplicaShouldNotRedirectWrites() {
            try (RoutingScope ignored = routingContext.enterForced(ForcedTarget.REPLICA)) {
                RoutingDecision decision = service.explain(M1, OperationKind.WRITE, RecordContext.empty());

                assertEquals(P0, decision.handle());
                assertEquals(DecisionReason.WRITE, decision.reason());
            }
        }

        @Test
        @DisplayName("Transaction should beat an enclosing forced replica block")
        void transactionShouldBeatForcedBlock() {
            try (RoutingScope forced = routingContext.enterForced(ForcedTarget.REPLICA);
                 RoutingScope tx = routingContext.enterTransaction()) {
                assertEquals(P0, service.decide(M1, OperationKind.READ));
            }
        }

        @Test
        @DisplayName("Migration should beat forced replica and explicit force")
        void migrationShouldBeatEverything() {
            try (RoutingScope forced = routingContext.enterForced(ForcedTarget.REPLICA);
                 RoutingScope migration = routingContext.enterMigration()) {
                RoutingDecision decision = service.explain(M1, OperationKind.FORCE_REPLICA, RecordContext.empty());

                assertEquals(P0, decision.handle());
                assertEquals(DecisionReason.MIGRATION, decision.reason());
            }
        }

        @Test
        @DisplayName("Selected shard should route sharded models without a shard attribute")
        void selectedShardShouldRouteShardedModel() {
            try (RoutingScope ignored = routingContext.enterShard(SHARD_3)) {
                assertEquals(P3, service.decide(M2, OperationKind.WRITE, RecordContext.of("id", 42)));
            }
        }
    }

    @Nested
    @DisplayName("Explicit force")
    class ExplicitForceTests {

        @Test
        @DisplayName("FORCE_REPLICA should beat a transaction")
        void forceReplicaShouldBeatTransaction() {
            try (RoutingScope ignored = routingContext.enterTransaction()) {
                RoutingDecision decision = service.explain(M1, OperationKind.FORCE_REPLICA, RecordContext.empty());

                assertEquals(R0, decision.handle());
                assertEquals(DecisionReason.EXPLICIT_OVERRIDE, decision.reason());
            }
        }

        @Test
        @DisplayName("FORCE_PRIMARY should beat a forced replica block")
        void forcePrimaryShouldBeatForcedBlock() {
            try (RoutingScope ignored = routingContext.enterForced(ForcedTarget.REPLICA)) {
                assertEquals(P0, service.decide(M1, OperationKind.FORCE_PRIMARY));
            }
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        @DisplayName("Unknown shard key should raise UnknownShardException")
        void unknownShardShouldFail() {
            assertThrows(UnknownShardException.class,
                () -> service.decide(M2, OperationKind.WRITE, RecordContext.of("shard", "shard_9")));
            verify(metrics).recordFailure("SHARD_UNKNOWN");
            verify(metrics, never()).recordDecision(any());
        }

        @Test
        @DisplayName("Sharded model without a derivable key should raise UnresolvedShardException")
        void missingShardShouldFail() {
            assertThrows(UnresolvedShardException.class,
                () -> service.decide(M2, OperationKind.READ, RecordContext.empty()));
            verify(metrics).recordFailure("SHARD_UNRESOLVED");
        }

        @Test
        @DisplayName("Unregistered model should raise UnresolvedShardException")
        void unregisteredModelShouldFail() {
            assertThrows(UnresolvedShardException.class,
                () -> service.decide(ModelId.of("ghosts"), OperationKind.READ));
        }

        @Test
        @DisplayName("Conflicting record and selected shard should raise UnresolvedShardException")
        void ambiguousShardShouldFail() {
            try (RoutingScope ignored = routingContext.enterShard(ShardKey.DEFAULT)) {
                assertThrows(UnresolvedShardException.class,
                    () -> service.decide(M2, OperationKind.READ, RecordContext.of("shard", "shard_3")));
            }
        }
    }

    @ParameterizedTest
    @EnumSource(ForcedTarget.class)
    @DisplayName("Write should return primary under any forced target")
    void writeShouldAlwaysUsePrimary(ForcedTarget target) {
        try (RoutingScope ignored = routingContext.enterForced(target)) {
            assertEquals(P0, service.decide(M1, OperationKind.WRITE));
            assertEquals(P3, service.decide(M2, OperationKind.WRITE, RecordContext.of("shard", "shard_3")));
        }
    }

    @Test
    @DisplayName("Should record every successful decision")
    void shouldRecordDecision() {
        // when
        service.decide(M1, OperationKind.READ);

        // then
        ArgumentCaptor<RoutingDecision> captor = ArgumentCaptor.forClass(RoutingDecision.class);
        verify(metrics).recordDecision(captor.capture());
        assertEquals(M1, captor.getValue().modelId());
        assertEquals(OperationKind.READ, captor.getValue().operation());
        verifyNoMoreInteractions(metrics);
    }

    private static ConnectionHandle handle(String host, String database) {
        return new ConnectionHandle(host, 5432, database, "app", "secret");
    }
}
