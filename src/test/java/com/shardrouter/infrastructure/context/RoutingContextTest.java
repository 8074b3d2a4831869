package com.shardrouter.infrastructure.context;

import com.shardrouter.application.port.in.RoutingScopeUseCase.RoutingScope;
import com.shardrouter.domain.model.ForcedTarget;
import com.shardrouter.domain.model.RoutingSnapshot;
import com.shardrouter.domain.model.ShardKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RoutingContext")
class RoutingContextTest {

    private RoutingContext routingContext;

    @BeforeEach
    void setUp() {
        routingContext = new RoutingContext();
    }

    @Test
    @DisplayName("Should start with no flags set")
    void shouldStartEmpty() {
        assertEquals(RoutingSnapshot.EMPTY, routingContext.current());
    }

    @Nested
    @DisplayName("enterTransaction")
    class TransactionTests {

        @Test
        @DisplayName("Should set and restore the transaction flag")
        void shouldSetAndRestore() {
            try (RoutingScope ignored = routingContext.enterTransaction()) {
                assertTrue(routingContext.current().inTransaction());
            }
            assertFalse(routingContext.current().inTransaction());
        }

        @Test
        @DisplayName("Nested scopes should keep the flag until the outer scope closes")
        void nestedScopesShouldRestoreExactly() {
            RoutingScope outer = routingContext.enterTransaction();
            RoutingScope inner = routingContext.enterTransaction();
            assertTrue(routingContext.current().inTransaction());

            inner.close();
            assertTrue(routingContext.current().inTransaction());

            outer.close();
            assertFalse(routingContext.current().inTransaction());
        }

        @Test
        @DisplayName("Should restore the flag when the enclosed code throws")
        void shouldRestoreOnException() {
            assertThrows(IllegalStateException.class, () -> {
                try (RoutingScope ignored = routingContext.enterTransaction()) {
                    throw new IllegalStateException("boom");
                }
            });
            assertFalse(routingContext.current().inTransaction());
        }
    }

    @Nested
    @DisplayName("enterMigration and enterForced")
    class MigrationAndForcedTests {

        @Test
        @DisplayName("Should combine flags and unwind them in reverse order")
        void shouldCombineFlags() {
            try (RoutingScope tx = routingContext.enterTransaction()) {
                try (RoutingScope forced = routingContext.enterForced(ForcedTarget.REPLICA)) {
                    try (RoutingScope migration = routingContext.enterMigration()) {
                        RoutingSnapshot snapshot = routingContext.current();
                        assertTrue(snapshot.inTransaction());
                        assertTrue(snapshot.inMigration());
                        assertEquals(ForcedTarget.REPLICA, snapshot.forcedTarget());
                    }
                    assertFalse(routingContext.current().inMigration());
                    assertEquals(ForcedTarget.REPLICA, routingContext.current().forcedTarget());
                }
                assertEquals(ForcedTarget.NONE, routingContext.current().forcedTarget());
            }
            assertEquals(RoutingSnapshot.EMPTY, routingContext.current());
        }

        @Test
        @DisplayName("Inner forced block should override and then restore the outer target")
        void innerForcedBlockShouldRestoreOuterTarget() {
            try (RoutingScope outer = routingContext.enterForced(ForcedTarget.REPLICA)) {
                try (RoutingScope inner = routingContext.enterForced(ForcedTarget.PRIMARY)) {
                    assertEquals(ForcedTarget.PRIMARY, routingContext.current().forcedTarget());
                }
                assertEquals(ForcedTarget.REPLICA, routingContext.current().forcedTarget());
            }
        }
    }

    @Nested
    @DisplayName("enterShard")
    class ShardTests {

        @Test
        @DisplayName("Should select and restore the shard")
        void shouldSelectShard() {
            try (RoutingScope outer = routingContext.enterShard(ShardKey.of("shard_0"))) {
                try (RoutingScope inner = routingContext.enterShard(ShardKey.of("shard_1"))) {
                    assertEquals(ShardKey.of("shard_1"), routingContext.current().selectedShard());
                }
                assertEquals(ShardKey.of("shard_0"), routingContext.current().selectedShard());
            }
            assertNull(routingContext.current().selectedShard());
        }
    }

    @Nested
    @DisplayName("scope close")
    class CloseTests {

        @Test
        @DisplayName("Closing twice should be a no-op")
        void closingTwiceShouldBeNoOp() {
            RoutingScope outer = routingContext.enterTransaction();
            RoutingScope inner = routingContext.enterForced(ForcedTarget.REPLICA);

            inner.close();
            inner.close();

            assertTrue(routingContext.current().inTransaction());
            outer.close();
            assertEquals(RoutingSnapshot.EMPTY, routingContext.current());
        }

        @Test
        @DisplayName("Closing on another thread should fail")
        void closingOnAnotherThreadShouldFail() throws Exception {
            RoutingScope scope = routingContext.enterTransaction();
            AtomicReference<Throwable> failure = new AtomicReference<>();

            CompletableFuture.runAsync(() -> {
                try {
                    scope.close();
                } catch (Throwable t) {
                    failure.set(t);
                }
            }).get();

            assertInstanceOf(IllegalStateException.class, failure.get());
            assertTrue(routingContext.current().inTransaction());
            scope.close();
        }
    }

    @Test
    @DisplayName("State should not leak to other threads")
    void stateShouldBeThreadConfined() throws Exception {
        try (RoutingScope ignored = routingContext.enterMigration()) {
            RoutingSnapshot seenElsewhere = CompletableFuture.supplyAsync(routingContext::current).get();
            assertEquals(RoutingSnapshot.EMPTY, seenElsewhere);
            assertTrue(routingContext.current().inMigration());
        }
    }

    @Test
    @DisplayName("clear should drop all state of the thread")
    void clearShouldDropState() {
        routingContext.enterTransaction();
        routingContext.enterShard(ShardKey.of("shard_0"));

        routingContext.clear();

        assertEquals(RoutingSnapshot.EMPTY, routingContext.current());
    }
}
