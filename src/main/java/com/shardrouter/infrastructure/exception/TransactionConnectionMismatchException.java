package com.shardrouter.infrastructure.exception;

import com.shardrouter.domain.model.ConnectionHandle;
import com.shardrouter.domain.model.RoutingDecision;

/**
 * An operation inside a transaction was routed to a different connection than the one the
 * transaction is bound to. A transaction never spans connections.
 */
public class TransactionConnectionMismatchException extends RoutingException {

    private final RoutingDecision decision;
    private final ConnectionHandle transactionHandle;

    public TransactionConnectionMismatchException(RoutingDecision decision, ConnectionHandle transactionHandle) {
        super("TRANSACTION_CONNECTION_MISMATCH",
            "Operation " + decision.operation().label() + " on " + decision.modelId() + " was routed to "
                + decision.handle().describe() + " (shard " + decision.shardKey() + ", " + decision.role().label()
                + ") but the current transaction is bound to " + transactionHandle.describe());
        this.decision = decision;
        this.transactionHandle = transactionHandle;
    }

    public RoutingDecision getDecision() {
        return decision;
    }

    public ConnectionHandle getTransactionHandle() {
        return transactionHandle;
    }
}
