package com.shardrouter.domain.model;

import com.shardrouter.domain.error.ValidationError;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Classification of a data-access operation, supplied by the interception layer.
 */
public enum OperationKind {
    READ,
    WRITE,
    FORCE_REPLICA,
    FORCE_PRIMARY;

    /**
     * True for the explicit per-call overrides.
     */
    public boolean isForced() {
        return this == FORCE_REPLICA || this == FORCE_PRIMARY;
    }

    /**
     * Role demanded by an explicit override.
     *
     * @throws IllegalStateException for READ and WRITE, which carry no forced role
     */
    public Role forcedRole() {
        return switch (this) {
            case FORCE_REPLICA -> Role.REPLICA;
            case FORCE_PRIMARY -> Role.PRIMARY;
            default -> throw new IllegalStateException(this + " does not force a role");
        };
    }

    public String label() {
        return name().toLowerCase();
    }

    public static Result<OperationKind, ValidationError> parse(String value) {
        if (value != null) {
            for (OperationKind kind : values()) {
                if (kind.label().equalsIgnoreCase(value.trim())) {
                    return Result.success(kind);
                }
            }
        }
        String allowed = Arrays.stream(values()).map(OperationKind::label).collect(Collectors.joining(", "));
        return Result.failure(new ValidationError.UnknownValue("operation", String.valueOf(value), allowed));
    }
}
