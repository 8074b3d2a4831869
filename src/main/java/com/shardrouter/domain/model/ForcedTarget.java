package com.shardrouter.domain.model;

import com.shardrouter.domain.error.ValidationError;

import java.util.Optional;

/**
 * Target of an enclosing forced block.
 */
public enum ForcedTarget {
    NONE,
    PRIMARY,
    REPLICA;

    public Optional<Role> role() {
        return switch (this) {
            case PRIMARY -> Optional.of(Role.PRIMARY);
            case REPLICA -> Optional.of(Role.REPLICA);
            case NONE -> Optional.empty();
        };
    }

    /**
     * Parses a request-level routing target; only {@code primary} and {@code replica} are accepted.
     */
    public static Result<ForcedTarget, ValidationError> parse(String value) {
        if (value != null) {
            String normalized = value.trim();
            if ("primary".equalsIgnoreCase(normalized)) {
                return Result.success(PRIMARY);
            }
            if ("replica".equalsIgnoreCase(normalized)) {
                return Result.success(REPLICA);
            }
        }
        return Result.failure(new ValidationError.UnknownValue("routing target", String.valueOf(value), "primary, replica"));
    }
}
