package com.shardrouter.domain.model;

import com.shardrouter.domain.error.ValidationError.ShardKeyError;

import java.util.regex.Pattern;

/**
 * Value Object identifying a logical shard, e.g. {@code shard_3} or the unsharded {@code default}.
 */
public record ShardKey(String value) implements Comparable<ShardKey> {

    private static final Pattern FORMAT = Pattern.compile("[A-Za-z0-9_-]{1,64}");

    /**
     * Key used for unsharded models unless the registry is configured with another one.
     */
    public static final ShardKey DEFAULT = new ShardKey("default");

    public ShardKey {
        // Compact constructor for internal use - assumes validated input
        if (value == null) {
            throw new IllegalStateException("ShardKey value cannot be null - use parse() for validation");
        }
    }

    /**
     * Parses a string into a ShardKey, returning a Result for expected validation failures.
     */
    public static Result<ShardKey, ShardKeyError> parse(String value) {
        if (value == null || value.isBlank()) {
            return Result.failure(ShardKeyError.Empty.INSTANCE);
        }
        String trimmed = value.trim();
        if (!FORMAT.matcher(trimmed).matches()) {
            return Result.failure(new ShardKeyError.InvalidFormat(value));
        }
        return Result.success(new ShardKey(trimmed));
    }

    /**
     * Creates a ShardKey from a trusted source (configuration already validated, tests).
     *
     * @throws IllegalArgumentException if the value is not a valid key
     */
    public static ShardKey of(String value) {
        return parse(value).getOrThrow(error -> new IllegalArgumentException(error.message()));
    }

    @Override
    public int compareTo(ShardKey other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
