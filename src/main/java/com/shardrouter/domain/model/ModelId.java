package com.shardrouter.domain.model;

import com.shardrouter.domain.error.ValidationError.ModelIdError;

import java.util.regex.Pattern;

/**
 * Value Object naming a model class of the host persistence framework.
 * Either a fully qualified class name or a logical name such as a table name.
 */
public record ModelId(String value) {

    private static final Pattern FORMAT = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$.]*");

    public ModelId {
        if (value == null) {
            throw new IllegalStateException("ModelId value cannot be null - use parse() for validation");
        }
    }

    public static Result<ModelId, ModelIdError> parse(String value) {
        if (value == null || value.isBlank()) {
            return Result.failure(ModelIdError.Empty.INSTANCE);
        }
        String trimmed = value.trim();
        if (!FORMAT.matcher(trimmed).matches()) {
            return Result.failure(new ModelIdError.InvalidFormat(value));
        }
        return Result.success(new ModelId(trimmed));
    }

    /**
     * @throws IllegalArgumentException if the value is not a valid model id
     */
    public static ModelId of(String value) {
        return parse(value).getOrThrow(error -> new IllegalArgumentException(error.message()));
    }

    @Override
    public String toString() {
        return value;
    }
}
