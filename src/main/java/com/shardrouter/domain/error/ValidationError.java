package com.shardrouter.domain.error;

/**
 * Sealed type representing validation errors for routing input.
 * These are expected outcomes (bad request parameters, bad configuration keys), not exceptional cases.
 */
public sealed interface ValidationError {

    String message();

    String code();

    // ShardKey validation errors
    sealed interface ShardKeyError extends ValidationError {

        record Empty() implements ShardKeyError {
            public static final Empty INSTANCE = new Empty();
            @Override
            public String message() {
                return "Shard key cannot be empty";
            }

            @Override
            public String code() {
                return "SHARD_KEY_EMPTY";
            }
        }

        record InvalidFormat(String value) implements ShardKeyError {
            @Override
            public String message() {
                return "Shard key may only contain letters, digits, '_' and '-' (max 64 chars): " + value;
            }

            @Override
            public String code() {
                return "SHARD_KEY_INVALID_FORMAT";
            }
        }
    }

    // ModelId validation errors
    sealed interface ModelIdError extends ValidationError {

        record Empty() implements ModelIdError {
            public static final Empty INSTANCE = new Empty();
            @Override
            public String message() {
                return "Model id cannot be empty";
            }

            @Override
            public String code() {
                return "MODEL_ID_EMPTY";
            }
        }

        record InvalidFormat(String value) implements ModelIdError {
            @Override
            public String message() {
                return "Model id must be a class or table name: " + value;
            }

            @Override
            public String code() {
                return "MODEL_ID_INVALID_FORMAT";
            }
        }
    }

    // Enum-valued parameters (operation kind, forced target)
    record UnknownValue(String parameter, String value, String allowed) implements ValidationError {
        @Override
        public String message() {
            return "Unknown " + parameter + " '" + value + "', expected one of: " + allowed;
        }

        @Override
        public String code() {
            return "UNKNOWN_" + parameter.toUpperCase().replace(' ', '_');
        }
    }
}
