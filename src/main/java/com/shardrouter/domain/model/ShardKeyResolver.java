package com.shardrouter.domain.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Derives the shard of a record for a sharded model.
 * Returning empty means the key cannot be derived; the registry turns that into an error.
 *
 * The built-in resolvers are records, so two resolvers built from the same settings are equal.
 * A hand-written resolver is only equal to itself.
 */
@FunctionalInterface
public interface ShardKeyResolver {

    Optional<ShardKey> resolve(RecordContext record);

    default ShardKeyResolver orElse(ShardKeyResolver fallback) {
        return new FirstOf(this, fallback);
    }

    /**
     * Uses the shard selected by an enclosing shard block.
     */
    static ShardKeyResolver selectedShard() {
        return SelectedShard.INSTANCE;
    }

    /**
     * Reads the shard key verbatim from a record attribute, e.g. a {@code shard} column.
     */
    static ShardKeyResolver fromAttribute(String attribute) {
        return new FromAttribute(attribute);
    }

    /**
     * Places a record on one of {@code shards} by hashing an attribute value.
     * The order of {@code shards} is part of the placement and must stay stable.
     */
    static ShardKeyResolver hashed(String attribute, List<ShardKey> shards) {
        return new Hashed(attribute, shards);
    }

    record SelectedShard() implements ShardKeyResolver {
        static final SelectedShard INSTANCE = new SelectedShard();

        @Override
        public Optional<ShardKey> resolve(RecordContext record) {
            return record.selected();
        }
    }

    record FromAttribute(String attribute) implements ShardKeyResolver {
        public FromAttribute {
            Objects.requireNonNull(attribute, "attribute");
        }

        @Override
        public Optional<ShardKey> resolve(RecordContext record) {
            return record.attribute(attribute)
                .map(Object::toString)
                .map(ShardKey::parse)
                .filter(Result::isSuccess)
                .map(result -> result.getOrThrow());
        }
    }

    record Hashed(String attribute, List<ShardKey> shards) implements ShardKeyResolver {
        public Hashed {
            Objects.requireNonNull(attribute, "attribute");
            shards = List.copyOf(shards);
            if (shards.isEmpty()) {
                throw new IllegalArgumentException("Hashed placement needs at least one shard");
            }
        }

        @Override
        public Optional<ShardKey> resolve(RecordContext record) {
            return record.attribute(attribute).map(value -> {
                if (shards.size() == 1) {
                    return shards.get(0);
                }
                // floorMod keeps negative hash codes in range
                int index = Math.floorMod(value.toString().hashCode(), shards.size());
                return shards.get(index);
            });
        }
    }

    record FirstOf(ShardKeyResolver first, ShardKeyResolver fallback) implements ShardKeyResolver {
        public FirstOf {
            Objects.requireNonNull(first, "first");
            Objects.requireNonNull(fallback, "fallback");
        }

        @Override
        public Optional<ShardKey> resolve(RecordContext record) {
            Optional<ShardKey> key = first.resolve(record);
            return key.isPresent() ? key : fallback.resolve(record);
        }
    }
}
