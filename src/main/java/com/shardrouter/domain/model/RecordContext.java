package com.shardrouter.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * What a {@link ShardKeyResolver} can see about the record being read or written:
 * its column values, and the shard selected by an enclosing shard block, if any.
 */
public record RecordContext(Map<String, Object> attributes, ShardKey selectedShard) {

    private static final RecordContext EMPTY = new RecordContext(Map.of(), null);

    public RecordContext {
        attributes = attributes == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static RecordContext empty() {
        return EMPTY;
    }

    public static RecordContext of(Map<String, Object> attributes) {
        return new RecordContext(attributes, null);
    }

    public static RecordContext of(String attribute, Object value) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put(attribute, value);
        return new RecordContext(attributes, null);
    }

    public static RecordContext selecting(ShardKey shardKey) {
        return new RecordContext(Map.of(), shardKey);
    }

    public Optional<Object> attribute(String name) {
        return Optional.ofNullable(attributes.get(name));
    }

    public Optional<ShardKey> selected() {
        return Optional.ofNullable(selectedShard);
    }

    /**
     * Returns a copy carrying the given selected shard unless this context already names one.
     */
    public RecordContext withSelectedShardIfAbsent(ShardKey shardKey) {
        if (selectedShard != null || shardKey == null) {
            return this;
        }
        return new RecordContext(attributes, shardKey);
    }
}
