package me.internalizable.quickplay.store;

import com.fasterxml.jackson.databind.JsonNode;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Volatile {@link KeyValueStore}, used when no store file is configured.
 */
public final class InMemoryKeyValueStore implements KeyValueStore {

    private final Map<String, Map<String, JsonNode>> tables = new ConcurrentHashMap<>();

    @Override
    @Nullable
    public JsonNode get(@Nonnull String table, @Nonnull String key) {
        Map<String, JsonNode> values = tables.get(table);
        return values != null ? values.get(key) : null;
    }

    @Override
    public void set(@Nonnull String table, @Nonnull String key, @Nonnull JsonNode value) {
        Objects.requireNonNull(value, "value");
        tables.computeIfAbsent(table, t -> new ConcurrentHashMap<>()).put(key, value.deepCopy());
    }

    @Override
    public void delete(@Nonnull String table, @Nonnull String key) {
        Map<String, JsonNode> values = tables.get(table);
        if (values != null) {
            values.remove(key);
        }
    }
}
