package me.internalizable.quickplay.store;

import com.fasterxml.jackson.databind.JsonNode;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;

/**
 * String-keyed storage of JSON values, grouped into named tables.
 */
public interface KeyValueStore {

    /**
     * Read a value.
     *
     * @param table table name
     * @param key the key
     * @return the value, or null if absent
     */
    @Nullable
    JsonNode get(@Nonnull String table, @Nonnull String key);

    /**
     * Write a value, replacing any previous one.
     *
     * @param table table name
     * @param key the key
     * @param value the value
     * @throws IOException if the store could not be persisted
     */
    void set(@Nonnull String table, @Nonnull String key, @Nonnull JsonNode value) throws IOException;

    /**
     * Delete a value. Deleting an absent key does nothing.
     *
     * @param table table name
     * @param key the key
     * @throws IOException if the store could not be persisted
     */
    void delete(@Nonnull String table, @Nonnull String key) throws IOException;
}
