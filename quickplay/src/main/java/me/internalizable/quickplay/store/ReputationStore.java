package me.internalizable.quickplay.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.util.Objects;

/**
 * Per-identity reputation adjustments added to the score.
 */
public final class ReputationStore {

    public static final String TABLE = "reputation";

    private final KeyValueStore store;

    public ReputationStore(@Nonnull KeyValueStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    /**
     * Get the reputation of a server.
     *
     * @param identity server identity
     * @return the reputation, 0 if none is recorded
     */
    public double get(@Nonnull String identity) {
        JsonNode node = store.get(TABLE, identity);
        return node != null && node.isNumber() ? node.asDouble() : 0.0;
    }

    public void set(@Nonnull String identity, double reputation) throws IOException {
        store.set(TABLE, identity, JsonNodeFactory.instance.numberNode(reputation));
    }

    public void clear(@Nonnull String identity) throws IOException {
        store.delete(TABLE, identity);
    }
}
