package me.internalizable.quickplay.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import me.internalizable.quickplay.api.capability.GeoLocation;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.util.Objects;
import java.util.Optional;

/**
 * Operator-supplied locations that take precedence over geolocation.
 *
 * <p>Each entry is an object with {@code country}, {@code continent},
 * {@code lon} and {@code lat}, keyed by host.</p>
 */
public final class GeoOverrideTable {

    public static final String TABLE = "geo";

    private final KeyValueStore store;

    public GeoOverrideTable(@Nonnull KeyValueStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    /**
     * Look up an override.
     *
     * @param host server host
     * @return the location, empty if none is recorded or the entry is malformed
     */
    @Nonnull
    public Optional<GeoLocation> find(@Nonnull String host) {
        JsonNode node = store.get(TABLE, host);
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        JsonNode lon = node.get("lon");
        JsonNode lat = node.get("lat");
        if (lon == null || lat == null || !lon.isNumber() || !lat.isNumber()) {
            return Optional.empty();
        }
        return Optional.of(new GeoLocation(
                node.path("country").asText(""),
                node.path("continent").asText(""),
                lat.asDouble(),
                lon.asDouble()
        ));
    }

    public void put(@Nonnull String host, @Nonnull GeoLocation location) throws IOException {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("country", location.country());
        node.put("continent", location.continent());
        node.put("lon", location.longitude());
        node.put("lat", location.latitude());
        store.set(TABLE, host, node);
    }

    public void remove(@Nonnull String host) throws IOException {
        store.delete(TABLE, host);
    }
}
