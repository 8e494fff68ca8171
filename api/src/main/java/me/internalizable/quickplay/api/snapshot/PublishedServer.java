package me.internalizable.quickplay.api.snapshot;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * One ranked server as announced downstream.
 *
 * @param address host:port
 * @param identity server identity
 * @param name sanitized display name
 * @param humans human count
 * @param bots bot count
 * @param capacity advertised capacity
 * @param map current map
 * @param tags normalized tag set
 * @param score composite desirability score
 * @param point geographic point
 * @param pingOverhead estimated ping overhead, at least 1
 */
public record PublishedServer(
        @Nonnull String address,
        @Nonnull String identity,
        @Nonnull String name,
        int humans,
        int bots,
        int capacity,
        @Nonnull String map,
        @Nonnull List<String> tags,
        double score,
        @Nonnull GeoPoint point,
        double pingOverhead
) {

    public PublishedServer {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(identity, "identity");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(map, "map");
        tags = List.copyOf(tags);
        Objects.requireNonNull(point, "point");
    }
}
