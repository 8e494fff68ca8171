package me.internalizable.quickplay.candidate;

import me.internalizable.quickplay.api.capability.GeoLocation;
import me.internalizable.quickplay.api.snapshot.GeoPoint;
import me.internalizable.quickplay.api.snapshot.PublishedServer;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Objects;

/**
 * A classified server with its score and geographic estimate.
 *
 * @param server the classified server
 * @param score composite score
 * @param location resolved location
 * @param pingOverhead estimated ping overhead, at least 1
 * @param name sanitized display name
 */
public record ScoredServer(
        @Nonnull ClassifiedServer server,
        double score,
        @Nonnull GeoLocation location,
        double pingOverhead,
        @Nonnull String name
) {

    public ScoredServer {
        Objects.requireNonNull(server, "server");
        Objects.requireNonNull(location, "location");
        Objects.requireNonNull(name, "name");
    }

    /**
     * Convert to the outbound record.
     *
     * @return the published server
     */
    @Nonnull
    public PublishedServer toPublished() {
        RawCandidate candidate = server.candidate();
        return new PublishedServer(
                candidate.address(),
                candidate.identity(),
                name,
                candidate.humans(),
                candidate.bots(),
                candidate.capacity(),
                candidate.map(),
                new ArrayList<>(server.tags()),
                score,
                new GeoPoint(location.longitude(), location.latitude()),
                pingOverhead
        );
    }
}
