package me.internalizable.quickplay.api.snapshot;

import javax.annotation.Nonnull;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Ranked, time-bounded list of servers.
 *
 * @param servers servers in descending score order
 * @param until instant after which the snapshot should be considered stale
 */
public record PublishedSnapshot(
        @Nonnull List<PublishedServer> servers,
        @Nonnull Instant until
) {

    public PublishedSnapshot {
        servers = List.copyOf(servers);
        Objects.requireNonNull(until, "until");
    }

    /**
     * Check if the snapshot is still fresh.
     *
     * @param now current instant
     * @return true if {@code now} is before the expiry
     */
    public boolean isFresh(@Nonnull Instant now) {
        return now.isBefore(until);
    }
}
