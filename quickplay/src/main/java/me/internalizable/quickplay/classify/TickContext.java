package me.internalizable.quickplay.classify;

import me.internalizable.quickplay.schema.SchemaSnapshot;
import me.internalizable.quickplay.store.BanList;

import javax.annotation.Nonnull;
import java.util.Objects;
import java.util.Set;

/**
 * Shared state read by every candidate of one tick. Immutable for the
 * duration of the tick.
 *
 * @param schema current map taxonomy
 * @param minimumVersion minimum accepted build version, 0 if unknown
 * @param bans ban lists
 * @param anycastNetworks network blocks of shared hosting
 * @param directoryFresh false when the candidate list is a stale copy and
 *                       every candidate must be probed before filtering
 */
public record TickContext(
        @Nonnull SchemaSnapshot schema,
        long minimumVersion,
        @Nonnull BanList bans,
        @Nonnull Set<String> anycastNetworks,
        boolean directoryFresh
) {

    public TickContext {
        Objects.requireNonNull(schema, "schema");
        Objects.requireNonNull(bans, "bans");
        anycastNetworks = Set.copyOf(anycastNetworks);
    }
}
