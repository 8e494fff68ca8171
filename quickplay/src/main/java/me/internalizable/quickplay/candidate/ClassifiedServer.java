package me.internalizable.quickplay.candidate;

import me.internalizable.quickplay.api.capability.ProbeResult;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A candidate that passed every filter.
 *
 * @param candidate the raw candidate (with live fields if it was probed)
 * @param tags normalized tag set: advertised, canonicalized and inferred tags
 * @param gamemode resolved gamemode of the map
 * @param expectedTag tag the gamemode requires, empty if none
 * @param probe live probe result, null until the server was verified
 */
public record ClassifiedServer(
        @Nonnull RawCandidate candidate,
        @Nonnull Set<String> tags,
        @Nonnull String gamemode,
        @Nonnull String expectedTag,
        @Nullable ProbeResult probe
) {

    public ClassifiedServer {
        Objects.requireNonNull(candidate, "candidate");
        tags = Collections.unmodifiableSet(new LinkedHashSet<>(tags));
        Objects.requireNonNull(gamemode, "gamemode");
        Objects.requireNonNull(expectedTag, "expectedTag");
    }

    /**
     * Attach the live probe result.
     *
     * @param result probe result
     * @return a new classified server
     */
    @Nonnull
    public ClassifiedServer withProbe(@Nonnull ProbeResult result) {
        return new ClassifiedServer(candidate, tags, gamemode, expectedTag, Objects.requireNonNull(result, "result"));
    }
}
