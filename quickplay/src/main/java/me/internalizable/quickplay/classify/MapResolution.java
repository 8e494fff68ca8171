package me.internalizable.quickplay.classify;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Result of resolving a map name to a gamemode.
 *
 * @param gamemode resolved gamemode, null when rejected
 * @param customAllowListed true when the map matched the custom-map allow-list
 * @param reason rejection reason, null when resolved
 */
public record MapResolution(@Nullable String gamemode, boolean customAllowListed, @Nullable RejectionReason reason) {

    @Nonnull
    static MapResolution resolved(@Nonnull String gamemode) {
        return new MapResolution(gamemode, false, null);
    }

    @Nonnull
    static MapResolution customAllowListed(@Nonnull String gamemode) {
        return new MapResolution(gamemode, true, null);
    }

    @Nonnull
    static MapResolution rejected(@Nonnull RejectionReason reason) {
        return new MapResolution(null, false, reason);
    }

    public boolean isResolved() {
        return reason == null;
    }
}
