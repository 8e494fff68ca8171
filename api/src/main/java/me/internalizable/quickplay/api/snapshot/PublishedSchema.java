package me.internalizable.quickplay.api.snapshot;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Map;

/**
 * Map taxonomy as announced downstream.
 *
 * @param mapGamemodes map name to gamemode
 * @param gamemodes non-default gamemode to its maps
 */
public record PublishedSchema(
        @Nonnull Map<String, String> mapGamemodes,
        @Nonnull Map<String, List<String>> gamemodes
) {

    public PublishedSchema {
        mapGamemodes = Map.copyOf(mapGamemodes);
        gamemodes = Map.copyOf(gamemodes);
    }
}
