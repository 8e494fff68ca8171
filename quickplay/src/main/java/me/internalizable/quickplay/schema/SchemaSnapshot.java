package me.internalizable.quickplay.schema;

import me.internalizable.quickplay.api.snapshot.PublishedSchema;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Immutable map to gamemode taxonomy for one schema document and month.
 */
public final class SchemaSnapshot {

    private final Map<String, String> mapGamemodes;
    private final Map<String, Set<String>> gamemodes;
    private final Map<Integer, Map<String, String>> holidayMaps;
    private final int month;
    private final String documentIdentity;

    /**
     * Create a snapshot.
     *
     * @param mapGamemodes map name to gamemode (main table)
     * @param gamemodes gamemode to map names
     * @param holidayMaps holiday month to maps restricted to that month
     * @param month UTC month (1-12) the snapshot was built for
     * @param documentIdentity identity of the source document
     */
    public SchemaSnapshot(
            @Nonnull Map<String, String> mapGamemodes,
            @Nonnull Map<String, Set<String>> gamemodes,
            @Nonnull Map<Integer, Map<String, String>> holidayMaps,
            int month,
            @Nonnull String documentIdentity) {
        this.mapGamemodes = Collections.unmodifiableMap(new LinkedHashMap<>(mapGamemodes));
        Map<String, Set<String>> modes = new LinkedHashMap<>();
        gamemodes.forEach((mode, maps) -> modes.put(mode, Collections.unmodifiableSet(new LinkedHashSet<>(maps))));
        this.gamemodes = Collections.unmodifiableMap(modes);
        Map<Integer, Map<String, String>> holiday = new TreeMap<>();
        holidayMaps.forEach((m, maps) -> holiday.put(m, Collections.unmodifiableMap(new LinkedHashMap<>(maps))));
        this.holidayMaps = Collections.unmodifiableMap(holiday);
        this.month = month;
        this.documentIdentity = Objects.requireNonNull(documentIdentity, "documentIdentity");
    }

    /**
     * Get the gamemode of a map from the main table.
     *
     * @param map map name
     * @return gamemode, or null if the map is not in the main table
     */
    @Nullable
    public String gamemodeOf(@Nonnull String map) {
        return mapGamemodes.get(map);
    }

    /**
     * Get the holiday month a map is restricted to, if it is out of season.
     *
     * @param map map name
     * @return the month, or null if the map is not holiday-restricted
     */
    @Nullable
    public Integer holidayMonthOf(@Nonnull String map) {
        for (Map.Entry<Integer, Map<String, String>> entry : holidayMaps.entrySet()) {
            if (entry.getValue().containsKey(map)) {
                return entry.getKey();
            }
        }
        return null;
    }

    @Nonnull
    public Map<String, String> getMapGamemodes() {
        return mapGamemodes;
    }

    @Nonnull
    public Map<String, Set<String>> getGamemodes() {
        return gamemodes;
    }

    @Nonnull
    public Map<Integer, Map<String, String>> getHolidayMaps() {
        return holidayMaps;
    }

    public int getMonth() {
        return month;
    }

    @Nonnull
    public String getDocumentIdentity() {
        return documentIdentity;
    }

    /**
     * Convert to the outbound schema, omitting default gamemodes from the
     * gamemode table.
     *
     * @param defaultGamemodes gamemodes consumers already know
     * @return the published schema
     */
    @Nonnull
    public PublishedSchema toPublished(@Nonnull Collection<String> defaultGamemodes) {
        Map<String, List<String>> custom = new LinkedHashMap<>();
        gamemodes.forEach((mode, maps) -> {
            if (!defaultGamemodes.contains(mode)) {
                custom.put(mode, new ArrayList<>(maps));
            }
        });
        return new PublishedSchema(mapGamemodes, custom);
    }
}
