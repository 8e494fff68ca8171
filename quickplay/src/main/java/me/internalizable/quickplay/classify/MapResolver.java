package me.internalizable.quickplay.classify;

import me.internalizable.quickplay.schema.MatchmakingTables;
import me.internalizable.quickplay.schema.SchemaSnapshot;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Resolves map names against the taxonomy.
 *
 * <p>Order: schema table, beta table, holiday table, custom-map allow-list,
 * version-suffix variant of a pre-seeded map.</p>
 *
 * <p>A variant differs from a pre-seeded map only in its trailing version
 * token ({@code rc2}, {@code b15d}, {@code v4}, {@code final1}...). Event and
 * holiday suffixes such as {@code _event} or {@code _invasion} are not
 * version tokens, so {@code ctf_2fort_custom} is never a variant of anything.</p>
 */
public final class MapResolver {

    private static final Pattern VERSION_TOKEN =
            Pattern.compile("(?:(?:v|rc|a|b|beta|pro|f)?\\d+[a-z]?|final\\d*[a-z]?)");

    private final MatchmakingTables tables;
    private final Map<String, String> unversionedMaps;

    public MapResolver(@Nonnull MatchmakingTables tables) {
        this.tables = Objects.requireNonNull(tables, "tables");

        Map<String, String> index = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : tables.getBaseGameMaps().entrySet()) {
            String map = entry.getKey();
            if (!tables.getStandardMapPrefixes().contains(MatchmakingTables.mapPrefix(map))) {
                continue;
            }
            String name = unversionedName(map);
            if (name != null) {
                index.putIfAbsent(name, entry.getValue());
            }
        }
        this.unversionedMaps = Collections.unmodifiableMap(index);
    }

    /**
     * Resolve a map.
     *
     * @param map map name as reported by the server
     * @param schema current taxonomy
     * @return the resolution
     */
    @Nonnull
    public MapResolution resolve(@Nonnull String map, @Nonnull SchemaSnapshot schema) {
        if (map.isEmpty()) {
            return MapResolution.rejected(RejectionReason.NO_MAP);
        }

        String gamemode = schema.gamemodeOf(map);
        if (gamemode != null) {
            return MapResolution.resolved(gamemode);
        }

        gamemode = tables.getBetaMaps().get(map);
        if (gamemode != null) {
            return MapResolution.resolved(gamemode);
        }

        if (schema.holidayMonthOf(map) != null) {
            return MapResolution.rejected(RejectionReason.HOLIDAY_MAP);
        }

        for (Map.Entry<String, String> entry : tables.getCustomMapPrefixes().entrySet()) {
            if (!entry.getKey().isEmpty() && map.startsWith(entry.getKey())) {
                return MapResolution.customAllowListed(entry.getValue());
            }
        }

        boolean standardPrefix = tables.getStandardMapPrefixes().contains(MatchmakingTables.mapPrefix(map));
        if (standardPrefix && !isExcludedFromVariants(map)) {
            String unversioned = unversionedName(map);
            if (unversioned != null) {
                String variantOf = unversionedMaps.get(unversioned);
                if (variantOf != null) {
                    return MapResolution.resolved(variantOf);
                }
            }
        }

        return MapResolution.rejected(standardPrefix ? RejectionReason.CUSTOM_MAP : RejectionReason.UNKNOWN_MAP);
    }

    /**
     * Strip a trailing version token from a map name.
     *
     * @param map map name
     * @return the versionless name, or null if the name has fewer than three
     *         segments or its last segment is not a version token
     */
    @Nullable
    public static String unversionedName(@Nonnull String map) {
        int cut = map.lastIndexOf('_');
        if (cut < 0 || map.split("_").length <= 2) {
            return null;
        }
        return VERSION_TOKEN.matcher(map.substring(cut + 1)).matches() ? map.substring(0, cut) : null;
    }

    /**
     * Get the gamemode of the pre-seeded map a versionless name belongs to.
     *
     * @param unversionedName map name without its version token
     * @return gamemode, or null if no pre-seeded map has that name
     */
    @Nullable
    public String gamemodeOfUnversioned(@Nonnull String unversionedName) {
        return unversionedMaps.get(unversionedName);
    }

    private boolean isExcludedFromVariants(String map) {
        for (String excluded : tables.getUnversionedExclusions()) {
            if (map.startsWith(excluded)) {
                return true;
            }
        }
        return false;
    }
}
