package me.internalizable.quickplay.schema;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Builds a {@link SchemaSnapshot} from a parsed schema document.
 */
public final class SchemaDocumentParser {

    private SchemaDocumentParser() {
    }

    /**
     * Build the taxonomy for a month.
     *
     * @param document parsed KeyValues document (with or without the {@code items_game} wrapper)
     * @param tables literal tables supplying pre-seeded maps and holiday months
     * @param matchGroup match group a category must be enabled for
     * @param month current UTC month (1-12)
     * @param identity identity of the document
     * @return the snapshot
     * @throws IllegalArgumentException if the document lacks the required sections
     */
    @Nonnull
    public static SchemaSnapshot parse(
            @Nonnull Map<String, Object> document,
            @Nonnull MatchmakingTables tables,
            @Nonnull String matchGroup,
            int month,
            @Nonnull String identity) {

        Map<String, Object> root = block(document, "items_game");
        if (root == null) {
            root = document;
        }

        Map<String, Object> categories = block(root, "matchmaking_categories");
        Map<String, Object> maps = block(root, "maps");
        if (categories == null || maps == null) {
            throw new IllegalArgumentException("Schema document lacks matchmaking_categories or maps");
        }

        Set<String> validTypes = new HashSet<>();
        for (Map.Entry<String, Object> category : categories.entrySet()) {
            Map<String, Object> groups = block(category.getValue(), "valid_match_groups");
            if (groups != null && "1".equals(groups.get(matchGroup))) {
                validTypes.add(category.getKey());
            }
        }

        Map<String, String> mapGamemodes = new LinkedHashMap<>(tables.getBaseGameMaps());
        Map<String, Set<String>> gamemodes = new LinkedHashMap<>();
        Map<Integer, Map<String, String>> holidayMaps = new TreeMap<>();

        for (Map.Entry<String, Object> entry : maps.entrySet()) {
            String gamemode = entry.getKey();
            if (!(entry.getValue() instanceof Map)) {
                continue;
            }
            String mmType = string(entry.getValue(), "mm_type");
            boolean forced = tables.getForcedCategories().contains(gamemode);
            if (!forced && (mmType == null || !validTypes.contains(mmType))) {
                continue;
            }

            Integer holidayMonth = null;
            Map<String, Object> restrictions = block(entry.getValue(), "restrictions");
            if (restrictions != null && restrictions.get("holiday") instanceof String) {
                holidayMonth = tables.getHolidays().get((String) restrictions.get("holiday"));
            }
            boolean outOfSeason = holidayMonth != null && holidayMonth != month;

            boolean grouped = mmType != null
                    && tables.getGroupedCategories().contains(mmType)
                    && !tables.getGroupingExemptGamemodes().contains(gamemode);
            String recordedAs = grouped ? mmType : gamemode;

            Set<String> gamemodeMaps = new LinkedHashSet<>();
            Map<String, Object> maplist = block(entry.getValue(), "maplist");
            if (maplist != null) {
                for (Object mapInfo : maplist.values()) {
                    String name = string(mapInfo, "name");
                    if (name == null || name.isEmpty()) {
                        continue;
                    }
                    boolean enabled = forced || "1".equals(string(mapInfo, "enabled"));
                    if (!enabled) {
                        continue;
                    }
                    gamemodeMaps.add(name);
                    if (outOfSeason) {
                        holidayMaps.computeIfAbsent(holidayMonth, m -> new LinkedHashMap<>()).put(name, recordedAs);
                    } else {
                        mapGamemodes.putIfAbsent(name, recordedAs);
                    }
                }
            }

            if (grouped) {
                if (!outOfSeason) {
                    gamemodes.computeIfAbsent(recordedAs, k -> new LinkedHashSet<>()).addAll(gamemodeMaps);
                }
            } else {
                gamemodes.put(recordedAs, gamemodeMaps);
            }
        }

        return new SchemaSnapshot(
                mapGamemodes,
                gamemodes,
                holidayMaps,
                month,
                identity
        );
    }

    @SuppressWarnings("unchecked")
    @Nullable
    private static Map<String, Object> block(Object parent, String key) {
        if (!(parent instanceof Map)) {
            return null;
        }
        Object child = ((Map<?, ?>) parent).get(key);
        return child instanceof Map ? (Map<String, Object>) child : null;
    }

    @Nullable
    private static String string(Object parent, String key) {
        if (!(parent instanceof Map)) {
            return null;
        }
        Object value = ((Map<?, ?>) parent).get(key);
        return value instanceof String ? (String) value : null;
    }
}
