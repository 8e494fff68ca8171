package me.internalizable.quickplay.schema;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Literal taxonomy tables, loaded from {@code quickplay-tables.yml}.
 *
 * <p>Holds the pre-seeded map table, tag vocabularies, prefix tables and the
 * tag enrichment heuristics. Instances are treated as read-only once loaded.</p>
 */
public class MatchmakingTables {

    private static final String BUNDLED_RESOURCE = "/quickplay-tables.yml";

    private Map<String, String> baseGameMaps = new LinkedHashMap<>();
    private Map<String, String> betaMaps = new LinkedHashMap<>();
    private Map<String, Integer> holidays = new LinkedHashMap<>();
    private Map<String, String> gamemodeTags = new LinkedHashMap<>();
    private List<String> defaultGamemodes = new ArrayList<>();
    private List<String> forcedCategories = new ArrayList<>();
    private List<String> groupedCategories = new ArrayList<>();
    private List<String> groupingExemptGamemodes = new ArrayList<>();
    private List<String> validTags = new ArrayList<>();
    private List<String> standardMapPrefixes = new ArrayList<>();
    private Map<String, String> prefixTags = new LinkedHashMap<>();
    private List<String> unversionedExclusions = new ArrayList<>();
    private Map<String, String> customMapPrefixes = new LinkedHashMap<>();
    private Map<String, String> tagAliases = new LinkedHashMap<>();
    private List<String> exemptTags = new ArrayList<>();
    private List<String> forcedModeTags = new ArrayList<>();
    private String increasedCapacityTag = "increased_maxplayers";
    private String betaTag = "beta";
    private String markerCharacters = "\u0001";
    private List<EnrichmentRule> enrichment = new ArrayList<>();

    /**
     * Load the tables bundled with the service.
     *
     * @return loaded tables
     * @throws IOException if the resource is missing or malformed
     */
    @Nonnull
    public static MatchmakingTables loadDefaults() throws IOException {
        try (InputStream is = MatchmakingTables.class.getResourceAsStream(BUNDLED_RESOURCE)) {
            if (is == null) {
                throw new IOException("Bundled tables not found: " + BUNDLED_RESOURCE);
            }
            return read(is);
        }
    }

    /**
     * Load tables from an operator supplied file.
     *
     * @param path path to the tables file
     * @return loaded tables
     * @throws IOException if loading fails
     */
    @Nonnull
    public static MatchmakingTables load(@Nonnull Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("Tables file not found: " + path);
        }
        try (InputStream is = Files.newInputStream(path)) {
            return read(is);
        }
    }

    private static MatchmakingTables read(InputStream is) {
        LoaderOptions options = new LoaderOptions();
        Yaml yaml = new Yaml(new Constructor(MatchmakingTables.class, options));
        MatchmakingTables tables = yaml.load(is);
        return tables != null ? tables : new MatchmakingTables();
    }

    /**
     * Get the prefix of a map name (the part before the first underscore).
     *
     * @param map map name
     * @return the prefix, or the whole name if it has no underscore
     */
    @Nonnull
    public static String mapPrefix(@Nonnull String map) {
        int idx = map.indexOf('_');
        return idx < 0 ? map : map.substring(0, idx);
    }

    /**
     * Get the expected gamemode tag for a map and its gamemode.
     *
     * <p>Uses the gamemode table first and falls back to the map prefix.</p>
     *
     * @param gamemode resolved gamemode
     * @param map map name
     * @return expected tag, or an empty string when nothing is required
     */
    @Nonnull
    public String expectedTag(@Nonnull String gamemode, @Nonnull String map) {
        String tag = gamemodeTags.get(gamemode);
        if (tag != null && !tag.isEmpty()) {
            return tag;
        }
        return prefixTags.getOrDefault(mapPrefix(map), "");
    }

    /**
     * Map a tag to its official spelling.
     *
     * @param tag lowercase tag
     * @return canonical tag
     */
    @Nonnull
    public String canonicalTag(@Nonnull String tag) {
        return tagAliases.getOrDefault(tag, tag);
    }

    // Getters and Setters

    public Map<String, String> getBaseGameMaps() {
        return baseGameMaps;
    }

    public void setBaseGameMaps(Map<String, String> baseGameMaps) {
        this.baseGameMaps = baseGameMaps;
    }

    public Map<String, String> getBetaMaps() {
        return betaMaps;
    }

    public void setBetaMaps(Map<String, String> betaMaps) {
        this.betaMaps = betaMaps;
    }

    public Map<String, Integer> getHolidays() {
        return holidays;
    }

    public void setHolidays(Map<String, Integer> holidays) {
        this.holidays = holidays;
    }

    public Map<String, String> getGamemodeTags() {
        return gamemodeTags;
    }

    public void setGamemodeTags(Map<String, String> gamemodeTags) {
        this.gamemodeTags = gamemodeTags;
    }

    public List<String> getDefaultGamemodes() {
        return defaultGamemodes;
    }

    public void setDefaultGamemodes(List<String> defaultGamemodes) {
        this.defaultGamemodes = defaultGamemodes;
    }

    public List<String> getForcedCategories() {
        return forcedCategories;
    }

    public void setForcedCategories(List<String> forcedCategories) {
        this.forcedCategories = forcedCategories;
    }

    public List<String> getGroupedCategories() {
        return groupedCategories;
    }

    public void setGroupedCategories(List<String> groupedCategories) {
        this.groupedCategories = groupedCategories;
    }

    public List<String> getGroupingExemptGamemodes() {
        return groupingExemptGamemodes;
    }

    public void setGroupingExemptGamemodes(List<String> groupingExemptGamemodes) {
        this.groupingExemptGamemodes = groupingExemptGamemodes;
    }

    public List<String> getValidTags() {
        return validTags;
    }

    public void setValidTags(List<String> validTags) {
        this.validTags = validTags;
    }

    public List<String> getStandardMapPrefixes() {
        return standardMapPrefixes;
    }

    public void setStandardMapPrefixes(List<String> standardMapPrefixes) {
        this.standardMapPrefixes = standardMapPrefixes;
    }

    public Map<String, String> getPrefixTags() {
        return prefixTags;
    }

    public void setPrefixTags(Map<String, String> prefixTags) {
        this.prefixTags = prefixTags;
    }

    public List<String> getUnversionedExclusions() {
        return unversionedExclusions;
    }

    public void setUnversionedExclusions(List<String> unversionedExclusions) {
        this.unversionedExclusions = unversionedExclusions;
    }

    public Map<String, String> getCustomMapPrefixes() {
        return customMapPrefixes;
    }

    public void setCustomMapPrefixes(Map<String, String> customMapPrefixes) {
        this.customMapPrefixes = customMapPrefixes;
    }

    public Map<String, String> getTagAliases() {
        return tagAliases;
    }

    public void setTagAliases(Map<String, String> tagAliases) {
        this.tagAliases = tagAliases;
    }

    public List<String> getExemptTags() {
        return exemptTags;
    }

    public void setExemptTags(List<String> exemptTags) {
        this.exemptTags = exemptTags;
    }

    public List<String> getForcedModeTags() {
        return forcedModeTags;
    }

    public void setForcedModeTags(List<String> forcedModeTags) {
        this.forcedModeTags = forcedModeTags;
    }

    public String getIncreasedCapacityTag() {
        return increasedCapacityTag;
    }

    public void setIncreasedCapacityTag(String increasedCapacityTag) {
        this.increasedCapacityTag = increasedCapacityTag;
    }

    public String getBetaTag() {
        return betaTag;
    }

    public void setBetaTag(String betaTag) {
        this.betaTag = betaTag;
    }

    public String getMarkerCharacters() {
        return markerCharacters;
    }

    public void setMarkerCharacters(String markerCharacters) {
        this.markerCharacters = markerCharacters;
    }

    public List<EnrichmentRule> getEnrichment() {
        return enrichment;
    }

    public void setEnrichment(List<EnrichmentRule> enrichment) {
        this.enrichment = enrichment;
    }

    /**
     * A derived capability tag and the signals that imply it.
     */
    public static class EnrichmentRule {
        private String tag;
        private List<String> tagPatterns = new ArrayList<>();
        private List<String> namePatterns = new ArrayList<>();

        public String getTag() {
            return tag;
        }

        public void setTag(String tag) {
            this.tag = tag;
        }

        /**
         * Raw tags that imply the derived tag (exact match).
         */
        public List<String> getTagPatterns() {
            return tagPatterns;
        }

        public void setTagPatterns(List<String> tagPatterns) {
            this.tagPatterns = tagPatterns;
        }

        /**
         * Lowercase display name fragments that imply the derived tag.
         */
        public List<String> getNamePatterns() {
            return namePatterns;
        }

        public void setNamePatterns(List<String> namePatterns) {
            this.namePatterns = namePatterns;
        }
    }
}
