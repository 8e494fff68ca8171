package me.internalizable.quickplay.classify;

import me.internalizable.quickplay.schema.MatchmakingTables;

import javax.annotation.Nonnull;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Normalizes advertised tags and infers capability tags the server did not
 * advertise itself.
 *
 * <p>Purely additive: advertised tags are never removed. Tag patterns match
 * whole tags; name patterns match substrings of the lowercase display name
 * padded with a space on each side.</p>
 */
public final class TagEnricher {

    private final MatchmakingTables tables;

    public TagEnricher(@Nonnull MatchmakingTables tables) {
        this.tables = Objects.requireNonNull(tables, "tables");
    }

    /**
     * Split a raw tag string.
     *
     * @param raw comma separated tags
     * @return lowercase, trimmed, non-empty tags in advertised order
     */
    @Nonnull
    public static Set<String> parse(@Nonnull String raw) {
        Set<String> tags = new LinkedHashSet<>();
        for (String tag : raw.toLowerCase(Locale.ROOT).split(",")) {
            String trimmed = tag.trim();
            if (!trimmed.isEmpty()) {
                tags.add(trimmed);
            }
        }
        return tags;
    }

    /**
     * Add inferred tags and the official spelling of aliased tags.
     *
     * @param advertised parsed advertised tags
     * @param name server display name
     * @return the enriched tag set
     */
    @Nonnull
    public Set<String> enrich(@Nonnull Set<String> advertised, @Nonnull String name) {
        Set<String> tags = new LinkedHashSet<>(advertised);
        String paddedName = " " + name.toLowerCase(Locale.ROOT) + " ";

        for (MatchmakingTables.EnrichmentRule rule : tables.getEnrichment()) {
            if (rule.getTag() == null || rule.getTag().isEmpty()) {
                continue;
            }
            if (matchesTag(rule, advertised) || matchesName(rule, paddedName)) {
                tags.add(rule.getTag());
            }
        }

        Set<String> canonical = new LinkedHashSet<>();
        for (String tag : tags) {
            canonical.add(tables.canonicalTag(tag));
        }
        tags.addAll(canonical);
        return tags;
    }

    private static boolean matchesTag(MatchmakingTables.EnrichmentRule rule, Set<String> advertised) {
        for (String pattern : rule.getTagPatterns()) {
            if (advertised.contains(pattern)) {
                return true;
            }
        }
        return false;
    }

    private static boolean matchesName(MatchmakingTables.EnrichmentRule rule, String paddedName) {
        for (String pattern : rule.getNamePatterns()) {
            if (!pattern.isEmpty() && paddedName.contains(pattern)) {
                return true;
            }
        }
        return false;
    }
}
