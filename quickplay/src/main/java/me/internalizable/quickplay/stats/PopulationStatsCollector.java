package me.internalizable.quickplay.stats;

import me.internalizable.quickplay.candidate.RawCandidate;
import me.internalizable.quickplay.classify.TagEnricher;
import me.internalizable.quickplay.classify.TickContext;
import me.internalizable.quickplay.config.QuickplayConfig;
import me.internalizable.quickplay.score.NameSanitizer;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Aggregates the population of a directory listing.
 *
 * <p>Servers of another game and banned servers are ignored. Every other
 * server counts towards the tag and capacity histograms and the concurrent
 * player total. The per-map and per-server breakdowns only include servers
 * with a plausible population: enough humans, a real capacity, a current
 * build and a map.</p>
 */
public final class PopulationStatsCollector {

    private final QuickplayConfig.GameConfig game;
    private final QuickplayConfig.StatsConfig stats;
    private final NameSanitizer sanitizer;

    public PopulationStatsCollector(@Nonnull QuickplayConfig config, @Nonnull NameSanitizer sanitizer) {
        Objects.requireNonNull(config, "config");
        this.game = config.getGame();
        this.stats = config.getStats();
        this.sanitizer = Objects.requireNonNull(sanitizer, "sanitizer");
    }

    /**
     * Aggregate one listing.
     *
     * @param candidates listed servers
     * @param context bans and minimum version of the tick
     * @return the statistics
     */
    @Nonnull
    public PopulationStats collect(@Nonnull List<RawCandidate> candidates, @Nonnull TickContext context) {
        Map<String, Integer> tags = new LinkedHashMap<>();
        Map<String, Integer> capacities = new LinkedHashMap<>();
        Map<String, Integer> servers = new LinkedHashMap<>();
        Map<String, Integer> maps = new LinkedHashMap<>();
        int concurrent = 0;
        int listed = 0;

        for (RawCandidate c : candidates) {
            if (c.appId() != game.getAppId()
                    || !game.getGameDir().equals(c.gameDir())
                    || !game.getGameDir().equals(c.product())) {
                continue;
            }
            if (context.bans().identities().contains(c.identity()) || context.bans().addresses().contains(c.host())) {
                continue;
            }

            listed++;
            concurrent += c.humans();
            for (String tag : TagEnricher.parse(c.tags())) {
                tags.merge(tag, 1, Integer::sum);
            }
            capacities.merge(String.valueOf(c.capacity()), 1, Integer::sum);

            if (isPopulated(c, context.minimumVersion())) {
                servers.merge(sanitizer.sanitize(c.name()), c.humans(), Integer::sum);
                maps.merge(c.map(), c.humans(), Integer::sum);
            }
        }

        return new PopulationStats(
                byAscendingCount(tags),
                byAscendingCount(capacities),
                byAscendingCount(servers),
                byAscendingCount(maps),
                concurrent,
                listed
        );
    }

    private boolean isPopulated(RawCandidate c, long minimumVersion) {
        return c.humans() >= stats.getMinHumans()
                && c.capacity() >= stats.getMinCapacity()
                && c.version() >= minimumVersion
                && !c.map().isEmpty();
    }

    private static Map<String, Integer> byAscendingCount(Map<String, Integer> counts) {
        List<Map.Entry<String, Integer>> entries = new ArrayList<>(counts.entrySet());
        entries.sort(Map.Entry.comparingByValue());
        Map<String, Integer> sorted = new LinkedHashMap<>();
        for (Map.Entry<String, Integer> entry : entries) {
            sorted.put(entry.getKey(), entry.getValue());
        }
        return sorted;
    }
}
