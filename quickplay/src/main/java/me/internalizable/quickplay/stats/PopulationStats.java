package me.internalizable.quickplay.stats;

import javax.annotation.Nonnull;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Population breakdown of one directory listing.
 *
 * <p>Every map is ordered by ascending count, ties in listing order.</p>
 *
 * @param tags servers advertising each tag
 * @param capacities servers per advertised capacity
 * @param servers human players per server name
 * @param maps human players per map
 * @param concurrentPlayers human players on every listed server of the game
 * @param listedServers servers of the game that were not banned
 */
public record PopulationStats(
        @Nonnull Map<String, Integer> tags,
        @Nonnull Map<String, Integer> capacities,
        @Nonnull Map<String, Integer> servers,
        @Nonnull Map<String, Integer> maps,
        int concurrentPlayers,
        int listedServers
) {

    public static final PopulationStats EMPTY = new PopulationStats(Map.of(), Map.of(), Map.of(), Map.of(), 0, 0);

    public PopulationStats {
        tags = copy(tags);
        capacities = copy(capacities);
        servers = copy(servers);
        maps = copy(maps);
    }

    private static Map<String, Integer> copy(Map<String, Integer> source) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
