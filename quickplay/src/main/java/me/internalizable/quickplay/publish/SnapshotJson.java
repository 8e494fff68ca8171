package me.internalizable.quickplay.publish;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import me.internalizable.quickplay.api.snapshot.PublishedSchema;
import me.internalizable.quickplay.api.snapshot.PublishedServer;
import me.internalizable.quickplay.api.snapshot.PublishedSnapshot;
import me.internalizable.quickplay.candidate.RawCandidate;
import me.internalizable.quickplay.classify.ClassificationResult;
import me.internalizable.quickplay.classify.TagEnricher;
import me.internalizable.quickplay.stats.PopulationStats;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Map;

/**
 * Wire encoding shared by the artifact writer and the HTTP consumer.
 *
 * <p>Field names follow what the downstream site reads: {@code addr},
 * {@code steamid}, {@code players}, {@code max_players}, {@code gametype},
 * {@code point} ({@code [lon, lat]}) and {@code ping}.</p>
 */
public final class SnapshotJson {

    private SnapshotJson() {
    }

    @Nonnull
    public static ArrayNode servers(@Nonnull ObjectMapper mapper, @Nonnull List<PublishedServer> servers) {
        ArrayNode array = mapper.createArrayNode();
        for (PublishedServer server : servers) {
            ObjectNode node = array.addObject();
            node.put("addr", server.address());
            node.put("steamid", server.identity());
            node.put("name", server.name());
            node.put("players", server.humans());
            node.put("max_players", server.capacity());
            node.put("bots", server.bots());
            node.put("map", server.map());
            ArrayNode tags = node.putArray("gametype");
            server.tags().forEach(tags::add);
            node.put("score", server.score());
            ArrayNode point = node.putArray("point");
            point.add(server.point().longitude());
            point.add(server.point().latitude());
            node.put("ping", server.pingOverhead());
        }
        return array;
    }

    @Nonnull
    public static ObjectNode snapshot(@Nonnull ObjectMapper mapper, @Nonnull PublishedSnapshot snapshot) {
        ObjectNode root = mapper.createObjectNode();
        root.set("servers", servers(mapper, snapshot.servers()));
        root.put("until", snapshot.until().toEpochMilli() / 1000.0);
        return root;
    }

    @Nonnull
    public static ObjectNode schema(@Nonnull ObjectMapper mapper, @Nonnull PublishedSchema schema) {
        ObjectNode inner = mapper.createObjectNode();
        ObjectNode mapGamemodes = inner.putObject("map_gamemodes");
        schema.mapGamemodes().forEach(mapGamemodes::put);
        ObjectNode gamemodes = inner.putObject("gamemodes");
        for (Map.Entry<String, List<String>> entry : schema.gamemodes().entrySet()) {
            ArrayNode maps = gamemodes.putArray(entry.getKey());
            entry.getValue().forEach(maps::add);
        }
        ObjectNode root = mapper.createObjectNode();
        root.set("schema", inner);
        return root;
    }

    @Nonnull
    public static ArrayNode rejections(@Nonnull ObjectMapper mapper, @Nonnull List<ClassificationResult.Rejected> rejections) {
        ArrayNode array = mapper.createArrayNode();
        for (ClassificationResult.Rejected rejected : rejections) {
            RawCandidate candidate = rejected.candidate();
            ObjectNode node = array.addObject();
            node.put("removal", rejected.reason().getCode());
            node.put("detail", rejected.detail());
            node.put("addr", candidate.address());
            node.put("steamid", candidate.identity());
            node.put("name", candidate.name());
            node.put("players", candidate.humans());
            node.put("max_players", candidate.capacity());
            node.put("bots", candidate.bots());
            node.put("map", candidate.map());
            ArrayNode tags = node.putArray("gametype");
            TagEnricher.parse(candidate.tags()).forEach(tags::add);
        }
        return array;
    }

    /**
     * Encode population statistics as {@code {tags, caps, players, maps, concurrent_players, servers}}.
     *
     * @param mapper object mapper
     * @param stats the statistics
     * @return the tree
     */
    @Nonnull
    public static ObjectNode stats(@Nonnull ObjectMapper mapper, @Nonnull PopulationStats stats) {
        ObjectNode root = mapper.createObjectNode();
        counts(root.putObject("tags"), stats.tags());
        counts(root.putObject("caps"), stats.capacities());
        counts(root.putObject("players"), stats.servers());
        counts(root.putObject("maps"), stats.maps());
        root.put("concurrent_players", stats.concurrentPlayers());
        root.put("servers", stats.listedServers());
        return root;
    }

    private static void counts(ObjectNode node, Map<String, Integer> counts) {
        counts.forEach(node::put);
    }
}
