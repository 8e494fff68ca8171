package me.internalizable.quickplay.support;

import me.internalizable.quickplay.api.capability.DirectoryServer;
import me.internalizable.quickplay.api.capability.ProbeResult;
import me.internalizable.quickplay.candidate.RawCandidate;
import me.internalizable.quickplay.config.QuickplayConfig;
import me.internalizable.quickplay.schema.KeyValuesParser;
import me.internalizable.quickplay.schema.MatchmakingTables;
import me.internalizable.quickplay.schema.SchemaDocumentParser;
import me.internalizable.quickplay.schema.SchemaSnapshot;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

/**
 * Shared test data: a small schema document, directory descriptors and probe
 * results for a well-formed server.
 */
public final class Fixtures {

    /** Mid-March: both holiday categories are out of season. */
    public static final Instant MARCH = Instant.parse("2026-03-15T12:00:00Z");
    public static final Instant OCTOBER = Instant.parse("2026-10-15T12:00:00Z");

    public static final String SCHEMA_IDENTITY = "https://media.example.net/items_game.abc123.txt";
    public static final long MINIMUM_VERSION = 8000;

    public static final String SCHEMA_DOCUMENT = """
            // test schema
            "items_game"
            {
                "matchmaking_categories"
                {
                    "core" { "valid_match_groups" { "MatchGroup_Casual_12v12" "1" } }
                    "alternative" { "valid_match_groups" { "MatchGroup_Casual_12v12" "1" } }
                    "special_events" { "valid_match_groups" { "MatchGroup_Casual_12v12" "1" } }
                    "beta" { "valid_match_groups" { "MatchGroup_Casual_12v12" "0" } }
                }
                "maps"
                {
                    "capture_point"
                    {
                        "mm_type" "core"
                        "maplist"
                        {
                            "0" { "name" "cp_testmap" "enabled" "1" }
                            "1" { "name" "cp_disabled" "enabled" "0" }
                        }
                    }
                    "koth"
                    {
                        "mm_type" "core"
                        "maplist"
                        {
                            "0" { "name" "koth_testhill_rc2" "enabled" "1" }
                            "1" { "name" "pl_coal_rc23" "enabled" "1" }
                        }
                    }
                    "payload"
                    {
                        "mm_type" "core"
                        "maplist"
                        {
                            "0" { "name" "pl_testrail" "enabled" "1" }
                        }
                    }
                    "halloween_koth"
                    {
                        "mm_type" "special_events"
                        "restrictions" { "holiday" "halloween" }
                        "maplist"
                        {
                            "0" { "name" "koth_spookytest" "enabled" "1" }
                        }
                    }
                    "christmas_cp"
                    {
                        "mm_type" "special_events"
                        "restrictions" { "holiday" "christmas" }
                        "maplist"
                        {
                            "0" { "name" "cp_snowytest" "enabled" "1" }
                        }
                    }
                    "arena"
                    {
                        "mm_type" "core"
                        "maplist"
                        {
                            "0" { "name" "arena_testarena" "enabled" "0" }
                        }
                    }
                    "powerup"
                    {
                        "mm_type" "alternative"
                        "maplist"
                        {
                            "0" { "name" "ctf_testpower" "enabled" "1" }
                        }
                    }
                    "beta_maps"
                    {
                        "mm_type" "beta"
                        "maplist"
                        {
                            "0" { "name" "cp_hiddenbeta" "enabled" "1" }
                        }
                    }
                }
            }
            """;

    private static MatchmakingTables tables;

    private Fixtures() {
    }

    public static synchronized MatchmakingTables tables() {
        if (tables == null) {
            try {
                tables = MatchmakingTables.loadDefaults();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
        return tables;
    }

    public static SchemaSnapshot schema(int month) {
        try {
            return SchemaDocumentParser.parse(KeyValuesParser.parse(SCHEMA_DOCUMENT), tables(),
                    "MatchGroup_Casual_12v12", month, SCHEMA_IDENTITY);
        } catch (KeyValuesParser.ParseException e) {
            throw new IllegalStateException(e);
        }
    }

    /**
     * Configuration with a fixed origin and artifacts under a temporary directory.
     */
    public static QuickplayConfig config(Path dir) {
        QuickplayConfig config = new QuickplayConfig();
        config.getGeo().setOriginLatitude(52.37);
        config.getGeo().setOriginLongitude(4.90);
        config.getPoll().setWorkerThreads(4);
        config.getPoll().setProbeTimeoutMillis(200);
        config.getEndpoints().setSnapshotFile(dir.resolve("servers.json").toString());
        config.getEndpoints().setRejectionsFile(dir.resolve("rejections.json").toString());
        config.getEndpoints().setStatsFile(dir.resolve("server_stats.json").toString());
        config.getEndpoints().setStoreFile(dir.resolve("db.json").toString());
        return config;
    }

    public static DirectoryServer server(String address, String identity, String map, String tags, int humans, int capacity) {
        return new DirectoryServer(address, identity, "Test Server " + identity, 440, "tf", "tf",
                humans, 0, capacity, map, tags, "9000");
    }

    public static RawCandidate candidate(String address, String identity, String map, String tags, int humans, int capacity) {
        return RawCandidate.fromDirectory(server(address, identity, map, tags, humans, capacity));
    }

    public static RawCandidate candidate(String map, String tags) {
        return candidate("203.0.113.10:27015", "85568392920040000", map, tags, 12, 24);
    }

    public static ProbeResult live(String map, String tags, int humans, int capacity) {
        return new ProbeResult(440, "tf", "Team Fortress", humans, 0, capacity, map, tags, "9000", false,
                Duration.ofMillis(50));
    }
}
