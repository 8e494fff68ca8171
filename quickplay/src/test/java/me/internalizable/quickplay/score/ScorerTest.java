package me.internalizable.quickplay.score;

import me.internalizable.quickplay.api.capability.GeoLocation;
import me.internalizable.quickplay.api.capability.ProbeResult;
import me.internalizable.quickplay.candidate.ClassifiedServer;
import me.internalizable.quickplay.candidate.RawCandidate;
import me.internalizable.quickplay.candidate.ScoredServer;
import me.internalizable.quickplay.classify.TickContext;
import me.internalizable.quickplay.config.QuickplayConfig;
import me.internalizable.quickplay.geo.GeoEstimator;
import me.internalizable.quickplay.store.BanList;
import me.internalizable.quickplay.store.GeoOverrideTable;
import me.internalizable.quickplay.store.InMemoryKeyValueStore;
import me.internalizable.quickplay.store.ReputationStore;
import me.internalizable.quickplay.support.FakeGeoLocator;
import me.internalizable.quickplay.support.Fixtures;
import me.internalizable.quickplay.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Scorer Tests")
class ScorerTest {

    private static final double EPSILON = 1e-9;
    private static final String HOST = "203.0.113.10";
    private static final String NETWORK = "203.0.113.0/24";
    private static final GeoLocation FRANKFURT = new GeoLocation("DE", "EU", 50.11, 8.68);

    private QuickplayConfig config;
    private InMemoryKeyValueStore store;
    private ReputationStore reputation;
    private FakeGeoLocator locator;
    private Scorer scorer;
    private TickContext context;

    @BeforeEach
    void setUp() throws Exception {
        config = new QuickplayConfig();
        config.getGeo().setOriginLatitude(52.37);
        config.getGeo().setOriginLongitude(4.90);

        store = new InMemoryKeyValueStore();
        reputation = new ReputationStore(store);
        locator = new FakeGeoLocator().locate(HOST, FRANKFURT);
        GeoEstimator geo = new GeoEstimator(locator, new GeoOverrideTable(store), config.getGeo());
        geo.resolveOrigin();

        MutableClock clock = new MutableClock(Fixtures.MARCH);
        scorer = new Scorer(
                config,
                reputation,
                geo,
                new TrendCache(config.getScoring(), clock),
                new JitterCache(config.getScoring(), clock, new Random(3)),
                new NameSanitizer("\u0001")
        );
        context = new TickContext(Fixtures.schema(3), 0, BanList.EMPTY, Set.of(NETWORK), true);
    }

    private static ClassifiedServer server(String identity, String name, int humans, int capacity, String title) {
        RawCandidate candidate = new RawCandidate(HOST + ":27015", identity, name, 440, "tf", "tf",
                humans, 0, capacity, "cp_testmap", "cp", 9000);
        ProbeResult live = new ProbeResult(440, "tf", title, humans, 0, capacity, "cp_testmap", "cp", "9000",
                false, Duration.ofMillis(50));
        return new ClassifiedServer(candidate, Set.of("cp"), "capture_point", "cp", live);
    }

    private static ClassifiedServer server(int humans) {
        return server("85568392920040000", "Test Server", humans, 24, "Team Fortress");
    }

    @Test
    @DisplayName("Base bonus plus population at the peak")
    void testPeakScore() {
        assertEquals(7.6, scorer.computeScore(server(17), context), EPSILON);
    }

    @Test
    @DisplayName("Reputation is added")
    void testReputation() throws Exception {
        reputation.set("85568392920040000", 0.5);
        assertEquals(8.1, scorer.computeScore(server(17), context), EPSILON);
    }

    @Test
    @DisplayName("Each penalty subtracts its amount")
    void testPenalties() {
        assertEquals(7.5, scorer.computeScore(
                server("90071996842377216", "Test Server", 17, 24, "Team Fortress"), context), EPSILON);
        assertEquals(7.5, scorer.computeScore(
                server("85568392920040001", "Test Server", 17, 24, "Other Game"), context), EPSILON);
        assertEquals(7.5, scorer.computeScore(
                server("85568392920040002", "\u0001Test Server", 17, 24, "Team Fortress"), context), EPSILON);

        locator.network(HOST, NETWORK);
        assertEquals(7.5, scorer.computeScore(server(17), context), EPSILON);
        assertEquals(7.2, scorer.computeScore(
                server("90071996842377217", "\u0001Test Server", 17, 24, "Other Game"), context), EPSILON);
    }

    @Test
    @DisplayName("Rejected population short-circuits every bonus")
    void testRejectionScore() throws Exception {
        reputation.set("85568392920040000", 3.0);
        assertEquals(-100.0, scorer.computeScore(server(23), context));
    }

    @Test
    @DisplayName("Empty servers carry a held jitter offset")
    void testEmptyJitter() {
        double first = scorer.computeScore(server(0), context);
        double second = scorer.computeScore(server(0), context);

        assertEquals(first, second);
        assertEquals(5.7, first, 0.5);
        assertTrue(scorer.getJitter().contains("85568392920040000"));
    }

    @Test
    @DisplayName("Climbing servers earn the trend bonus")
    void testTrendBonus() {
        scorer.computeScore(server(5), context);
        double score = scorer.computeScore(server(10), context);

        double population = PopulationCurve.score(10, 24, config.getScoring());
        assertEquals(6.0 + population + 0.05 + 0.2 * 5 / 11.0, score, EPSILON);
        assertEquals(5, scorer.getTrends().trough("85568392920040000"));
    }

    @Test
    @DisplayName("Scored server carries location, overhead and a clean name")
    void testScore() {
        Optional<ScoredServer> scored = scorer.score(
                server("85568392920040000", "\u0001 Test Server", 17, 24, "Team Fortress"), context);

        assertTrue(scored.isPresent());
        ScoredServer server = scored.get();
        assertEquals(FRANKFURT, server.location());
        assertEquals("Test Server", server.name());
        assertEquals(43.45, server.pingOverhead(), 0.2);
        assertEquals(7.5, server.score(), EPSILON);
        assertEquals(8.68, server.toPublished().point().longitude());
        assertEquals(50.11, server.toPublished().point().latitude());
    }

    @Test
    @DisplayName("Unlocatable servers are dropped")
    void testGeoMiss() {
        RawCandidate candidate = new RawCandidate("198.51.100.9:27015", "85568392920040000", "Test Server", 440,
                "tf", "tf", 17, 0, 24, "cp_testmap", "cp", 9000);
        ClassifiedServer unknown = new ClassifiedServer(candidate, Set.of("cp"), "capture_point", "cp",
                Fixtures.live("cp_testmap", "cp", 17, 24));

        assertFalse(scorer.score(unknown, context).isPresent());
    }

    @Test
    @DisplayName("Unverified servers cannot be scored")
    void testUnverified() {
        ClassifiedServer unverified = new ClassifiedServer(Fixtures.candidate("cp_testmap", "cp"),
                Set.of("cp"), "capture_point", "cp", null);
        assertThrows(IllegalArgumentException.class, () -> scorer.score(unverified, context));
    }
}
