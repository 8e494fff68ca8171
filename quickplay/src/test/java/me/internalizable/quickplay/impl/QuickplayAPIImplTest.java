package me.internalizable.quickplay.impl;

import me.internalizable.quickplay.api.QuickplayAPI;
import me.internalizable.quickplay.api.snapshot.PublishedServer;
import me.internalizable.quickplay.api.snapshot.PublishedSnapshot;
import me.internalizable.quickplay.support.ServiceHarness;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("QuickplayAPIImpl Tests")
class QuickplayAPIImplTest {

    @TempDir
    Path tempDir;

    private ServiceHarness harness;
    private QuickplayAPI api;

    @BeforeEach
    void setUp() throws Exception {
        harness = new ServiceHarness(tempDir);
        harness.service.initialize();
        api = harness.service.getApi();
    }

    @AfterEach
    void tearDown() {
        harness.service.shutdown();
    }

    @Test
    @DisplayName("Queries before the first tick are empty")
    void testBeforeFirstTick() {
        assertNull(api.getLatestSnapshot());
        assertNull(api.findBestServer());
        assertNull(api.getSchema());
        assertTrue(api.getServersOnMap("cp_testmap").isEmpty());
        assertTrue(api.getRejectionCounts().isEmpty());

        QuickplayAPI.QuickplayStats stats = api.getStats();
        assertEquals(0, stats.getCandidates());
        assertEquals(0, stats.getRankedServers());
        assertEquals(0, stats.getConcurrentPlayers());
        assertEquals(0, stats.getTicks());
    }

    @Test
    @DisplayName("Refresh runs a tick and exposes its results")
    void testRefresh() throws Exception {
        PublishedSnapshot snapshot = api.refresh().get(10, TimeUnit.SECONDS);

        assertEquals(2, snapshot.servers().size());
        assertEquals(snapshot, api.getLatestSnapshot());
        assertEquals(ServiceHarness.BUSY, api.findBestServer().identity());
        assertNotNull(api.getSchema());
        assertEquals(1, harness.consumer.getSnapshots().size());
    }

    @Test
    @DisplayName("Servers on a map are matched case-insensitively")
    void testServersOnMap() throws Exception {
        api.refresh().get(10, TimeUnit.SECONDS);

        List<PublishedServer> servers = api.getServersOnMap("CP_TESTMAP");

        assertEquals(1, servers.size());
        assertEquals(ServiceHarness.BUSY, servers.get(0).identity());
        assertTrue(api.getServersOnMap("pl_nowhere").isEmpty());
    }

    @Test
    @DisplayName("Rejection counts are keyed by reason name")
    void testRejectionCounts() throws Exception {
        api.refresh().get(10, TimeUnit.SECONDS);

        Map<String, Integer> counts = api.getRejectionCounts();

        assertEquals(1, counts.get("CUSTOM_MAP"));
        assertEquals(1, counts.get("PROBE_TIMEOUT"));
        assertEquals(1, counts.get("RELAY_ADDRESS"));
        assertEquals(3, counts.size());
    }

    @Test
    @DisplayName("Stats summarize the last tick")
    void testStats() throws Exception {
        api.refresh().get(10, TimeUnit.SECONDS);

        QuickplayAPI.QuickplayStats stats = api.getStats();

        assertEquals(5, stats.getCandidates());
        assertEquals(2, stats.getRankedServers());
        assertEquals(3, stats.getRejectedServers());
        assertEquals(22, stats.getTotalHumans());
        assertEquals(56, stats.getConcurrentPlayers());
        assertEquals(1, stats.getTicks());
    }

    @Test
    @DisplayName("Refresh without publishing leaves the consumer alone")
    void testRefreshWithoutPublish() throws Exception {
        api.refresh(QuickplayAPI.RefreshOptions.builder().publish(false).build()).get(10, TimeUnit.SECONDS);

        assertTrue(harness.consumer.getSnapshots().isEmpty());
        assertTrue(harness.consumer.getSchemas().isEmpty());
        assertNotNull(api.findBestServer());
    }
}
