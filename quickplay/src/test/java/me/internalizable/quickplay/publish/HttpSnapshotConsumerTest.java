package me.internalizable.quickplay.publish;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import me.internalizable.quickplay.api.capability.PublishException;
import me.internalizable.quickplay.api.snapshot.GeoPoint;
import me.internalizable.quickplay.api.snapshot.PublishedSchema;
import me.internalizable.quickplay.api.snapshot.PublishedServer;
import me.internalizable.quickplay.api.snapshot.PublishedSnapshot;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("HttpSnapshotConsumer Tests")
class HttpSnapshotConsumerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final Map<String, String> bodies = new ConcurrentHashMap<>();
    private final Map<String, String> authorizations = new ConcurrentHashMap<>();
    private final AtomicInteger status = new AtomicInteger(200);
    private HttpServer server;
    private HttpSnapshotConsumer consumer;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", exchange -> {
            String path = exchange.getRequestURI().getPath();
            try (InputStream in = exchange.getRequestBody()) {
                bodies.put(path, new String(in.readAllBytes(), StandardCharsets.UTF_8));
            }
            authorizations.put(path, exchange.getRequestHeaders().getFirst("Authorization"));
            byte[] response = "{}".getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status.get(), response.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(response);
            }
        });
        server.start();
        String baseUrl = "http://127.0.0.1:" + server.getAddress().getPort() + "/";
        consumer = new HttpSnapshotConsumer(baseUrl, "secret", Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    @DisplayName("Snapshot is posted with the bearer key")
    void testPublishSnapshot() throws Exception {
        PublishedServer published = new PublishedServer("203.0.113.10:27015", "1", "Test", 12, 0, 24, "cp_testmap",
                List.of("cp"), 7.6, new GeoPoint(8.68, 50.11), 43.5);
        Instant until = Instant.parse("2026-03-15T12:00:13Z");

        consumer.publishSnapshot(new PublishedSnapshot(List.of(published), until));

        JsonNode body = mapper.readTree(bodies.get(HttpSnapshotConsumer.SNAPSHOT_PATH));
        assertEquals("Bearer secret", authorizations.get(HttpSnapshotConsumer.SNAPSHOT_PATH));
        assertEquals(until.getEpochSecond(), body.get("until").asDouble(), 1e-6);
        assertEquals("203.0.113.10:27015", body.get("servers").get(0).get("addr").asText());
        assertEquals(7.6, body.get("servers").get(0).get("score").asDouble());
    }

    @Test
    @DisplayName("Schema is posted wrapped in a schema object")
    void testPublishSchema() throws Exception {
        consumer.publishSchema(new PublishedSchema(
                Map.of("koth_spookytest", "special_events"),
                Map.of("special_events", List.of("koth_spookytest"))));

        JsonNode body = mapper.readTree(bodies.get(HttpSnapshotConsumer.SCHEMA_PATH)).get("schema");
        assertEquals("special_events", body.get("map_gamemodes").get("koth_spookytest").asText());
        assertEquals("koth_spookytest", body.get("gamemodes").get("special_events").get(0).asText());
    }

    @Test
    @DisplayName("Non-success status is reported as a publish failure")
    void testErrorStatus() {
        status.set(503);
        assertThrows(PublishException.class, () -> consumer.publishSchema(new PublishedSchema(Map.of(), Map.of())));
    }
}
