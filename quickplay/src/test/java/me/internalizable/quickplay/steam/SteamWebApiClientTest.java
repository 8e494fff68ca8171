package me.internalizable.quickplay.steam;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import me.internalizable.quickplay.api.capability.DirectoryException;
import me.internalizable.quickplay.api.capability.DirectoryServer;
import me.internalizable.quickplay.api.capability.SchemaSourceException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("SteamWebApiClient Tests")
class SteamWebApiClientTest {

    private static final String SERVER_LIST = """
            {"response": {"servers": [
              {"addr": "203.0.113.10:27015", "steamid": "85568392920040000", "name": "Test Server",
               "appid": 440, "gamedir": "tf", "product": "tf", "players": 12, "bots": 1,
               "max_players": 24, "map": "cp_testmap", "gametype": "cp,alltalk", "version": "9000",
               "region": 3},
              {"addr": "203.0.113.11:27015", "steamid": "85568392920040001"}
            ]}}
            """;

    private final Map<String, String> responses = new ConcurrentHashMap<>();
    private final Map<String, String> queries = new ConcurrentHashMap<>();
    private HttpServer server;
    private String baseUrl;
    private SteamWebApiClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", exchange -> {
            String path = exchange.getRequestURI().getPath();
            String query = exchange.getRequestURI().getRawQuery();
            queries.put(path, query != null ? query : "");
            String body = responses.get(path);
            byte[] bytes = (body != null ? body : "not found").getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(body != null ? 200 : 404, bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
        client = new SteamWebApiClient(baseUrl, "key123", Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    @DisplayName("Server list is converted in directory order")
    void testListServers() throws Exception {
        responses.put(SteamWebApiClient.SERVER_LIST_PATH, SERVER_LIST);

        List<DirectoryServer> servers = client.listServers("\\appid\\440", 500);

        assertEquals(2, servers.size());
        DirectoryServer first = servers.get(0);
        assertEquals("203.0.113.10:27015", first.address());
        assertEquals(12, first.humans());
        assertEquals(24, first.capacity());
        assertEquals("cp,alltalk", first.tags());
        assertEquals("9000", first.version());

        DirectoryServer sparse = servers.get(1);
        assertEquals("", sparse.map());
        assertEquals(0, sparse.capacity());

        String query = queries.get(SteamWebApiClient.SERVER_LIST_PATH);
        assertTrue(query.contains("key=key123"));
        assertTrue(query.contains("limit=500"));
        assertTrue(query.contains("filter=%5Cappid%5C440"));
    }

    @Test
    @DisplayName("Malformed or failed listing raises a directory error")
    void testListServersFailures() {
        assertThrows(DirectoryException.class, () -> client.listServers("", 10));

        responses.put(SteamWebApiClient.SERVER_LIST_PATH, "{\"response\": {}}");
        assertThrows(DirectoryException.class, () -> client.listServers("", 10));
    }

    @Test
    @DisplayName("Schema identity and document are fetched")
    void testSchema() throws Exception {
        String documentUrl = baseUrl + "/items_game.txt";
        responses.put(SteamWebApiClient.SCHEMA_OVERVIEW_PATH,
                "{\"result\": {\"items_game_url\": \"" + documentUrl + "\"}}");
        responses.put("/items_game.txt", "\"items_game\" { }");

        String identity = client.fetchDocumentIdentity();

        assertEquals(documentUrl, identity);
        assertEquals("\"items_game\" { }", client.fetchDocument(identity));
    }

    @Test
    @DisplayName("Missing schema URL is an error")
    void testMissingSchemaUrl() {
        responses.put(SteamWebApiClient.SCHEMA_OVERVIEW_PATH, "{\"result\": {}}");
        assertThrows(SchemaSourceException.class, () -> client.fetchDocumentIdentity());
        assertThrows(SchemaSourceException.class, () -> client.fetchDocument("not a uri"));
    }

    @Test
    @DisplayName("Minimum version is read when reported")
    void testMinimumVersion() throws Exception {
        responses.put(SteamWebApiClient.SERVER_VERSION_PATH, "{\"result\": {\"min_allowed_version\": 8622567}}");
        assertEquals(OptionalLong.of(8622567), client.fetchMinimumVersion());

        responses.put(SteamWebApiClient.SERVER_VERSION_PATH, "{\"result\": {}}");
        assertEquals(OptionalLong.empty(), client.fetchMinimumVersion());
    }

    @Test
    @DisplayName("Descriptor conversion tolerates missing fields")
    void testToDirectoryServer() throws Exception {
        DirectoryServer server = SteamWebApiClient.toDirectoryServer(new ObjectMapper().readTree(
                "{\"addr\": \"198.51.100.2\", \"steamid\": \"5\"}"));

        assertEquals("198.51.100.2", server.address());
        assertEquals("", server.gameDir());
        assertEquals("", server.version());
    }
}
