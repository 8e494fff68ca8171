package me.internalizable.quickplay.steam;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.internalizable.quickplay.api.capability.DirectoryException;
import me.internalizable.quickplay.api.capability.DirectoryServer;
import me.internalizable.quickplay.api.capability.SchemaDocumentSource;
import me.internalizable.quickplay.api.capability.SchemaSourceException;
import me.internalizable.quickplay.api.capability.ServerDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Client for the parts of the Steam Web API the pipeline uses.
 *
 * <p>Serves as both the {@link ServerDirectory} and the
 * {@link SchemaDocumentSource}: the document identity is the items-game URL
 * from the schema overview, and the document is the text behind it.</p>
 */
public final class SteamWebApiClient implements ServerDirectory, SchemaDocumentSource {

    private static final Logger LOGGER = LoggerFactory.getLogger(SteamWebApiClient.class);

    static final String SERVER_LIST_PATH = "/IGameServersService/GetServerList/v1/";
    static final String SCHEMA_OVERVIEW_PATH = "/IEconItems_440/GetSchemaOverview/v1/";
    static final String SERVER_VERSION_PATH = "/IGCVersion_440/GetServerVersion/v1/";

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient httpClient;
    private final String baseUrl;
    private final String apiKey;
    private final Duration timeout;

    public SteamWebApiClient(@Nonnull String baseUrl, @Nonnull String apiKey, @Nonnull Duration timeout) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey = Objects.requireNonNull(apiKey, "apiKey");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    // ==================== Directory ====================

    @Override
    @Nonnull
    public List<DirectoryServer> listServers(@Nonnull String filter, int limit) throws DirectoryException {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("limit", String.valueOf(limit));
        params.put("filter", filter);

        JsonNode body;
        try {
            body = getJson(SERVER_LIST_PATH, params);
        } catch (IOException e) {
            throw new DirectoryException("Server list request failed", e);
        }

        JsonNode servers = body.path("response").path("servers");
        if (!servers.isArray()) {
            throw new DirectoryException("Server list response has no servers array");
        }

        List<DirectoryServer> result = new ArrayList<>(servers.size());
        for (JsonNode server : servers) {
            result.add(toDirectoryServer(server));
        }
        LOGGER.debug("Directory returned {} servers", result.size());
        return result;
    }

    static DirectoryServer toDirectoryServer(JsonNode server) {
        return new DirectoryServer(
                server.path("addr").asText(""),
                server.path("steamid").asText(""),
                server.path("name").asText(""),
                server.path("appid").asInt(0),
                server.path("gamedir").asText(""),
                server.path("product").asText(""),
                server.path("players").asInt(0),
                server.path("bots").asInt(0),
                server.path("max_players").asInt(0),
                server.path("map").asText(""),
                server.path("gametype").asText(""),
                server.path("version").asText("")
        );
    }

    // ==================== Schema ====================

    @Override
    @Nonnull
    public String fetchDocumentIdentity() throws SchemaSourceException {
        JsonNode body;
        try {
            body = getJson(SCHEMA_OVERVIEW_PATH, Map.of());
        } catch (IOException e) {
            throw new SchemaSourceException("Schema overview request failed", e);
        }
        String url = body.path("result").path("items_game_url").asText("");
        if (url.isEmpty()) {
            throw new SchemaSourceException("Schema overview has no items_game_url");
        }
        return url;
    }

    @Override
    @Nonnull
    public String fetchDocument(@Nonnull String identity) throws SchemaSourceException {
        try {
            return get(URI.create(identity));
        } catch (IOException | IllegalArgumentException e) {
            throw new SchemaSourceException("Failed to fetch " + identity, e);
        }
    }

    @Override
    @Nonnull
    public OptionalLong fetchMinimumVersion() throws SchemaSourceException {
        JsonNode body;
        try {
            body = getJson(SERVER_VERSION_PATH, Map.of());
        } catch (IOException e) {
            throw new SchemaSourceException("Server version request failed", e);
        }
        JsonNode version = body.path("result").path("min_allowed_version");
        return version.canConvertToLong() && version.asLong() > 0 ? OptionalLong.of(version.asLong()) : OptionalLong.empty();
    }

    // ==================== HTTP ====================

    private JsonNode getJson(String path, Map<String, String> params) throws IOException {
        StringBuilder url = new StringBuilder(baseUrl).append(path)
                .append("?key=").append(encode(apiKey))
                .append("&format=json");
        params.forEach((k, v) -> url.append('&').append(encode(k)).append('=').append(encode(v)));
        return mapper.readTree(get(URI.create(url.toString())));
    }

    private String get(URI uri) throws IOException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout)
                .GET()
                .build();
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Request to " + uri.getPath() + " interrupted", e);
        }
        if (response.statusCode() / 100 != 2) {
            throw new IOException("GET " + uri.getPath() + " returned " + response.statusCode());
        }
        return response.body();
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
