package me.internalizable.quickplay.publish;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.internalizable.quickplay.api.capability.PublishException;
import me.internalizable.quickplay.api.capability.SnapshotConsumer;
import me.internalizable.quickplay.api.snapshot.PublishedSchema;
import me.internalizable.quickplay.api.snapshot.PublishedSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;

/**
 * {@link SnapshotConsumer} posting JSON to the downstream site.
 */
public final class HttpSnapshotConsumer implements SnapshotConsumer {

    private static final Logger LOGGER = LoggerFactory.getLogger(HttpSnapshotConsumer.class);

    static final String SNAPSHOT_PATH = "/api/quickplay/update";
    static final String SCHEMA_PATH = "/api/schema/update";

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient httpClient;
    private final String baseUrl;
    private final String apiKey;
    private final Duration timeout;

    public HttpSnapshotConsumer(@Nonnull String baseUrl, @Nonnull String apiKey, @Nonnull Duration timeout) {
        this.baseUrl = stripTrailingSlash(Objects.requireNonNull(baseUrl, "baseUrl"));
        this.apiKey = Objects.requireNonNull(apiKey, "apiKey");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
    }

    @Override
    public void publishSnapshot(@Nonnull PublishedSnapshot snapshot) throws PublishException {
        post(SNAPSHOT_PATH, SnapshotJson.snapshot(mapper, snapshot));
    }

    @Override
    public void publishSchema(@Nonnull PublishedSchema schema) throws PublishException {
        post(SCHEMA_PATH, SnapshotJson.schema(mapper, schema));
    }

    private void post(String path, JsonNode body) throws PublishException {
        String payload;
        try {
            payload = mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new PublishException("Failed to encode " + path, e);
        }

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + apiKey)
                .POST(HttpRequest.BodyPublishers.ofString(payload))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new PublishException("POST " + path + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PublishException("POST " + path + " interrupted", e);
        }

        LOGGER.debug("POST {} -> {}", path, response.statusCode());
        if (response.statusCode() / 100 != 2) {
            throw new PublishException("POST " + path + " returned " + response.statusCode() + ": " + response.body());
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
