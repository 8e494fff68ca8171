package me.internalizable.quickplay.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("JsonFileKeyValueStore Tests")
class JsonFileKeyValueStoreTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Missing file opens empty without creating it")
    void testOpenMissing() throws IOException {
        Path file = tempDir.resolve("db.json");
        JsonFileKeyValueStore store = JsonFileKeyValueStore.open(file);

        assertNull(store.get("bans", "ids"));
        assertFalse(Files.exists(file));
    }

    @Test
    @DisplayName("Writes persist and survive reopening")
    void testPersistence() throws IOException {
        Path file = tempDir.resolve("nested").resolve("db.json");
        JsonFileKeyValueStore store = JsonFileKeyValueStore.open(file);
        store.set("reputation", "123", JsonNodeFactory.instance.numberNode(0.5));

        assertTrue(Files.exists(file));
        assertFalse(Files.exists(file.resolveSibling("db.json.tmp")));

        JsonFileKeyValueStore reopened = JsonFileKeyValueStore.open(file);
        assertEquals(0.5, reopened.get("reputation", "123").asDouble());
    }

    @Test
    @DisplayName("Delete removes the key")
    void testDelete() throws IOException {
        JsonFileKeyValueStore store = JsonFileKeyValueStore.open(tempDir.resolve("db.json"));
        store.set("geo", "1.2.3.4", JsonNodeFactory.instance.objectNode().put("lat", 1.0));
        store.delete("geo", "1.2.3.4");
        store.delete("geo", "absent");

        assertNull(store.get("geo", "1.2.3.4"));
        assertNull(JsonFileKeyValueStore.open(tempDir.resolve("db.json")).get("geo", "1.2.3.4"));
    }

    @Test
    @DisplayName("Failed write leaves memory and file unchanged")
    void testFailedWrite() throws IOException {
        Path file = tempDir.resolve("db.json");
        JsonFileKeyValueStore store = JsonFileKeyValueStore.open(file);
        store.set("reputation", "123", JsonNodeFactory.instance.numberNode(0.5));
        Files.createDirectories(tempDir.resolve("db.json.tmp").resolve("occupied"));

        assertThrows(IOException.class,
                () -> store.set("reputation", "123", JsonNodeFactory.instance.numberNode(0.9)));
        assertThrows(IOException.class,
                () -> store.set("reputation", "456", JsonNodeFactory.instance.numberNode(0.1)));
        assertThrows(IOException.class, () -> store.delete("reputation", "123"));

        assertEquals(0.5, store.get("reputation", "123").asDouble());
        assertNull(store.get("reputation", "456"));
        assertEquals(0.5, JsonFileKeyValueStore.open(file).get("reputation", "123").asDouble());
    }

    @Test
    @DisplayName("Returned values are copies")
    void testCopies() throws IOException {
        JsonFileKeyValueStore store = JsonFileKeyValueStore.open(tempDir.resolve("db.json"));
        store.set("geo", "h", JsonNodeFactory.instance.objectNode().put("lat", 1.0));

        JsonNode value = store.get("geo", "h");
        ((ObjectNode) value).put("lat", 9.0);

        assertEquals(1.0, store.get("geo", "h").get("lat").asDouble());
    }

    @Test
    @DisplayName("Hand written file is read")
    void testExistingFile() throws IOException {
        Path file = tempDir.resolve("db.json");
        Files.writeString(file, "{\"bans\": {\"ids\": [\"1\", \"2\"]}}", StandardCharsets.UTF_8);

        JsonFileKeyValueStore store = JsonFileKeyValueStore.open(file);
        assertEquals(2, store.get("bans", "ids").size());
    }

    @Test
    @DisplayName("File that is not a JSON object is rejected")
    void testInvalidFile() throws IOException {
        Path file = tempDir.resolve("db.json");
        Files.writeString(file, "[1, 2, 3]", StandardCharsets.UTF_8);

        assertThrows(IOException.class, () -> JsonFileKeyValueStore.open(file));
    }
}
