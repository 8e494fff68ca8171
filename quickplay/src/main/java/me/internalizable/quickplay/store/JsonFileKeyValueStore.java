package me.internalizable.quickplay.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;

/**
 * {@link KeyValueStore} backed by a single JSON file.
 *
 * <p>The file holds one object per table. It is read once when opened and
 * rewritten through a temporary file on every mutation. A mutation is applied
 * to a copy of the tree, which replaces the in-memory tree only once the file
 * has been moved into place.</p>
 */
public final class JsonFileKeyValueStore implements KeyValueStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(JsonFileKeyValueStore.class);

    private final Path file;
    private final ObjectMapper mapper;
    private ObjectNode root;

    private JsonFileKeyValueStore(Path file, ObjectMapper mapper, ObjectNode root) {
        this.file = file;
        this.mapper = mapper;
        this.root = root;
    }

    /**
     * Open a store file, starting empty if it does not exist yet.
     *
     * @param file the store file
     * @return the store
     * @throws IOException if the file exists but cannot be read as a JSON object
     */
    @Nonnull
    public static JsonFileKeyValueStore open(@Nonnull Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

        if (!Files.exists(file)) {
            LOGGER.info("Store file {} not found, starting empty", file);
            return new JsonFileKeyValueStore(file, mapper, mapper.createObjectNode());
        }

        JsonNode tree = mapper.readTree(file.toFile());
        if (tree == null || tree.isMissingNode()) {
            return new JsonFileKeyValueStore(file, mapper, mapper.createObjectNode());
        }
        if (!tree.isObject()) {
            throw new IOException("Store file " + file + " does not contain a JSON object");
        }
        return new JsonFileKeyValueStore(file, mapper, (ObjectNode) tree);
    }

    @Override
    @Nullable
    public synchronized JsonNode get(@Nonnull String table, @Nonnull String key) {
        JsonNode values = root.get(table);
        if (values == null || !values.isObject()) {
            return null;
        }
        JsonNode value = values.get(key);
        return value != null ? value.deepCopy() : null;
    }

    @Override
    public synchronized void set(@Nonnull String table, @Nonnull String key, @Nonnull JsonNode value) throws IOException {
        Objects.requireNonNull(value, "value");
        ObjectNode next = root.deepCopy();
        JsonNode values = next.get(table);
        ObjectNode tableNode = values instanceof ObjectNode ? (ObjectNode) values : next.putObject(table);
        tableNode.set(key, value.deepCopy());
        persist(next);
        root = next;
    }

    @Override
    public synchronized void delete(@Nonnull String table, @Nonnull String key) throws IOException {
        JsonNode values = root.get(table);
        if (values == null || !values.has(key)) {
            return;
        }
        ObjectNode next = root.deepCopy();
        ((ObjectNode) next.get(table)).remove(key);
        persist(next);
        root = next;
    }

    @Nonnull
    public Path getFile() {
        return file;
    }

    private void persist(ObjectNode tree) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        mapper.writeValue(temp.toFile(), tree);
        Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
}
