package me.internalizable.quickplay.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * String lists stored as JSON arrays under fixed keys of one table.
 */
abstract class StringListTable {

    private final KeyValueStore store;
    private final String table;

    StringListTable(@Nonnull KeyValueStore store, @Nonnull String table) {
        this.store = store;
        this.table = table;
    }

    @Nonnull
    final List<String> read(@Nonnull String key) {
        JsonNode node = store.get(table, key);
        List<String> values = new ArrayList<>();
        if (node == null || !node.isArray()) {
            return values;
        }
        for (JsonNode element : node) {
            if (element.isTextual()) {
                values.add(element.asText());
            }
        }
        return values;
    }

    final boolean add(@Nonnull String key, @Nonnull String value) throws IOException {
        Set<String> values = new LinkedHashSet<>(read(key));
        if (!values.add(value)) {
            return false;
        }
        write(key, values);
        return true;
    }

    final boolean remove(@Nonnull String key, @Nonnull String value) throws IOException {
        Set<String> values = new LinkedHashSet<>(read(key));
        if (!values.remove(value)) {
            return false;
        }
        write(key, values);
        return true;
    }

    private void write(String key, Set<String> values) throws IOException {
        ArrayNode array = JsonNodeFactory.instance.arrayNode();
        values.forEach(array::add);
        store.set(table, key, array);
    }
}
