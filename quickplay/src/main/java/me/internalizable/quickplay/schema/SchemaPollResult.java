package me.internalizable.quickplay.schema;

import javax.annotation.Nullable;

/**
 * Outcome of one {@link SchemaSync#poll()}.
 *
 * @param snapshot current snapshot, or null if no document was ever loaded
 * @param changed whether the snapshot was rebuilt by this poll
 * @param minimumVersion minimum allowed server build version, 0 if unknown
 */
public record SchemaPollResult(
        @Nullable SchemaSnapshot snapshot,
        boolean changed,
        long minimumVersion
) {
}
