package me.internalizable.quickplay.store;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.util.HashSet;
import java.util.Objects;

/**
 * Operator-maintained ban lists.
 *
 * <p>Stored in the {@code bans} table under the keys of {@link Kind}; an
 * absent key is an empty list.</p>
 */
public final class BanRegistry extends StringListTable {

    public static final String TABLE = "bans";

    public enum Kind {
        IDENTITY("ids"),
        ADDRESS("ips"),
        NAME("names"),
        TAG("tags");

        private final String key;

        Kind(String key) {
            this.key = key;
        }

        @Nonnull
        public String getKey() {
            return key;
        }
    }

    public BanRegistry(@Nonnull KeyValueStore store) {
        super(Objects.requireNonNull(store, "store"), TABLE);
    }

    /**
     * Read every list into an immutable snapshot.
     *
     * @return the current bans
     */
    @Nonnull
    public BanList snapshot() {
        return new BanList(
                new HashSet<>(read(Kind.IDENTITY.getKey())),
                new HashSet<>(read(Kind.ADDRESS.getKey())),
                read(Kind.NAME.getKey()),
                new HashSet<>(read(Kind.TAG.getKey()))
        );
    }

    /**
     * Add a ban.
     *
     * @param kind list to add to
     * @param value banned value
     * @return true if it was not already banned
     * @throws IOException if the store could not be persisted
     */
    public boolean ban(@Nonnull Kind kind, @Nonnull String value) throws IOException {
        return add(kind.getKey(), Objects.requireNonNull(value, "value"));
    }

    /**
     * Lift a ban.
     *
     * @param kind list to remove from
     * @param value banned value
     * @return true if it was banned
     * @throws IOException if the store could not be persisted
     */
    public boolean unban(@Nonnull Kind kind, @Nonnull String value) throws IOException {
        return remove(kind.getKey(), Objects.requireNonNull(value, "value"));
    }
}
