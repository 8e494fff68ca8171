package me.internalizable.quickplay.store;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.util.Objects;
import java.util.Set;

/**
 * Network blocks of shared or anycast hosting, kept in the {@code anycast}
 * table under {@code ips}.
 */
public final class AnycastRegistry extends StringListTable {

    public static final String TABLE = "anycast";
    private static final String KEY = "ips";

    public AnycastRegistry(@Nonnull KeyValueStore store) {
        super(Objects.requireNonNull(store, "store"), TABLE);
    }

    @Nonnull
    public Set<String> snapshot() {
        return Set.copyOf(read(KEY));
    }

    public boolean addNetwork(@Nonnull String network) throws IOException {
        return add(KEY, Objects.requireNonNull(network, "network"));
    }

    public boolean removeNetwork(@Nonnull String network) throws IOException {
        return remove(KEY, Objects.requireNonNull(network, "network"));
    }
}
