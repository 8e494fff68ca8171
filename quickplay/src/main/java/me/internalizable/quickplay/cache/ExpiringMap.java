package me.internalizable.quickplay.cache;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;

/**
 * A map whose entries expire a fixed time after they were last written.
 *
 * <p>Expired entries are swept lazily: a read of an expired key removes it,
 * and {@link #sweep()} removes every expired entry. Not thread-safe; the
 * pipeline only touches it from the scheduling thread.</p>
 *
 * @param <K> key type
 * @param <V> value type
 */
public final class ExpiringMap<K, V> {

    private final Map<K, Entry<V>> entries = new HashMap<>();
    private final Duration ttl;
    private final Clock clock;

    public ExpiringMap(@Nonnull Duration ttl, @Nonnull Clock clock) {
        this.ttl = Objects.requireNonNull(ttl, "ttl");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
    }

    /**
     * Get a live value.
     *
     * @param key the key
     * @return the value, or null if absent or expired
     */
    @Nullable
    public V get(@Nonnull K key) {
        Entry<V> entry = entries.get(key);
        if (entry == null) {
            return null;
        }
        if (entry.isExpired(clock.instant())) {
            entries.remove(key);
            return null;
        }
        return entry.value();
    }

    /**
     * Store a value, restarting its lifetime.
     *
     * @param key the key
     * @param value the value
     */
    public void put(@Nonnull K key, @Nonnull V value) {
        entries.put(Objects.requireNonNull(key, "key"),
                new Entry<>(Objects.requireNonNull(value, "value"), clock.instant().plus(ttl)));
    }

    /**
     * Remove a key.
     *
     * @param key the key
     * @return the removed value if it was still live
     */
    @Nullable
    public V remove(@Nonnull K key) {
        Entry<V> entry = entries.remove(key);
        if (entry == null || entry.isExpired(clock.instant())) {
            return null;
        }
        return entry.value();
    }

    /**
     * Remove every expired entry.
     *
     * @return number of entries removed
     */
    public int sweep() {
        Instant now = clock.instant();
        int removed = 0;
        Iterator<Entry<V>> it = entries.values().iterator();
        while (it.hasNext()) {
            if (it.next().isExpired(now)) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    /**
     * Number of stored entries, including expired ones not yet swept.
     *
     * @return entry count
     */
    public int size() {
        return entries.size();
    }

    @Nonnull
    public Duration getTtl() {
        return ttl;
    }

    private record Entry<V>(V value, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
