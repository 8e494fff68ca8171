package me.internalizable.quickplay.score;

import me.internalizable.quickplay.cache.ExpiringMap;
import me.internalizable.quickplay.config.QuickplayConfig;

import javax.annotation.Nonnull;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Random;

/**
 * Per-server random offsets for empty servers.
 *
 * <p>An offset is drawn once from {@code N(0, factor * |score|)} and held for
 * the configured time while the server stays empty; it is dropped as soon as
 * the server has players.</p>
 */
public final class JitterCache {

    private final ExpiringMap<String, Double> offsets;
    private final double varianceFactor;
    private final Random random;

    public JitterCache(@Nonnull QuickplayConfig.ScoringConfig scoring, @Nonnull Clock clock, @Nonnull Random random) {
        Objects.requireNonNull(scoring, "scoring");
        this.offsets = new ExpiringMap<>(Duration.ofSeconds(scoring.getJitterHoldSeconds()), clock);
        this.varianceFactor = scoring.getJitterVarianceFactor();
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * Get the offset for a server.
     *
     * @param identity server identity
     * @param humans current human count
     * @param score score before jitter, sets the variance of a new offset
     * @return the offset, 0 for a non-empty server
     */
    public double offset(@Nonnull String identity, int humans, double score) {
        if (humans > 0) {
            offsets.remove(identity);
            return 0.0;
        }
        Double offset = offsets.get(identity);
        if (offset == null) {
            offset = random.nextGaussian() * Math.sqrt(varianceFactor * Math.abs(score));
            offsets.put(identity, offset);
        }
        return offset;
    }

    public boolean contains(@Nonnull String identity) {
        return offsets.get(identity) != null;
    }

    public int sweep() {
        return offsets.sweep();
    }

    public int size() {
        return offsets.size();
    }
}
