package me.internalizable.quickplay.score;

import me.internalizable.quickplay.cache.ExpiringMap;
import me.internalizable.quickplay.config.QuickplayConfig;

import javax.annotation.Nonnull;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Per-server lowest human count over a trailing window.
 *
 * <p>A server climbing back from its trough towards the crowded threshold
 * earns a bonus growing linearly from the minimum to the maximum value.</p>
 */
public final class TrendCache {

    private final ExpiringMap<String, Integer> troughs;
    private final QuickplayConfig.ScoringConfig scoring;

    public TrendCache(@Nonnull QuickplayConfig.ScoringConfig scoring, @Nonnull Clock clock) {
        this.scoring = Objects.requireNonNull(scoring, "scoring");
        this.troughs = new ExpiringMap<>(Duration.ofSeconds(scoring.getTrendWindowSeconds()), clock);
    }

    /**
     * Record an observation and compute the bonus it earns.
     *
     * @param identity server identity
     * @param humans current human count
     * @return the bonus, 0 when the server is at or below its trough or crowded
     */
    public double observe(@Nonnull String identity, int humans) {
        Integer trough = troughs.get(identity);
        if (trough == null || humans <= trough) {
            troughs.put(identity, humans);
            return 0.0;
        }

        int threshold = scoring.getTrendCrowdedThreshold();
        if (humans >= threshold) {
            return 0.0;
        }
        return PopulationCurve.lerp(trough, threshold, scoring.getTrendBonusMin(), scoring.getTrendBonusMax(), humans);
    }

    /**
     * Get the live trough of a server.
     *
     * @param identity server identity
     * @return the trough, or null if none is held
     */
    public Integer trough(@Nonnull String identity) {
        return troughs.get(identity);
    }

    public int sweep() {
        return troughs.sweep();
    }

    public int size() {
        return troughs.size();
    }
}
