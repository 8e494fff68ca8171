package me.internalizable.quickplay;

import me.internalizable.quickplay.api.snapshot.PublishedSnapshot;
import me.internalizable.quickplay.classify.ClassificationResult;
import me.internalizable.quickplay.classify.RejectionReason;
import me.internalizable.quickplay.stats.PopulationStats;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one poll tick.
 *
 * @param snapshot published snapshot, null if the tick was skipped
 * @param rejections retained rejections (diagnostics mode only)
 * @param rejectionCounts rejections per reason
 * @param candidates number of candidates evaluated
 * @param schemaChanged whether the taxonomy changed this tick
 * @param directoryFresh false if the previous candidate list was reused
 * @param nextInterval delay until the next tick
 * @param stats population of the listing, null if the tick was skipped
 */
public record TickReport(
        @Nullable PublishedSnapshot snapshot,
        @Nonnull List<ClassificationResult.Rejected> rejections,
        @Nonnull Map<RejectionReason, Integer> rejectionCounts,
        int candidates,
        boolean schemaChanged,
        boolean directoryFresh,
        @Nonnull Duration nextInterval,
        @Nullable PopulationStats stats
) {

    public TickReport {
        rejections = List.copyOf(rejections);
        Map<RejectionReason, Integer> counts = new EnumMap<>(RejectionReason.class);
        counts.putAll(rejectionCounts);
        rejectionCounts = Collections.unmodifiableMap(counts);
    }

    /**
     * Report for a tick that could not run, e.g. before any taxonomy was loaded.
     *
     * @param nextInterval delay until the next tick
     * @return the report
     */
    @Nonnull
    public static TickReport skipped(@Nonnull Duration nextInterval) {
        return new TickReport(null, List.of(), Map.of(), 0, false, false, nextInterval, null);
    }

    public boolean isSkipped() {
        return snapshot == null;
    }

    public int getRejectedCount() {
        int total = 0;
        for (int count : rejectionCounts.values()) {
            total += count;
        }
        return total;
    }
}
