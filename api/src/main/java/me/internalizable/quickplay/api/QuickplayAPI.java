package me.internalizable.quickplay.api;

import me.internalizable.quickplay.api.snapshot.PublishedSchema;
import me.internalizable.quickplay.api.snapshot.PublishedServer;
import me.internalizable.quickplay.api.snapshot.PublishedSnapshot;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * API for quickplay server selection.
 *
 * <p>Provides read access to the most recent ranked snapshot and the
 * map taxonomy it was classified against.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * QuickplayAPI api = service.getApi();
 *
 * // Best server right now
 * PublishedServer best = api.findBestServer();
 *
 * // Force a refresh, keeping rejections for inspection
 * api.refresh(RefreshOptions.builder()
 *     .diagnostics(true)
 *     .build())
 *     .thenAccept(snapshot -> {
 *         System.out.println("Ranked: " + snapshot.servers().size());
 *     });
 * }</pre>
 */
public interface QuickplayAPI {

    /**
     * Get the latest published snapshot.
     *
     * @return the snapshot, or null before the first tick completes
     */
    @Nullable
    PublishedSnapshot getLatestSnapshot();

    /**
     * Get the highest ranked server of the latest snapshot.
     *
     * @return the best server, or null if none is ranked
     */
    @Nullable
    PublishedServer findBestServer();

    /**
     * Get the ranked servers playing a map.
     *
     * @param map map name
     * @return servers in rank order
     */
    @Nonnull
    List<PublishedServer> getServersOnMap(@Nonnull String map);

    /**
     * Get the current map taxonomy.
     *
     * @return the schema, or null before the first schema load
     */
    @Nullable
    PublishedSchema getSchema();

    /**
     * Run one poll tick outside the regular schedule.
     *
     * @param options refresh options
     * @return future completing with the published snapshot
     */
    @Nonnull
    CompletableFuture<PublishedSnapshot> refresh(@Nonnull RefreshOptions options);

    /**
     * Run one poll tick with default options.
     *
     * @return future completing with the published snapshot
     */
    @Nonnull
    default CompletableFuture<PublishedSnapshot> refresh() {
        return refresh(RefreshOptions.defaults());
    }

    /**
     * Get rejection counts of the latest tick, keyed by reason.
     *
     * @return reason name to count
     */
    @Nonnull
    Map<String, Integer> getRejectionCounts();

    /**
     * Get service statistics.
     *
     * @return statistics
     */
    @Nonnull
    QuickplayStats getStats();

    /**
     * Options for a manual refresh.
     */
    interface RefreshOptions {
        /**
         * Whether rejected candidates are kept for inspection.
         */
        boolean isDiagnostics();

        /**
         * Whether the snapshot is announced downstream.
         */
        boolean isPublish();

        /**
         * Create default refresh options.
         */
        @Nonnull
        static RefreshOptions defaults() {
            return builder().build();
        }

        /**
         * Create a builder for refresh options.
         */
        @Nonnull
        static Builder builder() {
            return new RefreshOptionsBuilder();
        }

        /**
         * Builder for refresh options.
         */
        interface Builder {
            Builder diagnostics(boolean diagnostics);
            Builder publish(boolean publish);
            RefreshOptions build();
        }
    }

    /**
     * Quickplay statistics.
     */
    interface QuickplayStats {
        int getCandidates();
        int getRankedServers();
        int getRejectedServers();
        int getTotalHumans();

        /**
         * Players on every listed server of the game, ranked or not.
         */
        int getConcurrentPlayers();
        long getTicks();
        long getLastTickMillis();
    }
}
