package me.internalizable.quickplay.publish;

import me.internalizable.quickplay.api.capability.PublishException;
import me.internalizable.quickplay.api.capability.SnapshotConsumer;
import me.internalizable.quickplay.api.snapshot.PublishedSchema;
import me.internalizable.quickplay.api.snapshot.PublishedServer;
import me.internalizable.quickplay.api.snapshot.PublishedSnapshot;
import me.internalizable.quickplay.candidate.ScoredServer;
import me.internalizable.quickplay.classify.ClassificationResult;
import me.internalizable.quickplay.stats.PopulationStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Sorts scored servers, writes the artifacts and notifies the consumer.
 *
 * <p>The sort is stable: servers with equal scores keep the order in which the
 * directory listed them. Failures are logged and left for the next tick to
 * supersede; nothing is retried.</p>
 */
public final class RankPublisher {

    private static final Logger LOGGER = LoggerFactory.getLogger(RankPublisher.class);

    private static final Comparator<ScoredServer> BY_SCORE_DESCENDING =
            Comparator.comparingDouble(ScoredServer::score).reversed();

    private final SnapshotFileWriter fileWriter;
    private final SnapshotConsumer consumer;
    private final Duration expiryMargin;
    private final Clock clock;

    /**
     * @param fileWriter artifact writer
     * @param consumer downstream consumer, or null to only write artifacts
     * @param expiryMargin added to the next interval to compute the expiry
     * @param clock clock used for the expiry
     */
    public RankPublisher(
            @Nonnull SnapshotFileWriter fileWriter,
            @Nullable SnapshotConsumer consumer,
            @Nonnull Duration expiryMargin,
            @Nonnull Clock clock) {
        this.fileWriter = Objects.requireNonNull(fileWriter, "fileWriter");
        this.consumer = consumer;
        this.expiryMargin = Objects.requireNonNull(expiryMargin, "expiryMargin");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Sort a copy of the servers, highest score first.
     *
     * @param servers scored servers in directory order
     * @return a new, sorted list
     */
    @Nonnull
    public static List<ScoredServer> rank(@Nonnull List<ScoredServer> servers) {
        List<ScoredServer> sorted = new ArrayList<>(servers);
        sorted.sort(BY_SCORE_DESCENDING);
        return sorted;
    }

    /**
     * Publish one tick's result.
     *
     * @param scored scored servers in directory order
     * @param rejections retained rejections, written only in diagnostics mode
     * @param nextInterval delay until the next tick
     * @param diagnostics write rejections and skip the downstream notification
     * @param notify whether to notify the consumer at all
     * @return the snapshot
     */
    @Nonnull
    public PublishedSnapshot publish(
            @Nonnull List<ScoredServer> scored,
            @Nonnull List<ClassificationResult.Rejected> rejections,
            @Nonnull Duration nextInterval,
            boolean diagnostics,
            boolean notify) {
        List<PublishedServer> servers = new ArrayList<>(scored.size());
        for (ScoredServer server : rank(scored)) {
            servers.add(server.toPublished());
        }

        Instant until = clock.instant().plus(nextInterval).plus(expiryMargin);
        PublishedSnapshot snapshot = new PublishedSnapshot(servers, until);

        try {
            fileWriter.writeServers(servers);
        } catch (IOException e) {
            LOGGER.warn("Failed to write snapshot to {}", fileWriter.getSnapshotFile(), e);
        }

        if (diagnostics) {
            try {
                fileWriter.writeRejections(rejections);
            } catch (IOException e) {
                LOGGER.warn("Failed to write rejections to {}", fileWriter.getRejectionsFile(), e);
            }
            LOGGER.info("Diagnostics: {} ranked, {} rejected, downstream publish skipped", servers.size(), rejections.size());
            return snapshot;
        }

        if (notify && consumer != null) {
            try {
                consumer.publishSnapshot(snapshot);
                LOGGER.info("Published {} servers, fresh until {}", servers.size(), until);
            } catch (PublishException e) {
                LOGGER.warn("Failed to publish snapshot: {}", e.getMessage());
            }
        }
        return snapshot;
    }

    /**
     * Publish a changed taxonomy.
     *
     * @param schema the taxonomy
     * @return true if the consumer accepted it
     */
    public boolean publishSchema(@Nonnull PublishedSchema schema) {
        if (consumer == null) {
            return false;
        }
        try {
            consumer.publishSchema(schema);
            LOGGER.info("Published schema with {} maps", schema.mapGamemodes().size());
            return true;
        } catch (PublishException e) {
            LOGGER.warn("Failed to publish schema: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Write the population statistics of a tick. Never sent downstream.
     *
     * @param stats the statistics
     * @return true if the artifact was written
     */
    public boolean publishStats(@Nonnull PopulationStats stats) {
        try {
            fileWriter.writeStats(stats);
            LOGGER.debug("Wrote stats for {} servers, {} players", stats.listedServers(), stats.concurrentPlayers());
            return true;
        } catch (IOException e) {
            LOGGER.warn("Failed to write stats to {}", fileWriter.getStatsFile(), e);
            return false;
        }
    }
}
