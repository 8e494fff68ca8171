package me.internalizable.quickplay.impl;

import me.internalizable.quickplay.QuickplayService;
import me.internalizable.quickplay.TickReport;
import me.internalizable.quickplay.stats.PopulationStats;
import me.internalizable.quickplay.api.QuickplayAPI;
import me.internalizable.quickplay.api.snapshot.PublishedSchema;
import me.internalizable.quickplay.api.snapshot.PublishedServer;
import me.internalizable.quickplay.api.snapshot.PublishedSnapshot;
import me.internalizable.quickplay.classify.RejectionReason;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Implementation of the QuickplayAPI for embedders.
 */
public class QuickplayAPIImpl implements QuickplayAPI {

    private final QuickplayService service;

    public QuickplayAPIImpl(@Nonnull QuickplayService service) {
        this.service = Objects.requireNonNull(service, "service");
    }

    @Override
    @Nullable
    public PublishedSnapshot getLatestSnapshot() {
        return service.getLatestSnapshot();
    }

    @Override
    @Nullable
    public PublishedServer findBestServer() {
        PublishedSnapshot snapshot = service.getLatestSnapshot();
        if (snapshot == null || snapshot.servers().isEmpty()) {
            return null;
        }
        return snapshot.servers().get(0);
    }

    @Override
    @Nonnull
    public List<PublishedServer> getServersOnMap(@Nonnull String map) {
        Objects.requireNonNull(map, "map");
        PublishedSnapshot snapshot = service.getLatestSnapshot();
        if (snapshot == null) {
            return List.of();
        }
        return snapshot.servers().stream()
                .filter(s -> s.map().equalsIgnoreCase(map))
                .collect(Collectors.toList());
    }

    @Override
    @Nullable
    public PublishedSchema getSchema() {
        return service.getLatestSchema();
    }

    @Override
    @Nonnull
    public CompletableFuture<PublishedSnapshot> refresh(@Nonnull RefreshOptions options) {
        Objects.requireNonNull(options, "options");
        return service.submitTick(options).thenApply(TickReport::snapshot);
    }

    @Override
    @Nonnull
    public Map<String, Integer> getRejectionCounts() {
        TickReport report = service.getLastReport();
        if (report == null) {
            return Collections.emptyMap();
        }
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Map.Entry<RejectionReason, Integer> entry : report.rejectionCounts().entrySet()) {
            counts.put(entry.getKey().name(), entry.getValue());
        }
        return Collections.unmodifiableMap(counts);
    }

    @Override
    @Nonnull
    public QuickplayStats getStats() {
        TickReport report = service.getLastReport();
        PublishedSnapshot snapshot = service.getLatestSnapshot();
        PopulationStats population = service.getLatestStats();

        int ranked = snapshot != null ? snapshot.servers().size() : 0;
        int humans = snapshot != null
                ? snapshot.servers().stream().mapToInt(PublishedServer::humans).sum()
                : 0;

        return new QuickplayStatsImpl(
                report != null ? report.candidates() : 0,
                ranked,
                report != null ? report.getRejectedCount() : 0,
                humans,
                population != null ? population.concurrentPlayers() : 0,
                service.getTicks(),
                service.getLastTickMillis()
        );
    }

    private record QuickplayStatsImpl(
            int candidates,
            int rankedServers,
            int rejectedServers,
            int totalHumans,
            int concurrentPlayers,
            long ticks,
            long lastTickMillis
    ) implements QuickplayStats {

        @Override
        public int getCandidates() {
            return candidates;
        }

        @Override
        public int getRankedServers() {
            return rankedServers;
        }

        @Override
        public int getRejectedServers() {
            return rejectedServers;
        }

        @Override
        public int getTotalHumans() {
            return totalHumans;
        }

        @Override
        public int getConcurrentPlayers() {
            return concurrentPlayers;
        }

        @Override
        public long getTicks() {
            return ticks;
        }

        @Override
        public long getLastTickMillis() {
            return lastTickMillis;
        }
    }
}
