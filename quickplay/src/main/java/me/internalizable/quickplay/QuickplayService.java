package me.internalizable.quickplay;

import me.internalizable.quickplay.api.QuickplayAPI;
import me.internalizable.quickplay.api.capability.DirectoryException;
import me.internalizable.quickplay.api.capability.DirectoryServer;
import me.internalizable.quickplay.api.capability.GeoLookupException;
import me.internalizable.quickplay.api.capability.ServerProbe;
import me.internalizable.quickplay.api.snapshot.PublishedSchema;
import me.internalizable.quickplay.api.snapshot.PublishedSnapshot;
import me.internalizable.quickplay.candidate.RawCandidate;
import me.internalizable.quickplay.candidate.ScoredServer;
import me.internalizable.quickplay.classify.ClassificationResult;
import me.internalizable.quickplay.classify.Classifier;
import me.internalizable.quickplay.classify.RejectionReason;
import me.internalizable.quickplay.classify.TickContext;
import me.internalizable.quickplay.config.QuickplayConfig;
import me.internalizable.quickplay.geo.GeoEstimator;
import me.internalizable.quickplay.geo.MaxMindGeoLocator;
import me.internalizable.quickplay.impl.QuickplayAPIImpl;
import me.internalizable.quickplay.publish.HttpSnapshotConsumer;
import me.internalizable.quickplay.publish.RankPublisher;
import me.internalizable.quickplay.publish.SnapshotFileWriter;
import me.internalizable.quickplay.schema.MatchmakingTables;
import me.internalizable.quickplay.schema.SchemaPollResult;
import me.internalizable.quickplay.schema.SchemaSync;
import me.internalizable.quickplay.score.JitterCache;
import me.internalizable.quickplay.score.NameSanitizer;
import me.internalizable.quickplay.score.Scorer;
import me.internalizable.quickplay.score.TrendCache;
import me.internalizable.quickplay.stats.PopulationStats;
import me.internalizable.quickplay.stats.PopulationStatsCollector;
import me.internalizable.quickplay.steam.SteamWebApiClient;
import me.internalizable.quickplay.store.AnycastRegistry;
import me.internalizable.quickplay.store.BanRegistry;
import me.internalizable.quickplay.store.GeoOverrideTable;
import me.internalizable.quickplay.store.JsonFileKeyValueStore;
import me.internalizable.quickplay.store.ReputationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Main orchestrator of the quickplay pipeline.
 *
 * <p>Each tick refreshes the taxonomy if due, lists candidates, records their
 * population statistics, classifies them concurrently, scores the accepted
 * ones and publishes the ranked snapshot.
 * Ticks run on a single scheduling thread; only classification (including its
 * probes) runs on the worker pool.</p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * QuickplayService service = QuickplayService.create(Paths.get("quickplay/config.yml"), probe);
 * service.initialize();
 * service.start();
 *
 * PublishedServer best = service.getApi().findBestServer();
 *
 * service.shutdown();
 * }</pre>
 */
public class QuickplayService {

    private static final Logger LOGGER = LoggerFactory.getLogger(QuickplayService.class);

    private static final Path DEFAULT_CONFIG_PATH = Paths.get("quickplay", "config.yml");

    private final QuickplayConfig config;
    private final MatchmakingTables tables;
    private final QuickplayCollaborators collaborators;
    private final Clock clock;
    private final Random random;

    private SchemaSync schemaSync;
    private Classifier classifier;
    private Scorer scorer;
    private GeoEstimator geoEstimator;
    private RankPublisher publisher;
    private PopulationStatsCollector statsCollector;
    private BanRegistry banRegistry;
    private AnycastRegistry anycastRegistry;
    private ReputationStore reputationStore;
    private GeoOverrideTable geoOverrides;
    private ExecutorService workers;
    private ScheduledExecutorService scheduler;
    private QuickplayAPIImpl api;

    private volatile List<RawCandidate> lastCandidates = List.of();
    private volatile PublishedSnapshot latestSnapshot;
    private volatile PublishedSchema latestSchema;
    private volatile TickReport lastReport;
    private volatile PopulationStats latestStats;
    private final AtomicLong ticks = new AtomicLong();
    private volatile long lastTickMillis;

    private volatile boolean initialized = false;
    private volatile boolean started = false;
    private volatile boolean shutdown = false;

    /**
     * Create a service.
     *
     * @param config configuration
     * @param tables taxonomy tables
     * @param collaborators external capabilities
     * @param clock clock for expiry, caches and the schema cadence
     * @param random randomness for intervals and jitter
     */
    public QuickplayService(
            @Nonnull QuickplayConfig config,
            @Nonnull MatchmakingTables tables,
            @Nonnull QuickplayCollaborators collaborators,
            @Nonnull Clock clock,
            @Nonnull Random random) {
        this.config = Objects.requireNonNull(config, "config");
        this.tables = Objects.requireNonNull(tables, "tables");
        this.collaborators = Objects.requireNonNull(collaborators, "collaborators");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * Create a service wired to the Steam Web API, the configured consumer,
     * the JSON store file and the MaxMind databases.
     *
     * <p>The configuration file is created with defaults if it does not exist.</p>
     *
     * @param configPath configuration file
     * @param probe direct server probe
     * @return the service, not yet initialized
     * @throws IOException if the configuration, tables, store or databases cannot be read
     */
    @Nonnull
    public static QuickplayService create(@Nonnull Path configPath, @Nonnull ServerProbe probe) throws IOException {
        QuickplayConfig config = QuickplayConfig.load(configPath);
        MatchmakingTables tables = config.getTablesFile() != null && !config.getTablesFile().isEmpty()
                ? MatchmakingTables.load(Paths.get(config.getTablesFile()))
                : MatchmakingTables.loadDefaults();

        QuickplayConfig.EndpointConfig endpoints = config.getEndpoints();
        Duration timeout = Duration.ofSeconds(endpoints.getRequestTimeoutSeconds());
        SteamWebApiClient steam = new SteamWebApiClient(endpoints.getSteamApiUrl(), endpoints.getSteamApiKey(), timeout);

        HttpSnapshotConsumer consumer = null;
        if (endpoints.getConsumerUrl() != null && !endpoints.getConsumerUrl().isEmpty()) {
            consumer = new HttpSnapshotConsumer(endpoints.getConsumerUrl(), endpoints.getConsumerApiKey(), timeout);
        } else {
            LOGGER.warn("No consumer URL configured, snapshots will only be written locally");
        }

        QuickplayConfig.GeoConfig geo = config.getGeo();
        MaxMindGeoLocator locator = MaxMindGeoLocator.open(
                Paths.get(geo.getCityDatabase()),
                geo.getAsnDatabase() != null ? Paths.get(geo.getAsnDatabase()) : null);

        QuickplayCollaborators collaborators = new QuickplayCollaborators(
                steam,
                steam,
                probe,
                locator,
                consumer,
                JsonFileKeyValueStore.open(Paths.get(endpoints.getStoreFile()))
        );
        return new QuickplayService(config, tables, collaborators, Clock.systemUTC(), new Random());
    }

    /**
     * Create a service from the default configuration path.
     *
     * @param probe direct server probe
     * @return the service, not yet initialized
     * @throws IOException if loading fails
     */
    @Nonnull
    public static QuickplayService create(@Nonnull ServerProbe probe) throws IOException {
        return create(DEFAULT_CONFIG_PATH, probe);
    }

    // ==================== Initialization ====================

    /**
     * Build the pipeline and resolve the origin location.
     *
     * @throws GeoLookupException if the configured origin address cannot be located
     */
    public void initialize() throws GeoLookupException {
        if (initialized) {
            throw new IllegalStateException("Quickplay service already initialized");
        }

        LOGGER.info("Initializing quickplay service...");

        banRegistry = new BanRegistry(collaborators.store());
        anycastRegistry = new AnycastRegistry(collaborators.store());
        reputationStore = new ReputationStore(collaborators.store());
        geoOverrides = new GeoOverrideTable(collaborators.store());

        geoEstimator = new GeoEstimator(collaborators.geoLocator(), geoOverrides, config.getGeo());
        geoEstimator.resolveOrigin();

        schemaSync = new SchemaSync(collaborators.schemaSource(), tables, config, clock, random);
        classifier = new Classifier(tables, config, collaborators.probe());
        NameSanitizer sanitizer = new NameSanitizer(tables.getMarkerCharacters());
        scorer = new Scorer(
                config,
                reputationStore,
                geoEstimator,
                new TrendCache(config.getScoring(), clock),
                new JitterCache(config.getScoring(), clock, random),
                sanitizer
        );
        statsCollector = new PopulationStatsCollector(config, sanitizer);

        QuickplayConfig.EndpointConfig endpoints = config.getEndpoints();
        publisher = new RankPublisher(
                new SnapshotFileWriter(
                        Paths.get(endpoints.getSnapshotFile()),
                        Paths.get(endpoints.getRejectionsFile()),
                        Paths.get(endpoints.getStatsFile())),
                collaborators.consumer(),
                Duration.ofSeconds(config.getPoll().getExpiryMarginSeconds()),
                clock
        );

        AtomicInteger workerIds = new AtomicInteger();
        workers = Executors.newFixedThreadPool(config.getPoll().getWorkerThreads(), r -> {
            Thread t = new Thread(r, "Quickplay-Worker-" + workerIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "Quickplay-Scheduler");
            t.setDaemon(true);
            return t;
        });

        api = new QuickplayAPIImpl(this);

        initialized = true;
        LOGGER.info("Quickplay service initialized");
        LOGGER.info("  Seeded maps: {}", tables.getBaseGameMaps().size());
        LOGGER.info("  Worker threads: {}", config.getPoll().getWorkerThreads());
    }

    /**
     * Start the poll loop. The first tick runs immediately.
     */
    public void start() {
        checkInitialized();
        if (started) {
            throw new IllegalStateException("Quickplay service already started");
        }
        started = true;
        scheduleTick(Duration.ZERO);
        LOGGER.info("Quickplay poll loop started");
    }

    private void scheduleTick(Duration delay) {
        if (shutdown) {
            return;
        }
        scheduler.schedule(this::runScheduledTick, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void runScheduledTick() {
        Duration next;
        try {
            next = tick(QuickplayAPI.RefreshOptions.defaults()).nextInterval();
        } catch (RuntimeException e) {
            LOGGER.error("Unhandled exception in poll tick", e);
            next = nextInterval();
        }
        LOGGER.debug("Next tick in {} ms", next.toMillis());
        scheduleTick(next);
    }

    // ==================== Tick ====================

    /**
     * Run one tick on the scheduling thread.
     *
     * @param options refresh options
     * @return future completing with the report
     */
    @Nonnull
    public CompletableFuture<TickReport> submitTick(@Nonnull QuickplayAPI.RefreshOptions options) {
        checkInitialized();
        Objects.requireNonNull(options, "options");
        return CompletableFuture.supplyAsync(() -> tick(options), scheduler);
    }

    /**
     * Run one full tick on the calling thread.
     *
     * <p>Trend and jitter caches are not synchronized: while the poll loop is
     * running, use {@link #submitTick} instead.</p>
     *
     * @param options refresh options
     * @return the report
     */
    @Nonnull
    public TickReport tick(@Nonnull QuickplayAPI.RefreshOptions options) {
        checkInitialized();
        long startNanos = System.nanoTime();
        boolean diagnostics = options.isDiagnostics() || config.getFilter().isDiagnostics();

        scorer.sweepCaches();

        SchemaPollResult poll = schemaSync.poll();
        if (poll.snapshot() == null) {
            LOGGER.warn("No schema available yet, skipping tick");
            TickReport report = TickReport.skipped(nextInterval());
            lastReport = report;
            return report;
        }
        if (poll.changed()) {
            PublishedSchema schema = poll.snapshot().toPublished(tables.getDefaultGamemodes());
            latestSchema = schema;
            if (options.isPublish() && !diagnostics) {
                publisher.publishSchema(schema);
            }
        }

        boolean directoryFresh = true;
        List<RawCandidate> candidates;
        try {
            List<DirectoryServer> servers = collaborators.directory().listServers(
                    config.getPoll().getDirectoryFilter(), config.getPoll().getDirectoryLimit());
            candidates = new ArrayList<>(servers.size());
            for (DirectoryServer server : servers) {
                candidates.add(RawCandidate.fromDirectory(server));
            }
            lastCandidates = List.copyOf(candidates);
        } catch (DirectoryException e) {
            LOGGER.warn("Directory listing failed, probing {} previous candidates: {}", lastCandidates.size(), e.getMessage());
            candidates = lastCandidates;
            directoryFresh = false;
        }

        TickContext context = new TickContext(
                poll.snapshot(),
                poll.minimumVersion(),
                banRegistry.snapshot(),
                anycastRegistry.snapshot(),
                directoryFresh
        );

        PopulationStats stats = statsCollector.collect(candidates, context);
        latestStats = stats;
        if (config.getStats().isEnabled()) {
            publisher.publishStats(stats);
        }

        List<ClassificationResult> results = classifyAll(candidates, context);

        List<ScoredServer> scored = new ArrayList<>();
        List<ClassificationResult.Rejected> rejections = new ArrayList<>();
        Map<RejectionReason, Integer> counts = new EnumMap<>(RejectionReason.class);
        for (ClassificationResult result : results) {
            if (result.isAccepted()) {
                Optional<ScoredServer> server = scorer.score(((ClassificationResult.Accepted) result).server(), context);
                server.ifPresent(scored::add);
            } else {
                ClassificationResult.Rejected rejected = (ClassificationResult.Rejected) result;
                counts.merge(rejected.reason(), 1, Integer::sum);
                if (diagnostics) {
                    rejections.add(rejected);
                }
            }
        }

        Duration next = nextInterval();
        PublishedSnapshot snapshot = publisher.publish(scored, rejections, next, diagnostics, options.isPublish());
        latestSnapshot = snapshot;

        TickReport report = new TickReport(
                snapshot,
                rejections,
                counts,
                candidates.size(),
                poll.changed(),
                directoryFresh,
                next,
                stats
        );
        lastReport = report;
        ticks.incrementAndGet();
        lastTickMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);

        LOGGER.info("Tick {}: {} candidates, {} ranked, {} rejected in {} ms",
                ticks.get(), candidates.size(), snapshot.servers().size(), report.getRejectedCount(), lastTickMillis);
        return report;
    }

    private List<ClassificationResult> classifyAll(List<RawCandidate> candidates, TickContext context) {
        List<CompletableFuture<ClassificationResult>> futures = new ArrayList<>(candidates.size());
        for (RawCandidate candidate : candidates) {
            futures.add(CompletableFuture
                    .supplyAsync(() -> classifier.classify(candidate, context), workers)
                    .thenCompose(future -> future)
                    .exceptionally(e -> {
                        Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
                        LOGGER.warn("Failed to classify {}", candidate.address(), cause);
                        return new ClassificationResult.Rejected(
                                RejectionReason.CLASSIFICATION_FAILED, candidate, String.valueOf(cause));
                    }));
        }

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<ClassificationResult> results = new ArrayList<>(futures.size());
        for (CompletableFuture<ClassificationResult> future : futures) {
            results.add(future.join());
        }
        return results;
    }

    /**
     * Draw the delay until the next tick: the interval plus a uniform share of
     * the variance.
     *
     * @return the delay
     */
    @Nonnull
    Duration nextInterval() {
        QuickplayConfig.PollConfig poll = config.getPoll();
        long millis = poll.getIntervalSeconds() * 1000L
                + (long) (random.nextDouble() * poll.getIntervalVarianceSeconds() * 1000L);
        return Duration.ofMillis(millis);
    }

    // ==================== Queries ====================

    @Nullable
    public PublishedSnapshot getLatestSnapshot() {
        return latestSnapshot;
    }

    @Nullable
    public PublishedSchema getLatestSchema() {
        return latestSchema;
    }

    @Nullable
    public PopulationStats getLatestStats() {
        return latestStats;
    }

    @Nullable
    public TickReport getLastReport() {
        return lastReport;
    }

    public long getTicks() {
        return ticks.get();
    }

    public long getLastTickMillis() {
        return lastTickMillis;
    }

    @Nonnull
    public QuickplayAPI getApi() {
        checkInitialized();
        return api;
    }

    @Nonnull
    public QuickplayConfig getConfig() {
        return config;
    }

    @Nonnull
    public BanRegistry getBanRegistry() {
        checkInitialized();
        return banRegistry;
    }

    @Nonnull
    public AnycastRegistry getAnycastRegistry() {
        checkInitialized();
        return anycastRegistry;
    }

    @Nonnull
    public ReputationStore getReputationStore() {
        checkInitialized();
        return reputationStore;
    }

    @Nonnull
    public GeoOverrideTable getGeoOverrides() {
        checkInitialized();
        return geoOverrides;
    }

    @Nonnull
    public Scorer getScorer() {
        checkInitialized();
        return scorer;
    }

    // ==================== Lifecycle ====================

    public boolean isInitialized() {
        return initialized;
    }

    private void checkInitialized() {
        if (!initialized) {
            throw new IllegalStateException("Quickplay service not initialized");
        }
    }

    /**
     * Stop the poll loop and the worker pool.
     */
    public void shutdown() {
        if (!initialized || shutdown) {
            return;
        }

        shutdown = true;
        LOGGER.info("Shutting down quickplay service...");

        shutdownExecutor(scheduler);
        shutdownExecutor(workers);

        LOGGER.info("Quickplay service shut down");
    }

    private static void shutdownExecutor(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
