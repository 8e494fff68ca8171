package me.internalizable.quickplay.config;

import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.nodes.Tag;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.io.InputStream;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration for the quickplay service.
 *
 * <p>Loaded from {@code quickplay/config.yml} and defines poll cadence,
 * the target game, filter bounds, scoring constants, geolocation,
 * endpoint settings and population statistics.</p>
 */
public class QuickplayConfig {

    private PollConfig poll = new PollConfig();
    private GameConfig game = new GameConfig();
    private FilterConfig filter = new FilterConfig();
    private ScoringConfig scoring = new ScoringConfig();
    private GeoConfig geo = new GeoConfig();
    private EndpointConfig endpoints = new EndpointConfig();
    private StatsConfig stats = new StatsConfig();
    private String tablesFile;

    /**
     * Load configuration from file, creating default if not exists.
     *
     * @param path path to config file
     * @return loaded configuration
     * @throws IOException if loading fails
     */
    @Nonnull
    public static QuickplayConfig load(@Nonnull Path path) throws IOException {
        if (!Files.exists(path)) {
            QuickplayConfig config = new QuickplayConfig();
            config.save(path);
            return config;
        }

        LoaderOptions options = new LoaderOptions();
        Yaml yaml = new Yaml(new Constructor(QuickplayConfig.class, options));
        QuickplayConfig config;
        try (InputStream is = Files.newInputStream(path)) {
            config = yaml.load(is);
        }
        if (config == null) {
            config = new QuickplayConfig();
        }
        config.validate();
        return config;
    }

    /**
     * Save configuration to file.
     *
     * @param path path to save to
     * @throws IOException if saving fails
     */
    public void save(@Nonnull Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        DumperOptions dumperOptions = new DumperOptions();
        dumperOptions.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        Yaml yaml = new Yaml(dumperOptions);
        // untagged root: the default tag inspector rejects global tags on load
        try (Writer writer = Files.newBufferedWriter(path)) {
            writer.write(yaml.dumpAs(this, Tag.MAP, DumperOptions.FlowStyle.BLOCK));
        }
    }

    /**
     * Check cross-field constraints.
     *
     * @throws IllegalArgumentException if a value is out of range
     */
    public void validate() {
        if (poll.getIntervalSeconds() <= 0 || poll.getIntervalVarianceSeconds() < 0) {
            throw new IllegalArgumentException("Poll interval must be positive and variance non-negative");
        }
        if (poll.getProbeTimeoutMillis() <= 0) {
            throw new IllegalArgumentException("Probe timeout must be positive");
        }
        if (filter.getMinCapacity() > filter.getMaxCapacity()) {
            throw new IllegalArgumentException("minCapacity " + filter.getMinCapacity()
                    + " exceeds maxCapacity " + filter.getMaxCapacity());
        }
        if (scoring.getFullPlayers() <= 0) {
            throw new IllegalArgumentException("fullPlayers must be positive");
        }
        if (scoring.getTrendWindowSeconds() <= 0 || scoring.getJitterHoldSeconds() <= 0) {
            throw new IllegalArgumentException("Trend window and jitter hold must be positive");
        }
        if (stats.getMinHumans() < 0 || stats.getMinCapacity() < 0) {
            throw new IllegalArgumentException("Stats thresholds must be non-negative");
        }
    }

    // Getters and Setters

    public PollConfig getPoll() {
        return poll;
    }

    public void setPoll(PollConfig poll) {
        this.poll = poll;
    }

    public GameConfig getGame() {
        return game;
    }

    public void setGame(GameConfig game) {
        this.game = game;
    }

    public FilterConfig getFilter() {
        return filter;
    }

    public void setFilter(FilterConfig filter) {
        this.filter = filter;
    }

    public ScoringConfig getScoring() {
        return scoring;
    }

    public void setScoring(ScoringConfig scoring) {
        this.scoring = scoring;
    }

    public GeoConfig getGeo() {
        return geo;
    }

    public void setGeo(GeoConfig geo) {
        this.geo = geo;
    }

    public EndpointConfig getEndpoints() {
        return endpoints;
    }

    public void setEndpoints(EndpointConfig endpoints) {
        this.endpoints = endpoints;
    }

    public StatsConfig getStats() {
        return stats;
    }

    public void setStats(StatsConfig stats) {
        this.stats = stats;
    }

    /**
     * Path of an operator supplied taxonomy table file, or null for the bundled one.
     */
    public String getTablesFile() {
        return tablesFile;
    }

    public void setTablesFile(String tablesFile) {
        this.tablesFile = tablesFile;
    }

    /**
     * Poll loop cadence and per-request limits.
     */
    public static class PollConfig {
        private int intervalSeconds = 10;
        private int intervalVarianceSeconds = 5;
        private int expiryMarginSeconds = 1;
        private int schemaCheckSeconds = 300;
        private int schemaCheckVarianceSeconds = 300;
        private int probeTimeoutMillis = 2000;
        private int workerThreads = 32;
        private String directoryFilter = "\\appid\\440\\gamedir\\tf\\secure\\1\\dedicated\\1"
                + "\\ngametype\\hidden,friendlyfire,highlander,noquickplay,trade,dmgspread,mvm,pve,gravity"
                + "\\steamblocking\\1\\nor\\1\\white\\1";
        private int directoryLimit = 20000;

        public int getIntervalSeconds() {
            return intervalSeconds;
        }

        public void setIntervalSeconds(int intervalSeconds) {
            this.intervalSeconds = intervalSeconds;
        }

        public int getIntervalVarianceSeconds() {
            return intervalVarianceSeconds;
        }

        public void setIntervalVarianceSeconds(int intervalVarianceSeconds) {
            this.intervalVarianceSeconds = intervalVarianceSeconds;
        }

        public int getExpiryMarginSeconds() {
            return expiryMarginSeconds;
        }

        public void setExpiryMarginSeconds(int expiryMarginSeconds) {
            this.expiryMarginSeconds = expiryMarginSeconds;
        }

        public int getSchemaCheckSeconds() {
            return schemaCheckSeconds;
        }

        public void setSchemaCheckSeconds(int schemaCheckSeconds) {
            this.schemaCheckSeconds = schemaCheckSeconds;
        }

        public int getSchemaCheckVarianceSeconds() {
            return schemaCheckVarianceSeconds;
        }

        public void setSchemaCheckVarianceSeconds(int schemaCheckVarianceSeconds) {
            this.schemaCheckVarianceSeconds = schemaCheckVarianceSeconds;
        }

        public int getProbeTimeoutMillis() {
            return probeTimeoutMillis;
        }

        public void setProbeTimeoutMillis(int probeTimeoutMillis) {
            this.probeTimeoutMillis = probeTimeoutMillis;
        }

        public int getWorkerThreads() {
            return workerThreads;
        }

        public void setWorkerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
        }

        public String getDirectoryFilter() {
            return directoryFilter;
        }

        public void setDirectoryFilter(String directoryFilter) {
            this.directoryFilter = directoryFilter;
        }

        public int getDirectoryLimit() {
            return directoryLimit;
        }

        public void setDirectoryLimit(int directoryLimit) {
            this.directoryLimit = directoryLimit;
        }
    }

    /**
     * Identity of the target game.
     */
    public static class GameConfig {
        private int appId = 440;
        private String gameDir = "tf";
        private String gameTitle = "Team Fortress";
        private String casualMatchGroup = "MatchGroup_Casual_12v12";

        public int getAppId() {
            return appId;
        }

        public void setAppId(int appId) {
            this.appId = appId;
        }

        public String getGameDir() {
            return gameDir;
        }

        public void setGameDir(String gameDir) {
            this.gameDir = gameDir;
        }

        public String getGameTitle() {
            return gameTitle;
        }

        public void setGameTitle(String gameTitle) {
            this.gameTitle = gameTitle;
        }

        public String getCasualMatchGroup() {
            return casualMatchGroup;
        }

        public void setCasualMatchGroup(String casualMatchGroup) {
            this.casualMatchGroup = casualMatchGroup;
        }
    }

    /**
     * Eligibility bounds.
     */
    public static class FilterConfig {
        private int minCapacity = 18;
        private int maxCapacity = 101;
        private int increasedCapacityThreshold = 24;
        private List<String> relayAddressPrefixes = new ArrayList<>(List.of("169.254."));
        private boolean diagnostics = false;

        public int getMinCapacity() {
            return minCapacity;
        }

        public void setMinCapacity(int minCapacity) {
            this.minCapacity = minCapacity;
        }

        public int getMaxCapacity() {
            return maxCapacity;
        }

        public void setMaxCapacity(int maxCapacity) {
            this.maxCapacity = maxCapacity;
        }

        public int getIncreasedCapacityThreshold() {
            return increasedCapacityThreshold;
        }

        public void setIncreasedCapacityThreshold(int increasedCapacityThreshold) {
            this.increasedCapacityThreshold = increasedCapacityThreshold;
        }

        public List<String> getRelayAddressPrefixes() {
            return relayAddressPrefixes;
        }

        public void setRelayAddressPrefixes(List<String> relayAddressPrefixes) {
            this.relayAddressPrefixes = relayAddressPrefixes;
        }

        public boolean isDiagnostics() {
            return diagnostics;
        }

        public void setDiagnostics(boolean diagnostics) {
            this.diagnostics = diagnostics;
        }
    }

    /**
     * Scoring constants.
     */
    public static class ScoringConfig {
        private double baseBonus = 6.0;
        private int fullPlayers = 24;
        private int headroom = 1;
        private double rejectionScore = -100.0;
        private double emptyPenalty = -0.3;
        private double scoreMin = 0.0;
        private double scoreLow = 0.1;
        private double scoreIdeal = 1.6;
        private double scoreFuller = 0.2;
        private double scoreFinal = -0.3;
        private double lowFraction = 1.0 / 3.0;
        private double idealFraction = 0.72;
        private double anonymousPenalty = 0.1;
        private double titlePenalty = 0.1;
        private double anycastPenalty = 0.1;
        private double markerPenalty = 0.1;
        private int trendCrowdedThreshold = 16;
        private double trendBonusMin = 0.05;
        private double trendBonusMax = 0.25;
        private int trendWindowSeconds = 3600;
        private double jitterVarianceFactor = 0.0005;
        private int jitterHoldSeconds = 3600;

        public double getBaseBonus() {
            return baseBonus;
        }

        public void setBaseBonus(double baseBonus) {
            this.baseBonus = baseBonus;
        }

        public int getFullPlayers() {
            return fullPlayers;
        }

        public void setFullPlayers(int fullPlayers) {
            this.fullPlayers = fullPlayers;
        }

        public int getHeadroom() {
            return headroom;
        }

        public void setHeadroom(int headroom) {
            this.headroom = headroom;
        }

        public double getRejectionScore() {
            return rejectionScore;
        }

        public void setRejectionScore(double rejectionScore) {
            this.rejectionScore = rejectionScore;
        }

        public double getEmptyPenalty() {
            return emptyPenalty;
        }

        public void setEmptyPenalty(double emptyPenalty) {
            this.emptyPenalty = emptyPenalty;
        }

        public double getScoreMin() {
            return scoreMin;
        }

        public void setScoreMin(double scoreMin) {
            this.scoreMin = scoreMin;
        }

        public double getScoreLow() {
            return scoreLow;
        }

        public void setScoreLow(double scoreLow) {
            this.scoreLow = scoreLow;
        }

        public double getScoreIdeal() {
            return scoreIdeal;
        }

        public void setScoreIdeal(double scoreIdeal) {
            this.scoreIdeal = scoreIdeal;
        }

        public double getScoreFuller() {
            return scoreFuller;
        }

        public void setScoreFuller(double scoreFuller) {
            this.scoreFuller = scoreFuller;
        }

        public double getScoreFinal() {
            return scoreFinal;
        }

        public void setScoreFinal(double scoreFinal) {
            this.scoreFinal = scoreFinal;
        }

        public double getLowFraction() {
            return lowFraction;
        }

        public void setLowFraction(double lowFraction) {
            this.lowFraction = lowFraction;
        }

        public double getIdealFraction() {
            return idealFraction;
        }

        public void setIdealFraction(double idealFraction) {
            this.idealFraction = idealFraction;
        }

        public double getAnonymousPenalty() {
            return anonymousPenalty;
        }

        public void setAnonymousPenalty(double anonymousPenalty) {
            this.anonymousPenalty = anonymousPenalty;
        }

        public double getTitlePenalty() {
            return titlePenalty;
        }

        public void setTitlePenalty(double titlePenalty) {
            this.titlePenalty = titlePenalty;
        }

        public double getAnycastPenalty() {
            return anycastPenalty;
        }

        public void setAnycastPenalty(double anycastPenalty) {
            this.anycastPenalty = anycastPenalty;
        }

        public double getMarkerPenalty() {
            return markerPenalty;
        }

        public void setMarkerPenalty(double markerPenalty) {
            this.markerPenalty = markerPenalty;
        }

        public int getTrendCrowdedThreshold() {
            return trendCrowdedThreshold;
        }

        public void setTrendCrowdedThreshold(int trendCrowdedThreshold) {
            this.trendCrowdedThreshold = trendCrowdedThreshold;
        }

        public double getTrendBonusMin() {
            return trendBonusMin;
        }

        public void setTrendBonusMin(double trendBonusMin) {
            this.trendBonusMin = trendBonusMin;
        }

        public double getTrendBonusMax() {
            return trendBonusMax;
        }

        public void setTrendBonusMax(double trendBonusMax) {
            this.trendBonusMax = trendBonusMax;
        }

        public int getTrendWindowSeconds() {
            return trendWindowSeconds;
        }

        public void setTrendWindowSeconds(int trendWindowSeconds) {
            this.trendWindowSeconds = trendWindowSeconds;
        }

        public double getJitterVarianceFactor() {
            return jitterVarianceFactor;
        }

        public void setJitterVarianceFactor(double jitterVarianceFactor) {
            this.jitterVarianceFactor = jitterVarianceFactor;
        }

        public int getJitterHoldSeconds() {
            return jitterHoldSeconds;
        }

        public void setJitterHoldSeconds(int jitterHoldSeconds) {
            this.jitterHoldSeconds = jitterHoldSeconds;
        }
    }

    /**
     * Geolocation and ping overhead calibration.
     */
    public static class GeoConfig {
        private Double originLatitude;
        private Double originLongitude;
        private String originAddress;
        private double kilometresPerMillisecond = 65.5;
        private double overheadOffsetMillis = 1.0;
        private String cityDatabase = "GeoIP2-City.mmdb";
        private String asnDatabase = "GeoIP2-ASN.mmdb";

        public Double getOriginLatitude() {
            return originLatitude;
        }

        public void setOriginLatitude(Double originLatitude) {
            this.originLatitude = originLatitude;
        }

        public Double getOriginLongitude() {
            return originLongitude;
        }

        public void setOriginLongitude(Double originLongitude) {
            this.originLongitude = originLongitude;
        }

        public String getOriginAddress() {
            return originAddress;
        }

        public void setOriginAddress(String originAddress) {
            this.originAddress = originAddress;
        }

        public double getKilometresPerMillisecond() {
            return kilometresPerMillisecond;
        }

        public void setKilometresPerMillisecond(double kilometresPerMillisecond) {
            this.kilometresPerMillisecond = kilometresPerMillisecond;
        }

        public double getOverheadOffsetMillis() {
            return overheadOffsetMillis;
        }

        public void setOverheadOffsetMillis(double overheadOffsetMillis) {
            this.overheadOffsetMillis = overheadOffsetMillis;
        }

        public String getCityDatabase() {
            return cityDatabase;
        }

        public void setCityDatabase(String cityDatabase) {
            this.cityDatabase = cityDatabase;
        }

        public String getAsnDatabase() {
            return asnDatabase;
        }

        public void setAsnDatabase(String asnDatabase) {
            this.asnDatabase = asnDatabase;
        }
    }

    /**
     * Remote endpoints and local artifacts.
     */
    public static class EndpointConfig {
        private String steamApiUrl = "https://api.steampowered.com";
        private String steamApiKey = "";
        private String consumerUrl = "";
        private String consumerApiKey = "";
        private int requestTimeoutSeconds = 30;
        private String snapshotFile = "servers.json";
        private String rejectionsFile = "rejections.json";
        private String statsFile = "server_stats.json";
        private String storeFile = "db.json";

        public String getSteamApiUrl() {
            return steamApiUrl;
        }

        public void setSteamApiUrl(String steamApiUrl) {
            this.steamApiUrl = steamApiUrl;
        }

        public String getSteamApiKey() {
            return steamApiKey;
        }

        public void setSteamApiKey(String steamApiKey) {
            this.steamApiKey = steamApiKey;
        }

        public String getConsumerUrl() {
            return consumerUrl;
        }

        public void setConsumerUrl(String consumerUrl) {
            this.consumerUrl = consumerUrl;
        }

        public String getConsumerApiKey() {
            return consumerApiKey;
        }

        public void setConsumerApiKey(String consumerApiKey) {
            this.consumerApiKey = consumerApiKey;
        }

        public int getRequestTimeoutSeconds() {
            return requestTimeoutSeconds;
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = requestTimeoutSeconds;
        }

        public String getSnapshotFile() {
            return snapshotFile;
        }

        public void setSnapshotFile(String snapshotFile) {
            this.snapshotFile = snapshotFile;
        }

        public String getRejectionsFile() {
            return rejectionsFile;
        }

        public void setRejectionsFile(String rejectionsFile) {
            this.rejectionsFile = rejectionsFile;
        }

        public String getStatsFile() {
            return statsFile;
        }

        public void setStatsFile(String statsFile) {
            this.statsFile = statsFile;
        }

        public String getStoreFile() {
            return storeFile;
        }

        public void setStoreFile(String storeFile) {
            this.storeFile = storeFile;
        }
    }

    /**
     * Population statistics written next to the snapshot.
     */
    public static class StatsConfig {
        private boolean enabled = true;
        private int minHumans = 2;
        private int minCapacity = 6;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        /**
         * Fewest humans for a server to appear in the per-map and per-server breakdown.
         */
        public int getMinHumans() {
            return minHumans;
        }

        public void setMinHumans(int minHumans) {
            this.minHumans = minHumans;
        }

        public int getMinCapacity() {
            return minCapacity;
        }

        public void setMinCapacity(int minCapacity) {
            this.minCapacity = minCapacity;
        }
    }
}
