package me.internalizable.quickplay.schema;

import me.internalizable.quickplay.api.capability.SchemaDocumentSource;
import me.internalizable.quickplay.api.capability.SchemaSourceException;
import me.internalizable.quickplay.config.QuickplayConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.Random;

/**
 * Keeps the map to gamemode taxonomy in step with the schema document.
 *
 * <p>The document identity is checked on a slow, randomized cadence and the
 * document is only re-fetched when the identity changes. The snapshot is also
 * rebuilt from the cached document when the UTC month rolls over, so
 * holiday-restricted maps move in and out of the main table. Failures are
 * logged and the previous snapshot stays in place.</p>
 *
 * <p>Not thread-safe; driven from the poll loop thread only.</p>
 */
public class SchemaSync {

    private static final Logger LOGGER = LoggerFactory.getLogger(SchemaSync.class);

    private final SchemaDocumentSource source;
    private final MatchmakingTables tables;
    private final QuickplayConfig config;
    private final Clock clock;
    private final Random random;

    private String lastIdentity;
    private Map<String, Object> lastDocument;
    private SchemaSnapshot snapshot;
    private int lastMonth;
    private Instant nextCheckAt = Instant.MIN;
    private long minimumVersion;

    /**
     * Create a schema synchronizer.
     *
     * @param source schema document source
     * @param tables literal taxonomy tables
     * @param config service configuration
     * @param clock clock for check cadence and month rollover
     * @param random source of cadence jitter
     */
    public SchemaSync(
            @Nonnull SchemaDocumentSource source,
            @Nonnull MatchmakingTables tables,
            @Nonnull QuickplayConfig config,
            @Nonnull Clock clock,
            @Nonnull Random random) {
        this.source = Objects.requireNonNull(source, "source");
        this.tables = Objects.requireNonNull(tables, "tables");
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * Bring the snapshot up to date.
     *
     * @return the current snapshot and whether this call changed it
     */
    @Nonnull
    public SchemaPollResult poll() {
        Instant now = clock.instant();
        int month = now.atZone(ZoneOffset.UTC).getMonthValue();
        boolean changed = false;

        if (snapshot == null || !now.isBefore(nextCheckAt)) {
            changed = refreshDocument(now, month);
            refreshMinimumVersion();
        } else if (minimumVersion == 0) {
            refreshMinimumVersion();
        }

        if (!changed && lastDocument != null && month != lastMonth) {
            try {
                snapshot = SchemaDocumentParser.parse(lastDocument, tables,
                        config.getGame().getCasualMatchGroup(), month, lastIdentity);
                lastMonth = month;
                changed = true;
                LOGGER.info("Month rolled over to {}, rebuilt schema snapshot", month);
            } catch (RuntimeException e) {
                LOGGER.warn("Failed to rebuild schema for month {}: {}", month, e.getMessage());
            }
        }

        return new SchemaPollResult(snapshot, changed, minimumVersion);
    }

    private boolean refreshDocument(Instant now, int month) {
        try {
            String identity = source.fetchDocumentIdentity();
            QuickplayConfig.PollConfig poll = config.getPoll();
            long delayMillis = poll.getSchemaCheckSeconds() * 1000L
                    + (long) (random.nextDouble() * poll.getSchemaCheckVarianceSeconds() * 1000L);
            nextCheckAt = now.plus(Duration.ofMillis(delayMillis));

            if (identity.equals(lastIdentity)) {
                return false;
            }

            LOGGER.info("Schema document changed: {}", identity);
            Map<String, Object> document = KeyValuesParser.parse(source.fetchDocument(identity));
            SchemaSnapshot rebuilt = SchemaDocumentParser.parse(document, tables,
                    config.getGame().getCasualMatchGroup(), month, identity);

            lastIdentity = identity;
            lastDocument = document;
            lastMonth = month;
            snapshot = rebuilt;
            LOGGER.info("Schema snapshot rebuilt: {} maps, {} gamemodes",
                    rebuilt.getMapGamemodes().size(), rebuilt.getGamemodes().size());
            return true;
        } catch (SchemaSourceException | KeyValuesParser.ParseException e) {
            LOGGER.warn("Failed to refresh schema document: {}", e.getMessage());
        } catch (RuntimeException e) {
            LOGGER.warn("Malformed schema document: {}", e.getMessage());
        }
        return false;
    }

    private void refreshMinimumVersion() {
        try {
            OptionalLong version = source.fetchMinimumVersion();
            if (version.isPresent() && version.getAsLong() > 0) {
                if (version.getAsLong() != minimumVersion) {
                    LOGGER.debug("Minimum server version now {}", version.getAsLong());
                }
                minimumVersion = version.getAsLong();
            }
        } catch (SchemaSourceException e) {
            LOGGER.warn("Failed to fetch minimum server version: {}", e.getMessage());
        }
    }

    /**
     * Get the current snapshot without polling.
     *
     * @return the snapshot, or null if none was loaded yet
     */
    @Nullable
    public SchemaSnapshot getSnapshot() {
        return snapshot;
    }

    /**
     * Get the last known minimum server version.
     *
     * @return the version, 0 if unknown
     */
    public long getMinimumVersion() {
        return minimumVersion;
    }
}
