package me.internalizable.quickplay.classify;

import me.internalizable.quickplay.api.capability.ProbeResult;
import me.internalizable.quickplay.api.capability.ServerProbe;
import me.internalizable.quickplay.candidate.ClassifiedServer;
import me.internalizable.quickplay.candidate.RawCandidate;
import me.internalizable.quickplay.config.QuickplayConfig;
import me.internalizable.quickplay.schema.MatchmakingTables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Ordered eligibility filter.
 *
 * <p>Predicates run in a fixed order and the first failing one decides the
 * rejection reason. {@link #evaluate} runs the synchronous part of the chain;
 * {@link #classify} adds the direct probes: one before filtering when the
 * directory data is stale, and one live verification of every candidate that
 * passed.</p>
 *
 * <p>Thread-safe: it only reads its tables and the per-tick context.</p>
 */
public final class Classifier {

    private static final Logger LOGGER = LoggerFactory.getLogger(Classifier.class);

    private final MatchmakingTables tables;
    private final QuickplayConfig.GameConfig game;
    private final QuickplayConfig.FilterConfig filter;
    private final long probeTimeoutMillis;
    private final ServerProbe probe;
    private final TagEnricher enricher;
    private final MapResolver mapResolver;
    private final Set<String> gamemodeTagVocabulary;

    public Classifier(@Nonnull MatchmakingTables tables, @Nonnull QuickplayConfig config, @Nonnull ServerProbe probe) {
        this.tables = Objects.requireNonNull(tables, "tables");
        Objects.requireNonNull(config, "config");
        this.game = config.getGame();
        this.filter = config.getFilter();
        this.probeTimeoutMillis = config.getPoll().getProbeTimeoutMillis();
        this.probe = Objects.requireNonNull(probe, "probe");
        this.enricher = new TagEnricher(tables);
        this.mapResolver = new MapResolver(tables);

        Set<String> vocabulary = new LinkedHashSet<>();
        tables.getGamemodeTags().values().stream().filter(t -> t != null && !t.isEmpty()).forEach(vocabulary::add);
        tables.getPrefixTags().values().stream().filter(t -> t != null && !t.isEmpty()).forEach(vocabulary::add);
        vocabulary.removeAll(tables.getExemptTags());
        vocabulary.removeAll(tables.getForcedModeTags());
        this.gamemodeTagVocabulary = Collections.unmodifiableSet(vocabulary);
    }

    // ==================== Full Chain ====================

    /**
     * Classify a candidate, probing it as needed.
     *
     * <p>The returned future never completes exceptionally: probe failures and
     * timeouts become rejections.</p>
     *
     * @param candidate the candidate
     * @param context shared state of the current tick
     * @return future completing with the result
     */
    @Nonnull
    public CompletableFuture<ClassificationResult> classify(@Nonnull RawCandidate candidate, @Nonnull TickContext context) {
        Objects.requireNonNull(candidate, "candidate");
        Objects.requireNonNull(context, "context");

        ClassificationResult.Rejected early = checkIdentity(candidate);
        if (early != null) {
            return CompletableFuture.completedFuture(early);
        }

        if (context.directoryFresh()) {
            return verify(evaluateFiltered(candidate, context), null);
        }

        return probe(candidate).handle((result, error) -> {
            if (error != null) {
                return CompletableFuture.<ClassificationResult>completedFuture(
                        reject(RejectionReason.PROBE_FAILED, candidate, describe(error)));
            }
            RawCandidate live = candidate.withProbe(result);
            return verify(evaluateFiltered(live, context), result);
        }).thenCompose(future -> future);
    }

    /**
     * Run the synchronous predicates without probing.
     *
     * <p>Deterministic for a given candidate and context. An accepted result
     * has not been verified and carries no probe.</p>
     *
     * @param candidate the candidate
     * @param context shared state of the current tick
     * @return the result
     */
    @Nonnull
    public ClassificationResult evaluate(@Nonnull RawCandidate candidate, @Nonnull TickContext context) {
        ClassificationResult.Rejected early = checkIdentity(candidate);
        return early != null ? early : evaluateFiltered(candidate, context);
    }

    // ==================== Predicates ====================

    @Nullable
    private ClassificationResult.Rejected checkIdentity(RawCandidate c) {
        String host = c.host();
        for (String prefix : filter.getRelayAddressPrefixes()) {
            if (host.startsWith(prefix)) {
                return reject(RejectionReason.RELAY_ADDRESS, c, host);
            }
        }

        if (!isValidIdentity(c.identity())) {
            return reject(RejectionReason.INVALID_IDENTITY, c, c.identity());
        }
        return null;
    }

    private ClassificationResult evaluateFiltered(RawCandidate c, TickContext context) {
        if (c.appId() != game.getAppId()
                || !game.getGameDir().equals(c.gameDir())
                || !game.getGameDir().equals(c.product())) {
            return reject(RejectionReason.APP_MISMATCH, c, c.appId() + "/" + c.gameDir() + "/" + c.product());
        }

        if (c.capacity() < filter.getMinCapacity()) {
            return reject(RejectionReason.CAPACITY_TOO_LOW, c, String.valueOf(c.capacity()));
        }
        if (c.capacity() > filter.getMaxCapacity()) {
            return reject(RejectionReason.CAPACITY_TOO_HIGH, c, String.valueOf(c.capacity()));
        }

        if (c.humans() >= c.capacity()) {
            return reject(RejectionReason.PLAYER_COUNT_MISMATCH, c, c.humans() + "/" + c.capacity());
        }

        if (c.version() < context.minimumVersion()) {
            return reject(RejectionReason.OUTDATED, c, c.version() + " < " + context.minimumVersion());
        }

        MapResolution map = mapResolver.resolve(c.map(), context.schema());
        if (!map.isResolved()) {
            return reject(map.reason(), c, c.map());
        }

        if (context.bans().identities().contains(c.identity())) {
            return reject(RejectionReason.BANNED_IDENTITY, c, c.identity());
        }
        if (context.bans().addresses().contains(c.host())) {
            return reject(RejectionReason.BANNED_ADDRESS, c, c.host());
        }

        Set<String> advertised = TagEnricher.parse(c.tags());
        if (advertised.isEmpty()) {
            return reject(RejectionReason.NO_TAGS, c, "");
        }
        Set<String> tags = enricher.enrich(advertised, c.name());

        boolean increased = c.capacity() > filter.getIncreasedCapacityThreshold();
        if (increased != tags.contains(tables.getIncreasedCapacityTag())) {
            return reject(RejectionReason.CAPACITY_TAG_MISMATCH, c,
                    (increased ? "missing " : "unexpected ") + tables.getIncreasedCapacityTag());
        }

        if (!map.customAllowListed() && Collections.disjoint(tags, tables.getValidTags())) {
            return reject(RejectionReason.NO_VALID_TAG, c, String.join(",", tags));
        }

        String gamemode = Objects.requireNonNull(map.gamemode());
        String expected = tables.expectedTag(gamemode, c.map());
        boolean forcedMode = !Collections.disjoint(tags, tables.getForcedModeTags());
        if (!expected.isEmpty() && !forcedMode && !tags.contains(expected)) {
            return reject(RejectionReason.MISSING_GAMEMODE_TAG, c, expected);
        }

        if (!expected.isEmpty()) {
            for (String tag : tags) {
                if (!tag.equals(expected) && gamemodeTagVocabulary.contains(tag)) {
                    return reject(RejectionReason.TAG_EXCLUSIVITY, c, tag + " on " + expected);
                }
            }
        }

        boolean betaMap = tables.getBetaMaps().containsKey(c.map());
        if (betaMap != tags.contains(tables.getBetaTag())) {
            return reject(RejectionReason.BETA_MISMATCH, c, betaMap ? "missing beta tag" : "unexpected beta tag");
        }

        for (String tag : tags) {
            if (context.bans().tags().contains(tag)) {
                return reject(RejectionReason.BANNED_TAG, c, tag);
            }
        }

        String bannedName = context.bans().bannedSubstringIn(c.name());
        if (bannedName != null) {
            return reject(RejectionReason.BANNED_NAME, c, bannedName);
        }

        return new ClassificationResult.Accepted(new ClassifiedServer(c, tags, gamemode, expected, null));
    }

    // ==================== Live Verification ====================

    private CompletableFuture<ClassificationResult> verify(ClassificationResult result, @Nullable ProbeResult earlier) {
        if (!result.isAccepted()) {
            return CompletableFuture.completedFuture(result);
        }
        ClassifiedServer server = ((ClassificationResult.Accepted) result).server();
        if (earlier != null) {
            return CompletableFuture.completedFuture(checkLive(server, earlier));
        }
        return probe(server.candidate()).handle((live, error) -> error != null
                ? reject(RejectionReason.PROBE_TIMEOUT, server.candidate(), describe(error))
                : checkLive(server, live));
    }

    private ClassificationResult checkLive(ClassifiedServer server, ProbeResult live) {
        if (live.passwordProtected()) {
            return reject(RejectionReason.PASSWORD_PROTECTED, server.candidate(), "");
        }
        if (live.appId() != game.getAppId() || !game.getGameDir().equals(live.gameDir())) {
            return reject(RejectionReason.APP_MISMATCH, server.candidate(), live.appId() + "/" + live.gameDir());
        }
        return new ClassificationResult.Accepted(server.withProbe(live));
    }

    private CompletableFuture<ProbeResult> probe(RawCandidate candidate) {
        Integer port = candidate.port();
        if (port == null) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("No port in " + candidate.address()));
        }
        try {
            CompletableFuture<ProbeResult> future = probe.probe(candidate.host(), port);
            return future.orTimeout(probeTimeoutMillis, TimeUnit.MILLISECONDS);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    // ==================== Helpers ====================

    /**
     * Check the form of a server identity: non-empty decimal digits.
     *
     * @param identity server identity
     * @return true if well formed
     */
    public static boolean isValidIdentity(@Nonnull String identity) {
        if (identity.isEmpty()) {
            return false;
        }
        for (int i = 0; i < identity.length(); i++) {
            char ch = identity.charAt(i);
            if (ch < '0' || ch > '9') {
                return false;
            }
        }
        return true;
    }

    private static ClassificationResult.Rejected reject(RejectionReason reason, RawCandidate candidate, String detail) {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Rejected {} ({}): {} {}", candidate.address(), candidate.name(), reason, detail);
        }
        return new ClassificationResult.Rejected(reason, candidate, detail);
    }

    private static String describe(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof TimeoutException) {
            return "timed out";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
