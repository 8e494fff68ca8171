package me.internalizable.quickplay.score;

import me.internalizable.quickplay.api.capability.GeoLookupException;
import me.internalizable.quickplay.api.capability.ProbeResult;
import me.internalizable.quickplay.candidate.ClassifiedServer;
import me.internalizable.quickplay.candidate.RawCandidate;
import me.internalizable.quickplay.candidate.ScoredServer;
import me.internalizable.quickplay.classify.TickContext;
import me.internalizable.quickplay.config.QuickplayConfig;
import me.internalizable.quickplay.geo.GeoEstimate;
import me.internalizable.quickplay.geo.GeoEstimator;
import me.internalizable.quickplay.store.ReputationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns verified servers into scored ones.
 *
 * <p>Not thread-safe: scoring updates the trend and jitter caches, so it runs
 * on the scheduling thread only.</p>
 */
public final class Scorer {

    private static final Logger LOGGER = LoggerFactory.getLogger(Scorer.class);

    /** Identities handed out to servers without a persistent login. */
    private static final String ANONYMOUS_IDENTITY_PREFIX = "9";

    private final QuickplayConfig.ScoringConfig scoring;
    private final String gameTitle;
    private final ReputationStore reputation;
    private final GeoEstimator geo;
    private final TrendCache trends;
    private final JitterCache jitter;
    private final NameSanitizer sanitizer;

    public Scorer(
            @Nonnull QuickplayConfig config,
            @Nonnull ReputationStore reputation,
            @Nonnull GeoEstimator geo,
            @Nonnull TrendCache trends,
            @Nonnull JitterCache jitter,
            @Nonnull NameSanitizer sanitizer) {
        Objects.requireNonNull(config, "config");
        this.scoring = config.getScoring();
        this.gameTitle = config.getGame().getGameTitle();
        this.reputation = Objects.requireNonNull(reputation, "reputation");
        this.geo = Objects.requireNonNull(geo, "geo");
        this.trends = Objects.requireNonNull(trends, "trends");
        this.jitter = Objects.requireNonNull(jitter, "jitter");
        this.sanitizer = Objects.requireNonNull(sanitizer, "sanitizer");
    }

    /**
     * Score a server and estimate its geography.
     *
     * @param server a verified server
     * @param context shared state of the current tick
     * @return the scored server, or empty if its location cannot be resolved
     * @throws IllegalArgumentException if the server carries no probe result
     */
    @Nonnull
    public Optional<ScoredServer> score(@Nonnull ClassifiedServer server, @Nonnull TickContext context) {
        ProbeResult live = server.probe();
        if (live == null) {
            throw new IllegalArgumentException("Server " + server.candidate().address() + " was not verified");
        }

        double score = computeScore(server, context);

        RawCandidate candidate = server.candidate();
        GeoEstimate estimate;
        try {
            estimate = geo.estimate(candidate.host(), live.latencyMillis());
        } catch (GeoLookupException e) {
            LOGGER.debug("Dropping {}: {}", candidate.address(), e.getMessage());
            return Optional.empty();
        }

        return Optional.of(new ScoredServer(
                server,
                score,
                estimate.location(),
                estimate.pingOverhead(),
                sanitizer.sanitize(candidate.name())
        ));
    }

    /**
     * Compute the composite score.
     *
     * <p>Records the observation in the trend cache and draws or clears the
     * jitter offset as a side effect.</p>
     *
     * @param server a verified server
     * @param context shared state of the current tick
     * @return the score
     */
    public double computeScore(@Nonnull ClassifiedServer server, @Nonnull TickContext context) {
        RawCandidate candidate = server.candidate();
        String identity = candidate.identity();
        int humans = candidate.humans();

        double population = PopulationCurve.score(humans, candidate.capacity(), scoring);
        double trend = trends.observe(identity, humans);
        if (population == scoring.getRejectionScore()) {
            jitter.offset(identity, humans, population);
            return population;
        }

        double score = scoring.getBaseBonus() + reputation.get(identity) + population + trend;

        if (identity.startsWith(ANONYMOUS_IDENTITY_PREFIX)) {
            score -= scoring.getAnonymousPenalty();
        }

        ProbeResult live = server.probe();
        if (live != null && !gameTitle.equals(live.gameTitle())) {
            score -= scoring.getTitlePenalty();
        }

        String network = geo.networkOf(candidate.host());
        if (network != null && context.anycastNetworks().contains(network)) {
            score -= scoring.getAnycastPenalty();
        }

        if (sanitizer.hasLeadingMarker(candidate.name())) {
            score -= scoring.getMarkerPenalty();
        }

        return score + jitter.offset(identity, humans, score);
    }

    /**
     * Drop expired trend and jitter entries.
     */
    public void sweepCaches() {
        int trendsRemoved = trends.sweep();
        int jitterRemoved = jitter.sweep();
        if (trendsRemoved > 0 || jitterRemoved > 0) {
            LOGGER.debug("Swept {} trend and {} jitter entries", trendsRemoved, jitterRemoved);
        }
    }

    @Nonnull
    public TrendCache getTrends() {
        return trends;
    }

    @Nonnull
    public JitterCache getJitter() {
        return jitter;
    }
}
