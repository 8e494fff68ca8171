package me.internalizable.quickplay.geo;

import me.internalizable.quickplay.api.capability.GeoLocation;
import me.internalizable.quickplay.api.capability.GeoLocator;
import me.internalizable.quickplay.api.capability.GeoLookupException;
import me.internalizable.quickplay.config.QuickplayConfig;
import me.internalizable.quickplay.store.GeoOverrideTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves server locations and estimates ping overhead.
 *
 * <p>Overhead is {@code max(latency - distance / kmPerMs - offset, 1)}: the
 * part of the measured round trip a player would pay regardless of where the
 * server is.</p>
 */
public final class GeoEstimator {

    private static final Logger LOGGER = LoggerFactory.getLogger(GeoEstimator.class);

    private final GeoLocator locator;
    private final GeoOverrideTable overrides;
    private final QuickplayConfig.GeoConfig config;
    private volatile GeoLocation origin;

    public GeoEstimator(@Nonnull GeoLocator locator, @Nonnull GeoOverrideTable overrides, @Nonnull QuickplayConfig.GeoConfig config) {
        this.locator = Objects.requireNonNull(locator, "locator");
        this.overrides = Objects.requireNonNull(overrides, "overrides");
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Resolve the operator's own location from configured coordinates, or by
     * geolocating the configured origin address.
     *
     * @return the origin
     * @throws GeoLookupException if the origin address cannot be resolved
     * @throws IllegalStateException if neither coordinates nor an address are configured
     */
    @Nonnull
    public GeoLocation resolveOrigin() throws GeoLookupException {
        if (config.getOriginLatitude() != null && config.getOriginLongitude() != null) {
            origin = new GeoLocation(null, null, config.getOriginLatitude(), config.getOriginLongitude());
        } else if (config.getOriginAddress() != null && !config.getOriginAddress().isEmpty()) {
            origin = locate(config.getOriginAddress());
        } else {
            throw new IllegalStateException("No origin coordinates or origin address configured");
        }
        LOGGER.info("Origin resolved to {}, {}", origin.latitude(), origin.longitude());
        return origin;
    }

    /**
     * Locate a host, preferring the override table.
     *
     * @param host server host
     * @return the location
     * @throws GeoLookupException if the host is neither overridden nor resolvable
     */
    @Nonnull
    public GeoLocation locate(@Nonnull String host) throws GeoLookupException {
        Optional<GeoLocation> override = overrides.find(host);
        if (override.isPresent()) {
            return override.get();
        }
        return locator.locate(host);
    }

    /**
     * Estimate location, distance and overhead for a server.
     *
     * @param host server host
     * @param latencyMillis measured round trip in milliseconds
     * @return the estimate
     * @throws GeoLookupException if the host cannot be located
     * @throws IllegalStateException if the origin has not been resolved
     */
    @Nonnull
    public GeoEstimate estimate(@Nonnull String host, double latencyMillis) throws GeoLookupException {
        GeoLocation from = origin;
        if (from == null) {
            throw new IllegalStateException("Origin not resolved");
        }
        GeoLocation location = locate(host);
        double distance = GreatCircle.distanceKm(from.latitude(), from.longitude(), location.latitude(), location.longitude());
        return new GeoEstimate(location, distance, overhead(latencyMillis, distance));
    }

    /**
     * Ping overhead for a latency and distance.
     *
     * @param latencyMillis measured round trip in milliseconds
     * @param distanceKm distance to the server
     * @return overhead, at least 1
     */
    public double overhead(double latencyMillis, double distanceKm) {
        double explained = distanceKm / config.getKilometresPerMillisecond();
        return Math.max(latencyMillis - explained - config.getOverheadOffsetMillis(), 1.0);
    }

    /**
     * Network block of a host, for the anycast check.
     *
     * @param host server host
     * @return the block in CIDR notation, or null if unknown
     */
    @Nullable
    public String networkOf(@Nonnull String host) {
        return locator.networkOf(host);
    }

    @Nullable
    public GeoLocation getOrigin() {
        return origin;
    }
}
