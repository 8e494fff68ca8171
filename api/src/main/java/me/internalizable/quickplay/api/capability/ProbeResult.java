package me.internalizable.quickplay.api.capability;

import javax.annotation.Nonnull;
import java.time.Duration;
import java.util.Objects;

/**
 * Live descriptor fields returned by a direct server probe.
 *
 * @param appId application id
 * @param gameDir game directory (mod) name
 * @param gameTitle game title string the server reports
 * @param humans live human count
 * @param bots live bot count
 * @param capacity live capacity
 * @param map current map
 * @param tags raw comma separated tag string
 * @param version build version string
 * @param passwordProtected whether joining requires a password
 * @param latency measured round trip time
 */
public record ProbeResult(
        int appId,
        @Nonnull String gameDir,
        @Nonnull String gameTitle,
        int humans,
        int bots,
        int capacity,
        @Nonnull String map,
        @Nonnull String tags,
        @Nonnull String version,
        boolean passwordProtected,
        @Nonnull Duration latency
) {

    public ProbeResult {
        gameDir = gameDir != null ? gameDir : "";
        gameTitle = gameTitle != null ? gameTitle : "";
        map = map != null ? map : "";
        tags = tags != null ? tags : "";
        version = version != null ? version : "";
        Objects.requireNonNull(latency, "latency");
    }

    /**
     * Get the latency in fractional milliseconds.
     *
     * @return latency in milliseconds
     */
    public double latencyMillis() {
        return latency.toNanos() / 1_000_000.0;
    }
}
