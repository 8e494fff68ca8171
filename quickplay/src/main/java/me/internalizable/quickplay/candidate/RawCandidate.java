package me.internalizable.quickplay.candidate;

import me.internalizable.quickplay.api.capability.DirectoryServer;
import me.internalizable.quickplay.api.capability.ProbeResult;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * A server as reported by the directory, before classification.
 *
 * @param address host:port
 * @param identity server identity
 * @param name raw display name
 * @param appId application id
 * @param gameDir game directory (mod) name
 * @param product product name
 * @param humans human count
 * @param bots bot count
 * @param capacity advertised capacity
 * @param map current map
 * @param tags raw comma separated tag string
 * @param version build version, 0 if unparsable
 */
public record RawCandidate(
        @Nonnull String address,
        @Nonnull String identity,
        @Nonnull String name,
        int appId,
        @Nonnull String gameDir,
        @Nonnull String product,
        int humans,
        int bots,
        int capacity,
        @Nonnull String map,
        @Nonnull String tags,
        long version
) {

    public RawCandidate {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(identity, "identity");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(gameDir, "gameDir");
        Objects.requireNonNull(product, "product");
        Objects.requireNonNull(map, "map");
        Objects.requireNonNull(tags, "tags");
    }

    /**
     * Convert a directory descriptor.
     *
     * @param server directory descriptor
     * @return the candidate
     */
    @Nonnull
    public static RawCandidate fromDirectory(@Nonnull DirectoryServer server) {
        return new RawCandidate(
                server.address(),
                server.identity(),
                server.name(),
                server.appId(),
                server.gameDir(),
                server.product(),
                server.humans(),
                server.bots(),
                server.capacity(),
                server.map(),
                server.tags(),
                parseVersion(server.version())
        );
    }

    /**
     * Replace the live fields with those of a direct probe.
     *
     * <p>Capacity is kept from the directory.</p>
     *
     * @param probe probe result
     * @return a new candidate carrying the live fields
     */
    @Nonnull
    public RawCandidate withProbe(@Nonnull ProbeResult probe) {
        return new RawCandidate(
                address,
                identity,
                name,
                probe.appId(),
                probe.gameDir(),
                probe.gameDir(),
                probe.humans(),
                probe.bots(),
                capacity,
                probe.map(),
                probe.tags(),
                parseVersion(probe.version())
        );
    }

    /**
     * Get the host part of the address.
     *
     * @return host
     */
    @Nonnull
    public String host() {
        int idx = address.lastIndexOf(':');
        return idx < 0 ? address : address.substring(0, idx);
    }

    /**
     * Get the port part of the address.
     *
     * @return port, or null if absent or malformed
     */
    @Nullable
    public Integer port() {
        int idx = address.lastIndexOf(':');
        if (idx < 0) {
            return null;
        }
        try {
            return Integer.parseInt(address.substring(idx + 1));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Parse a build version string.
     *
     * @param version version string
     * @return the version, or 0 if it is not a number
     */
    public static long parseVersion(@Nullable String version) {
        if (version == null) {
            return 0;
        }
        try {
            return Long.parseLong(version.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
