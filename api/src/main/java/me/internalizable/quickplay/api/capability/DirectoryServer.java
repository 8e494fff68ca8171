package me.internalizable.quickplay.api.capability;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * One server descriptor as returned by the directory listing.
 *
 * @param address host:port
 * @param identity server identity (steam id)
 * @param name display name
 * @param appId application id
 * @param gameDir game directory (mod) name
 * @param product product name
 * @param humans reported human count
 * @param bots reported bot count
 * @param capacity advertised capacity
 * @param map current map, may be empty
 * @param tags raw comma separated tag string, may be empty
 * @param version build version string
 */
public record DirectoryServer(
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
        @Nonnull String version
) {

    public DirectoryServer {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(identity, "identity");
        name = name != null ? name : "";
        gameDir = gameDir != null ? gameDir : "";
        product = product != null ? product : "";
        map = map != null ? map : "";
        tags = tags != null ? tags : "";
        version = version != null ? version : "";
    }
}
