package me.internalizable.quickplay.api.capability;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Address geolocation.
 */
public interface GeoLocator {

    /**
     * Resolve an address to a location.
     *
     * @param address IP address
     * @return the location
     * @throws GeoLookupException if the address is unresolvable
     */
    @Nonnull
    GeoLocation locate(@Nonnull String address) throws GeoLookupException;

    /**
     * Resolve the network block an address belongs to, in CIDR notation.
     *
     * @param address IP address
     * @return the network block, or null if unknown
     */
    @Nullable
    default String networkOf(@Nonnull String address) {
        return null;
    }
}
