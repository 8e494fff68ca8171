package me.internalizable.quickplay.api.capability;

import javax.annotation.Nullable;

/**
 * Resolved location of an address.
 *
 * @param country ISO country code, may be null
 * @param continent continent code, may be null
 * @param latitude latitude in degrees
 * @param longitude longitude in degrees
 */
public record GeoLocation(
        @Nullable String country,
        @Nullable String continent,
        double latitude,
        double longitude
) {
}
