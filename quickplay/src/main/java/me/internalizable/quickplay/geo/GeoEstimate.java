package me.internalizable.quickplay.geo;

import me.internalizable.quickplay.api.capability.GeoLocation;

import javax.annotation.Nonnull;

/**
 * @param location resolved server location
 * @param distanceKm great-circle distance from the origin
 * @param pingOverhead latency not explained by distance, at least 1
 */
public record GeoEstimate(@Nonnull GeoLocation location, double distanceKm, double pingOverhead) {
}
