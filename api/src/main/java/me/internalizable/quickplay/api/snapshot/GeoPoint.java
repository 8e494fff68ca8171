package me.internalizable.quickplay.api.snapshot;

/**
 * Geographic point of a published server, serialized as {@code [longitude, latitude]}.
 *
 * @param longitude longitude in degrees
 * @param latitude latitude in degrees
 */
public record GeoPoint(double longitude, double latitude) {
}
