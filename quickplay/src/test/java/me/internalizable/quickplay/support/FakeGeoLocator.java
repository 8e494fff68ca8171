package me.internalizable.quickplay.support;

import me.internalizable.quickplay.api.capability.GeoLocation;
import me.internalizable.quickplay.api.capability.GeoLocator;
import me.internalizable.quickplay.api.capability.GeoLookupException;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public final class FakeGeoLocator implements GeoLocator {

    private final Map<String, GeoLocation> locations = new ConcurrentHashMap<>();
    private final Map<String, String> networks = new ConcurrentHashMap<>();

    public FakeGeoLocator locate(String host, GeoLocation location) {
        locations.put(host, location);
        return this;
    }

    public FakeGeoLocator network(String host, String network) {
        networks.put(host, network);
        return this;
    }

    @Override
    public GeoLocation locate(String address) throws GeoLookupException {
        GeoLocation location = locations.get(address);
        if (location == null) {
            throw new GeoLookupException("Address not found: " + address);
        }
        return location;
    }

    @Override
    public String networkOf(String address) {
        return networks.get(address);
    }
}
