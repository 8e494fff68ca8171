package me.internalizable.quickplay.api.capability;

/**
 * Thrown when an address cannot be geolocated.
 */
public class GeoLookupException extends CapabilityException {

    public GeoLookupException(String message) {
        super(message);
    }

    public GeoLookupException(String message, Throwable cause) {
        super(message, cause);
    }
}
