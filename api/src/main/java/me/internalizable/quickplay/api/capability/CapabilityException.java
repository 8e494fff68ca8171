package me.internalizable.quickplay.api.capability;

/**
 * Base class for failures reported by an external capability.
 */
public class CapabilityException extends Exception {

    public CapabilityException(String message) {
        super(message);
    }

    public CapabilityException(String message, Throwable cause) {
        super(message, cause);
    }
}
