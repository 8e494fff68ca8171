package me.internalizable.quickplay.api.capability;

/**
 * Thrown when a direct server probe fails or times out.
 */
public class ProbeException extends CapabilityException {

    public ProbeException(String message) {
        super(message);
    }

    public ProbeException(String message, Throwable cause) {
        super(message, cause);
    }
}
