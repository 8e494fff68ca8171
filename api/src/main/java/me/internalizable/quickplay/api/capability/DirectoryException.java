package me.internalizable.quickplay.api.capability;

/**
 * Thrown when the server directory listing fails.
 */
public class DirectoryException extends CapabilityException {

    public DirectoryException(String message) {
        super(message);
    }

    public DirectoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
