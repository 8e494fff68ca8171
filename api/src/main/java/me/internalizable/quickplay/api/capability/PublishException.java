package me.internalizable.quickplay.api.capability;

/**
 * Thrown when the downstream consumer rejects a publication.
 */
public class PublishException extends CapabilityException {

    public PublishException(String message) {
        super(message);
    }

    public PublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
