package me.internalizable.quickplay.api.capability;

/**
 * Thrown when the schema document or its identity cannot be fetched.
 */
public class SchemaSourceException extends CapabilityException {

    public SchemaSourceException(String message) {
        super(message);
    }

    public SchemaSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
