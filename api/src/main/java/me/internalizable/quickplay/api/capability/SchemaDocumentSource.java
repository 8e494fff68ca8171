package me.internalizable.quickplay.api.capability;

import javax.annotation.Nonnull;
import java.util.OptionalLong;

/**
 * Versioned source of the game schema document.
 */
public interface SchemaDocumentSource {

    /**
     * Fetch the identity (URL) of the current schema document.
     *
     * <p>This is the cheap periodic check; the document is only
     * re-fetched when the identity changes.</p>
     *
     * @return document identity
     * @throws SchemaSourceException if the identity cannot be fetched
     */
    @Nonnull
    String fetchDocumentIdentity() throws SchemaSourceException;

    /**
     * Fetch the document behind an identity.
     *
     * @param identity document identity
     * @return raw document text
     * @throws SchemaSourceException if the document cannot be fetched
     */
    @Nonnull
    String fetchDocument(@Nonnull String identity) throws SchemaSourceException;

    /**
     * Fetch the minimum build version servers must run.
     *
     * @return the minimum version, or empty if not reported
     * @throws SchemaSourceException if the lookup fails
     */
    @Nonnull
    OptionalLong fetchMinimumVersion() throws SchemaSourceException;
}
