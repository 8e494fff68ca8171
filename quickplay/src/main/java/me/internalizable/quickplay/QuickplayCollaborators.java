package me.internalizable.quickplay;

import me.internalizable.quickplay.api.capability.GeoLocator;
import me.internalizable.quickplay.api.capability.SchemaDocumentSource;
import me.internalizable.quickplay.api.capability.ServerDirectory;
import me.internalizable.quickplay.api.capability.ServerProbe;
import me.internalizable.quickplay.api.capability.SnapshotConsumer;
import me.internalizable.quickplay.store.KeyValueStore;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * External capabilities the pipeline runs against.
 *
 * @param directory server directory listing
 * @param schemaSource schema document source
 * @param probe direct server probe
 * @param geoLocator geolocation
 * @param consumer downstream consumer, or null to only write local artifacts
 * @param store storage for bans, anycast networks, reputation and geo overrides
 */
public record QuickplayCollaborators(
        @Nonnull ServerDirectory directory,
        @Nonnull SchemaDocumentSource schemaSource,
        @Nonnull ServerProbe probe,
        @Nonnull GeoLocator geoLocator,
        @Nullable SnapshotConsumer consumer,
        @Nonnull KeyValueStore store
) {

    public QuickplayCollaborators {
        Objects.requireNonNull(directory, "directory");
        Objects.requireNonNull(schemaSource, "schemaSource");
        Objects.requireNonNull(probe, "probe");
        Objects.requireNonNull(geoLocator, "geoLocator");
        Objects.requireNonNull(store, "store");
    }
}
