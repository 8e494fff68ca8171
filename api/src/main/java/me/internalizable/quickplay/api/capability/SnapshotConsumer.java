package me.internalizable.quickplay.api.capability;

import me.internalizable.quickplay.api.snapshot.PublishedSchema;
import me.internalizable.quickplay.api.snapshot.PublishedSnapshot;

import javax.annotation.Nonnull;

/**
 * Downstream consumer of ranked snapshots and schema changes.
 */
public interface SnapshotConsumer {

    /**
     * Announce a ranked snapshot.
     *
     * @param snapshot the snapshot
     * @throws PublishException if the consumer rejects it
     */
    void publishSnapshot(@Nonnull PublishedSnapshot snapshot) throws PublishException;

    /**
     * Announce a changed map taxonomy.
     *
     * @param schema the schema
     * @throws PublishException if the consumer rejects it
     */
    void publishSchema(@Nonnull PublishedSchema schema) throws PublishException;
}
