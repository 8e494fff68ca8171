package me.internalizable.quickplay.api.capability;

import javax.annotation.Nonnull;
import java.util.concurrent.CompletableFuture;

/**
 * Direct query of a single game server.
 *
 * <p>Implementations own the wire protocol. The returned future completes
 * exceptionally with a {@link ProbeException} on connection failure; the
 * caller applies its own time box on top.</p>
 */
public interface ServerProbe {

    /**
     * Probe a server.
     *
     * @param host server host
     * @param port server port
     * @return future completing with live descriptor fields
     */
    @Nonnull
    CompletableFuture<ProbeResult> probe(@Nonnull String host, int port);
}
