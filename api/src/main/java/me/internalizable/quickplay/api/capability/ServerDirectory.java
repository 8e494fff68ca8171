package me.internalizable.quickplay.api.capability;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * Third-party directory of live dedicated servers.
 */
public interface ServerDirectory {

    /**
     * List servers matching a filter expression.
     *
     * @param filter opaque directory filter expression
     * @param limit maximum number of descriptors to return
     * @return server descriptors in directory order
     * @throws DirectoryException if the listing cannot be fetched
     */
    @Nonnull
    List<DirectoryServer> listServers(@Nonnull String filter, int limit) throws DirectoryException;
}
