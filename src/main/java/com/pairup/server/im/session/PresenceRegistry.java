package com.pairup.server.im.session;

import java.util.Optional;
import java.util.Set;

/**
 * Which users currently hold a live connection, one connection per user.
 */
public interface PresenceRegistry {

    /**
     * Binds the user to the connection, replacing any previous binding. The replaced connection
     * is left open.
     */
    void register(long userId, ClientConnection connection);

    /**
     * Removes the user's binding, whatever connection it points to. No-op when absent.
     */
    void unregister(long userId);

    /**
     * Removes the binding only while it still points to {@code connection}.
     *
     * @return whether a binding was removed
     */
    boolean unregister(long userId, ClientConnection connection);

    Optional<ClientConnection> lookup(long userId);

    Set<Long> snapshot();
}
