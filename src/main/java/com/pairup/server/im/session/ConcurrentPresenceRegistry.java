package com.pairup.server.im.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Lock-free reads for broadcast fan-out; writes only come from session open/close.
 */
@Component
public class ConcurrentPresenceRegistry implements PresenceRegistry {

    private static final Logger log = LoggerFactory.getLogger(ConcurrentPresenceRegistry.class);

    // UserId -> Connection
    private final ConcurrentHashMap<Long, ClientConnection> connections = new ConcurrentHashMap<>();

    @Override
    public void register(long userId, ClientConnection connection) {
        if (connection == null) {
            log.error("Register failed: connection cannot be null. uid={}", userId);
            return;
        }
        ClientConnection previous = connections.put(userId, connection);
        if (previous != null && previous != connection) {
            log.info("User {} reconnected, connection {} replaces {}", userId, connection.id(), previous.id());
        } else {
            log.info("Registered user: {}, connection: {}", userId, connection.id());
        }
    }

    @Override
    public void unregister(long userId) {
        ClientConnection removed = connections.remove(userId);
        if (removed != null) {
            log.info("Unregistered user: {}, connection: {}", userId, removed.id());
        }
    }

    @Override
    public boolean unregister(long userId, ClientConnection connection) {
        // Only remove if it's the same connection (handling reconnections)
        boolean removed = connection != null && connections.remove(userId, connection);
        if (removed) {
            log.info("Unregistered user: {}, connection: {}", userId, connection.id());
        }
        return removed;
    }

    @Override
    public Optional<ClientConnection> lookup(long userId) {
        return Optional.ofNullable(connections.get(userId));
    }

    @Override
    public Set<Long> snapshot() {
        return Set.copyOf(connections.keySet());
    }
}
