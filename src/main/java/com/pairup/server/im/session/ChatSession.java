package com.pairup.server.im.session;

import com.pairup.server.im.event.ChatEvent;
import com.pairup.server.im.event.EventCodec;
import com.pairup.server.im.exception.MalformedFrameException;
import com.pairup.server.im.exception.UnknownEventException;
import com.pairup.server.im.handler.EventRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicReference;

/**
 * One live client connection of an authenticated user.
 *
 * <p>
 * {@code CONNECTED -> READING -> CLOSED}. Frames are accepted only while {@code READING}; the
 * transport delivers them one at a time, so frames of one connection are routed in arrival
 * order. A frame that cannot be decoded or routed is logged and skipped, it never ends the
 * session. Only {@link #close()} does.
 * </p>
 */
public class ChatSession {

    private static final Logger log = LoggerFactory.getLogger(ChatSession.class);

    private final long userId;
    private final ClientConnection connection;
    private final PresenceRegistry presenceRegistry;
    private final EventCodec codec;
    private final EventRouter router;

    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.CONNECTED);

    public ChatSession(long userId, ClientConnection connection, PresenceRegistry presenceRegistry,
                       EventCodec codec, EventRouter router) {
        this.userId = userId;
        this.connection = connection;
        this.presenceRegistry = presenceRegistry;
        this.codec = codec;
        this.router = router;
    }

    public void open() {
        if (state.get() != SessionState.CONNECTED) {
            return;
        }
        presenceRegistry.register(userId, connection);
        if (!state.compareAndSet(SessionState.CONNECTED, SessionState.READING)) {
            // closed while registering
            presenceRegistry.unregister(userId, connection);
            return;
        }
        log.info("Session opened for user {} on connection {}", userId, connection.id());
    }

    public void onFrame(String text) {
        if (state.get() != SessionState.READING) {
            log.debug("Ignoring frame for user {} in state {}", userId, state.get());
            return;
        }

        ChatEvent event;
        try {
            event = codec.decode(text);
        } catch (UnknownEventException e) {
            log.warn("Unknown event type '{}' from user {}", e.getType(), userId);
            return;
        } catch (MalformedFrameException e) {
            log.warn("Malformed frame from user {}: {}", userId, e.getMessage());
            return;
        }

        try {
            router.route(userId, event);
        } catch (RuntimeException e) {
            log.error("Error handling {} from user {}", event.getType(), userId, e);
        }
    }

    public void close() {
        if (state.getAndSet(SessionState.CLOSED) == SessionState.CLOSED) {
            return;
        }
        presenceRegistry.unregister(userId, connection);
        connection.close();
        log.info("Session closed for user {} on connection {}", userId, connection.id());
    }

    public long getUserId() {
        return userId;
    }

    public SessionState getState() {
        return state.get();
    }

    public ClientConnection getConnection() {
        return connection;
    }
}
