package com.pairup.server.im.session;

import com.pairup.server.im.event.EventCodec;
import com.pairup.server.im.handler.EventRouter;
import org.springframework.stereotype.Component;

@Component
public class ChatSessionFactory {

    private final PresenceRegistry presenceRegistry;
    private final EventCodec codec;
    private final EventRouter router;

    public ChatSessionFactory(PresenceRegistry presenceRegistry, EventCodec codec, EventRouter router) {
        this.presenceRegistry = presenceRegistry;
        this.codec = codec;
        this.router = router;
    }

    public ChatSession create(long userId, ClientConnection connection) {
        return new ChatSession(userId, connection, presenceRegistry, codec, router);
    }
}
