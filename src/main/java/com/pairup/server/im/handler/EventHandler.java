package com.pairup.server.im.handler;

import com.pairup.server.im.event.ChatEvent;

public interface EventHandler<E extends ChatEvent> {
    /**
     * Handle an event sent by an authorized participant of its chat
     * @param userId sender of the frame
     * @param event decoded frame
     */
    void handle(long userId, E event);
}
