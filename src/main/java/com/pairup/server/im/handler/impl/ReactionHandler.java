package com.pairup.server.im.handler.impl;

import com.pairup.server.im.event.ReactionEvent;
import com.pairup.server.im.exception.MessagingException;
import com.pairup.server.im.handler.EventHandler;
import com.pairup.server.im.service.MessagingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class ReactionHandler implements EventHandler<ReactionEvent> {

    private static final Logger log = LoggerFactory.getLogger(ReactionHandler.class);

    private final MessagingService messagingService;

    public ReactionHandler(MessagingService messagingService) {
        this.messagingService = messagingService;
    }

    @Override
    public void handle(long userId, ReactionEvent event) {
        try {
            messagingService.addReaction(userId, event.getReactionId(), event.getMessageId(), event.getReactionCode());
        } catch (MessagingException e) {
            log.warn("Reaction {} from user {} rejected ({}): {}", event.getReactionId(), userId, e.getKind(), e.getMessage());
        }
    }
}
