package com.pairup.server.im.handler.impl;

import com.pairup.server.im.event.ReactionRemovedEvent;
import com.pairup.server.im.exception.MessagingException;
import com.pairup.server.im.handler.EventHandler;
import com.pairup.server.im.service.MessagingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class RemoveReactionHandler implements EventHandler<ReactionRemovedEvent> {

    private static final Logger log = LoggerFactory.getLogger(RemoveReactionHandler.class);

    private final MessagingService messagingService;

    public RemoveReactionHandler(MessagingService messagingService) {
        this.messagingService = messagingService;
    }

    @Override
    public void handle(long userId, ReactionRemovedEvent event) {
        try {
            int removed = messagingService.removeReaction(userId, event.getMessageId(), event.getReactionCode());
            log.debug("User {} removed {} '{}' reaction(s) from message {}", userId, removed, event.getReactionCode(), event.getMessageId());
        } catch (MessagingException e) {
            log.warn("Reaction removal on message {} by user {} rejected ({}): {}", event.getMessageId(), userId, e.getKind(), e.getMessage());
        }
    }
}
