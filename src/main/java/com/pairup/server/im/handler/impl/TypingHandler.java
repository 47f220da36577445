package com.pairup.server.im.handler.impl;

import com.pairup.server.im.event.TypingEvent;
import com.pairup.server.im.exception.MessagingException;
import com.pairup.server.im.handler.EventHandler;
import com.pairup.server.im.service.MessagingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class TypingHandler implements EventHandler<TypingEvent> {

    private static final Logger log = LoggerFactory.getLogger(TypingHandler.class);

    private final MessagingService messagingService;

    public TypingHandler(MessagingService messagingService) {
        this.messagingService = messagingService;
    }

    @Override
    public void handle(long userId, TypingEvent event) {
        try {
            messagingService.typing(userId, event.getChatId(), event.isTyping());
        } catch (MessagingException e) {
            log.warn("Typing indicator from user {} in chat {} dropped ({})", userId, event.getChatId(), e.getKind());
        }
    }
}
