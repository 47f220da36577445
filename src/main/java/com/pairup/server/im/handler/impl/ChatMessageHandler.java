package com.pairup.server.im.handler.impl;

import com.pairup.server.im.event.ChatMessageEvent;
import com.pairup.server.im.exception.MessagingException;
import com.pairup.server.im.handler.EventHandler;
import com.pairup.server.im.service.MessageResult;
import com.pairup.server.im.service.MessagingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class ChatMessageHandler implements EventHandler<ChatMessageEvent> {

    private static final Logger log = LoggerFactory.getLogger(ChatMessageHandler.class);

    private final MessagingService messagingService;

    public ChatMessageHandler(MessagingService messagingService) {
        this.messagingService = messagingService;
    }

    @Override
    public void handle(long userId, ChatMessageEvent event) {
        // sender_id is taken from the session, never from the frame
        try {
            MessageResult result = messagingService.sendMessage(userId, event.getChatId(), event.getMessageId(), event.getContent());
            if (!result.isDuplicate()) {
                log.debug("Message {} from user {} stored with seq {}", event.getMessageId(), userId, result.getMessage().getSeq());
            }
        } catch (MessagingException e) {
            log.warn("Chat message {} from user {} rejected ({}): {}", event.getMessageId(), userId, e.getKind(), e.getMessage());
        }
    }
}
