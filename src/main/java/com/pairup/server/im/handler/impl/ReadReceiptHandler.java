package com.pairup.server.im.handler.impl;

import com.pairup.server.im.event.ReadReceiptEvent;
import com.pairup.server.im.exception.MessagingException;
import com.pairup.server.im.handler.EventHandler;
import com.pairup.server.im.service.MessagingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class ReadReceiptHandler implements EventHandler<ReadReceiptEvent> {

    private static final Logger log = LoggerFactory.getLogger(ReadReceiptHandler.class);

    private final MessagingService messagingService;

    public ReadReceiptHandler(MessagingService messagingService) {
        this.messagingService = messagingService;
    }

    @Override
    public void handle(long userId, ReadReceiptEvent event) {
        try {
            messagingService.readReceipt(userId, event.getChatId(), event.getMessageId());
        } catch (MessagingException e) {
            log.warn("Read receipt of user {} for message {} rejected ({}): {}", userId, event.getMessageId(), e.getKind(), e.getMessage());
        }
    }
}
