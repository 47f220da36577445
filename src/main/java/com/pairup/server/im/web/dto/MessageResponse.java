package com.pairup.server.im.web.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.pairup.server.im.store.StoredMessage;
import lombok.Data;

@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class MessageResponse {
    private String messageId;
    private String chatId;
    private long senderId;
    private String content;
    private String sentAt;
    private long seq;

    public static MessageResponse from(StoredMessage message) {
        MessageResponse response = new MessageResponse();
        response.setMessageId(message.getMessageId());
        response.setChatId(message.getChatId());
        response.setSenderId(message.getSenderId());
        response.setContent(message.getContent());
        response.setSentAt(message.getSentAt().toString());
        response.setSeq(message.getSeq());
        return response;
    }
}
