package com.pairup.server.im.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.pairup.server.im.store.Chat;
import lombok.Data;

import java.util.List;

@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ChatResponse {
    private String chatId;
    private String chatName;
    private String createdAt;
    @JsonProperty("is_group")
    private boolean group;
    private List<Long> participants;

    public static ChatResponse from(Chat chat) {
        ChatResponse response = new ChatResponse();
        response.setChatId(chat.getChatId());
        response.setChatName(chat.getChatName());
        response.setCreatedAt(chat.getCreatedAt() == null ? null : chat.getCreatedAt().toString());
        response.setGroup(chat.isGroup());
        response.setParticipants(chat.getParticipants());
        return response;
    }
}
