package com.pairup.server.im.event;

import com.alibaba.fastjson.annotation.JSONField;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class ChatMessageEvent extends ChatEvent {

    @JSONField(name = "message_id")
    private String messageId; // client supplied, doubles as idempotency key

    @JSONField(name = "sender_id")
    private Long senderId; // stamped by the server

    private String content;

    @JSONField(name = "sent_at")
    private String sentAt; // server time, ISO-8601

    public ChatMessageEvent() {
        super(EventType.CHAT_MESSAGE);
    }

    @Override
    public EventType eventType() {
        return EventType.CHAT_MESSAGE;
    }

    @Override
    public <R> R accept(ChatEventVisitor<R> visitor) {
        return visitor.visitChatMessage(this);
    }
}
