package com.pairup.server.im.event;

import com.alibaba.fastjson.annotation.JSONField;
import lombok.Data;

/**
 * Common part of every real-time frame: the {@code type} discriminator and the chat it concerns.
 *
 * <p>
 * The set of variants is closed: constructors are package-private and every variant is handled
 * through {@link ChatEventVisitor}, so adding a kind of event forces every visitor to handle it.
 * </p>
 */
@Data
public abstract class ChatEvent {

    @JSONField(name = "type", ordinal = 0)
    private String type;

    @JSONField(name = "chat_id", ordinal = 1)
    private String chatId;

    ChatEvent(EventType eventType) {
        this.type = eventType.getWireName();
    }

    public abstract EventType eventType();

    public abstract <R> R accept(ChatEventVisitor<R> visitor);
}
