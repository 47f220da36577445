package com.pairup.server.im.event;

import com.alibaba.fastjson.annotation.JSONField;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class TypingEvent extends ChatEvent {

    @JSONField(name = "user_id")
    private Long userId;

    @JSONField(name = "is_typing")
    private boolean typing;

    private String timestamp;

    public TypingEvent() {
        super(EventType.TYPING);
    }

    @Override
    public EventType eventType() {
        return EventType.TYPING;
    }

    @Override
    public <R> R accept(ChatEventVisitor<R> visitor) {
        return visitor.visitTyping(this);
    }
}
