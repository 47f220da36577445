package com.pairup.server.im.event;

import com.alibaba.fastjson.annotation.JSONField;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class ReactionEvent extends ChatEvent {

    @JSONField(name = "reaction_id")
    private String reactionId;

    @JSONField(name = "message_id")
    private String messageId;

    @JSONField(name = "user_id")
    private Long userId;

    @JSONField(name = "reaction_code")
    private String reactionCode;

    @JSONField(name = "reacted_at")
    private String reactedAt;

    public ReactionEvent() {
        super(EventType.REACTION);
    }

    @Override
    public EventType eventType() {
        return EventType.REACTION;
    }

    @Override
    public <R> R accept(ChatEventVisitor<R> visitor) {
        return visitor.visitReaction(this);
    }
}
