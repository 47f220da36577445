package com.pairup.server.im.event;

import com.alibaba.fastjson.annotation.JSONField;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Inbound: request to remove the sender's reactions with a code. Outbound: notice that they were removed.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class ReactionRemovedEvent extends ChatEvent {

    @JSONField(name = "message_id")
    private String messageId;

    @JSONField(name = "user_id")
    private Long userId;

    @JSONField(name = "reaction_code")
    private String reactionCode;

    @JSONField(name = "removed_at")
    private String removedAt;

    public ReactionRemovedEvent() {
        super(EventType.REMOVE_REACTION);
    }

    @Override
    public EventType eventType() {
        return EventType.REMOVE_REACTION;
    }

    @Override
    public <R> R accept(ChatEventVisitor<R> visitor) {
        return visitor.visitReactionRemoved(this);
    }
}
