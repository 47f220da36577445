package com.pairup.server.im.event;

import com.alibaba.fastjson.annotation.JSONField;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class ReadReceiptEvent extends ChatEvent {

    @JSONField(name = "user_id")
    private Long userId;

    @JSONField(name = "message_id")
    private String messageId;

    @JSONField(name = "read_at")
    private String readAt;

    public ReadReceiptEvent() {
        super(EventType.READ_RECEIPT);
    }

    @Override
    public EventType eventType() {
        return EventType.READ_RECEIPT;
    }

    @Override
    public <R> R accept(ChatEventVisitor<R> visitor) {
        return visitor.visitReadReceipt(this);
    }
}
