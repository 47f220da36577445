package com.pairup.server.im.store;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StoredMessage {
    private String messageId;
    private String chatId;
    private long senderId;
    private String content;
    private Instant sentAt;
    private long seq; // per-chat, assigned at insert
}
