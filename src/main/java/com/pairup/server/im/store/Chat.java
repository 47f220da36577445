package com.pairup.server.im.store;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Chat {
    private String chatId;
    private String chatName; // null for direct chats until resolved for a viewer
    private Instant createdAt;
    private boolean group;
    private List<Long> participants = new ArrayList<>();
}
