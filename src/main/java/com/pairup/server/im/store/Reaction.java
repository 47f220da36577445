package com.pairup.server.im.store;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Reaction {
    private String reactionId;
    private String messageId;
    private long userId;
    private String reactionCode;
    private Instant reactedAt;
}
