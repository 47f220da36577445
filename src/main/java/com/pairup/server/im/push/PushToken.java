package com.pairup.server.im.push;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PushToken {
    private long userId;
    private String token;
    private Platform platform;
    private String deviceId;
    private long lastSeenAt;
}
