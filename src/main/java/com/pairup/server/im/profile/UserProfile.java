package com.pairup.server.im.profile;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UserProfile {
    private long userId;
    private String displayName;
    private String avatarUrl; // may be null
}
