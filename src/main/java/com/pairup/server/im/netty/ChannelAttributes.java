package com.pairup.server.im.netty;

import com.pairup.server.im.session.ChatSession;
import io.netty.util.AttributeKey;

public final class ChannelAttributes {

    public static final AttributeKey<Long> USER_ID = AttributeKey.valueOf("userId");
    public static final AttributeKey<ChatSession> SESSION = AttributeKey.valueOf("chatSession");

    private ChannelAttributes() {
    }
}
