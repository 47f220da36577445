package com.pairup.server.im.session;

public enum SessionState {
    CONNECTED,
    READING,
    CLOSED
}
