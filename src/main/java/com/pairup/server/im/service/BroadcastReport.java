package com.pairup.server.im.service;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Outcome of one fan-out: who got the frame over a live connection, who had none.
 */
public class BroadcastReport {

    private final Set<Long> delivered = new LinkedHashSet<>();
    private final Set<Long> failed = new LinkedHashSet<>();
    private final Set<Long> offline = new LinkedHashSet<>();

    static BroadcastReport empty() {
        return new BroadcastReport();
    }

    void delivered(long userId) {
        delivered.add(userId);
    }

    void failed(long userId) {
        failed.add(userId);
    }

    void offline(long userId) {
        offline.add(userId);
    }

    public Set<Long> getDelivered() {
        return Collections.unmodifiableSet(delivered);
    }

    /** Online, but the frame could not be handed to the connection. */
    public Set<Long> getFailed() {
        return Collections.unmodifiableSet(failed);
    }

    public Set<Long> getOffline() {
        return Collections.unmodifiableSet(offline);
    }
}
