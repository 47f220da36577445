package com.pairup.server.im.service;

import com.pairup.server.im.store.StoredMessage;

/**
 * A stored message and whether this submission created it or repeated an earlier one.
 */
public class MessageResult {

    private final StoredMessage message;
    private final boolean duplicate;

    private MessageResult(StoredMessage message, boolean duplicate) {
        this.message = message;
        this.duplicate = duplicate;
    }

    static MessageResult created(StoredMessage message) {
        return new MessageResult(message, false);
    }

    static MessageResult duplicate(StoredMessage original) {
        return new MessageResult(original, true);
    }

    public StoredMessage getMessage() {
        return message;
    }

    public boolean isDuplicate() {
        return duplicate;
    }
}
