package com.pairup.server.im.exception;

/**
 * A direct chat was requested between a user and themselves.
 */
public class SelfChatException extends MessagingException {

    public SelfChatException(long userId) {
        super(ErrorKind.SELF_CHAT, "cannot create direct chat with yourself (user " + userId + ")");
    }
}
