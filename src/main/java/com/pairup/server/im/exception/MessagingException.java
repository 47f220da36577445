package com.pairup.server.im.exception;

/**
 * Base of every failure raised by the chat engine. The {@link ErrorKind} is what callers branch on.
 */
public class MessagingException extends RuntimeException {

    private final ErrorKind kind;

    public MessagingException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public MessagingException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
